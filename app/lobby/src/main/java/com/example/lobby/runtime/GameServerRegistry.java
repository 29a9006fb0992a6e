/*
 * どこで: Lobby ランタイム
 * 何を: ルーム ID ごとに起動中の game server (プロセス/作業ディレクトリ) を保持する
 * なぜ: ルーム終了時の停止と、終了通知が現在のプロセスからのものかの判定に使うため
 */
package com.example.lobby.runtime;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

@Component
public class GameServerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(GameServerRegistry.class);

  private final ConcurrentMap<String, RunningGameServer> servers = new ConcurrentHashMap<>();

  public void register(RunningGameServer server) {
    servers.put(server.roomId(), server);
  }

  public Optional<RunningGameServer> find(String roomId) {
    return Optional.ofNullable(servers.get(roomId));
  }

  public boolean isCurrent(String roomId, GameProcess process) {
    final RunningGameServer server = servers.get(roomId);
    return server != null && server.process() == process;
  }

  /** 役割: 登録を外してプロセスを停止し、作業ディレクトリを削除する。 動作: 未登録なら何もしない。 */
  public void stop(String roomId) {
    final RunningGameServer server = servers.remove(roomId);
    if (server == null) {
      return;
    }
    server.process().terminate();
    try {
      FileSystemUtils.deleteRecursively(server.workingDirectory());
    } catch (IOException ex) {
      // プロセス停止は完了しているため、削除失敗はルーム終了を妨げない。
      logger.warn(
          "failed to delete game server directory roomId={} dir={}",
          roomId,
          server.workingDirectory(),
          ex);
    }
  }

  public int runningCount() {
    return servers.size();
  }
}
