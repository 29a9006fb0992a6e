/*
 * どこで: Lobby サービス層
 * 何を: WAITING ルームを RUNNING へ遷移させ、必要なら game server を起動する
 * なぜ: 起動の成否と状態遷移/評価資格付与を 1 つのクリティカルセクションで一致させるため
 */
package com.example.lobby.service;

import com.example.lobby.api.ApiErrorCode;
import com.example.lobby.api.LobbyAccessDeniedException;
import com.example.lobby.api.LobbyConflictException;
import com.example.lobby.api.LobbyNotFoundException;
import com.example.lobby.api.LobbyResourceException;
import com.example.lobby.config.LobbyLauncherProperties;
import com.example.lobby.model.AccountRole;
import com.example.lobby.model.ConnectionInfo;
import com.example.lobby.model.GameManifest;
import com.example.lobby.model.LaunchResult;
import com.example.lobby.model.RoomRecord;
import com.example.lobby.model.RoomStatus;
import com.example.lobby.repository.RoomRepository;
import com.example.lobby.runtime.BlobStore;
import com.example.lobby.runtime.GameProcess;
import com.example.lobby.runtime.GameServerRegistry;
import com.example.lobby.runtime.ProcessHost;
import com.example.lobby.runtime.RunningGameServer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

@Service
@RequiredArgsConstructor
public class SessionLauncher {

  private static final Logger logger = LoggerFactory.getLogger(SessionLauncher.class);

  private final RoomRepository roomRepository;
  private final RoomService roomService;
  private final PlayEligibilityTracker playEligibilityTracker;
  private final BlobStore blobStore;
  private final ProcessHost processHost;
  private final GameServerRegistry gameServerRegistry;
  private final RoomEventNotifier roomEventNotifier;
  private final AccountDirectory accountDirectory;
  private final LobbyLauncherProperties properties;
  private final LobbyMetrics metrics;
  private final EntityLocks entityLocks;
  private final Clock clock;

  /**
   * 役割: ルームを開始する。
   * 動作: 名簿メンバーなら誰でも開始できる。server_entry があれば展開/起動/待機まで行い、失敗時はプロセスと作業ディレクトリを片付けて
   * WAITING のまま LAUNCH_FAILED を返す。成功時のみ RUNNING へ遷移し、名簿全員の起動記録を進める。
   * 前提: 起動処理の間はルーム単位のロックを保持し続ける。
   */
  public LaunchResult start(String roomId, String requesterId) {
    accountDirectory.touch(requesterId, AccountRole.PLAYER);
    return entityLocks.withLock(
        EntityLocks.SCOPE_ROOM, roomId, () -> startLocked(roomId, requesterId));
  }

  private LaunchResult startLocked(String roomId, String requesterId) {
    final RoomRecord room =
        roomRepository.findById(roomId).orElseThrow(() -> LobbyNotFoundException.room(roomId));
    if (!room.hasMember(requesterId)) {
      throw LobbyAccessDeniedException.notAuthorized(roomId, requesterId);
    }
    if (room.status() != RoomStatus.WAITING) {
      throw new LobbyConflictException(
          ApiErrorCode.ROOM_NOT_WAITING, roomId, "room is " + room.status() + ": " + roomId);
    }
    final GameManifest manifest = room.manifest();
    if (!manifest.admits(room.roster().size())) {
      throw new LobbyConflictException(
          ApiErrorCode.INSUFFICIENT_PLAYERS,
          roomId,
          "need at least " + manifest.minPlayers() + " players, have " + room.roster().size());
    }

    final Instant startedAt = Instant.now(clock);
    final RunningGameServer server = manifest.hasServerEntry() ? launchServer(room) : null;
    final ConnectionInfo connection =
        server == null ? null : new ConnectionInfo(properties.publicHost(), server.port());

    final RoomRecord running = room.running(connection, startedAt);
    roomRepository.save(running);
    if (server != null) {
      gameServerRegistry.register(server);
      final GameProcess process = server.process();
      process
          .onExit()
          .thenAcceptAsync(exitCode -> roomService.closeOnProcessExit(roomId, process, exitCode));
    }
    for (String playerId : running.roster()) {
      playEligibilityTracker.markStarted(playerId, running.gameId());
    }

    metrics.recordRoomTransition("started");
    metrics.recordLaunch(server == null ? "client_only" : "started");
    metrics.recordLaunchDuration(Duration.between(startedAt, Instant.now(clock)));
    roomService.refreshOpenRoomGauge();
    logger.info(
        "room started roomId={} gameId={} version={} players={} port={}",
        roomId,
        running.gameId(),
        running.version().label(),
        running.roster().size(),
        server == null ? "-" : server.port());
    roomEventNotifier.roomStarted(running);
    return new LaunchResult(
        roomId, running.gameId(), running.version().label(), manifest.entry(), connection);
  }

  private RunningGameServer launchServer(RoomRecord room) {
    final String roomId = room.roomId();
    final Path workDir = properties.workRoot().resolve("room-" + roomId);
    GameProcess process = null;
    try {
      final int port = processHost.freePort(properties.bindHost());
      blobStore.unpack(blobStore.fetch(room.version().blobRef()), workDir);
      final Path serverEntry = workDir.resolve(room.manifest().serverEntry()).normalize();
      if (!Files.isRegularFile(serverEntry)) {
        throw new IOException("server entry is missing: " + room.manifest().serverEntry());
      }
      process = processHost.spawn(command(serverEntry, roomId, port), workDir);
      if (!processHost.awaitReady(process, readyHost(), port, properties.readyTimeout())) {
        throw new IOException("game server did not become ready on port " + port);
      }
      return new RunningGameServer(roomId, process, workDir, port);
    } catch (IOException ex) {
      rollback(roomId, process, workDir);
      throw LobbyResourceException.launchFailed(roomId, ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      rollback(roomId, process, workDir);
      throw LobbyResourceException.launchFailed(roomId, "interrupted", ex);
    }
  }

  private List<String> command(Path serverEntry, String roomId, int port) {
    final List<String> command = new ArrayList<>();
    if (properties.interpreter() != null && !properties.interpreter().isBlank()) {
      command.addAll(Arrays.asList(properties.interpreter().strip().split("\\s+")));
    }
    command.add(serverEntry.toString());
    command.add("--room");
    command.add(roomId);
    command.add("--port");
    command.add(Integer.toString(port));
    return command;
  }

  private String readyHost() {
    final String bindHost = properties.bindHost();
    return "0.0.0.0".equals(bindHost) ? "127.0.0.1" : bindHost;
  }

  private void rollback(String roomId, GameProcess process, Path workDir) {
    metrics.recordLaunch("failed");
    if (process != null) {
      process.terminate();
    }
    try {
      FileSystemUtils.deleteRecursively(workDir);
    } catch (IOException ex) {
      logger.warn("failed to clean launch directory roomId={} dir={}", roomId, workDir, ex);
    }
    logger.warn("room launch rolled back roomId={}", roomId);
  }
}
