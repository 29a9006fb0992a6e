/*
 * どこで: Lobby ランタイム (外部協調者)
 * 何を: プロセス起動と空きポート確保を抽象化する
 * なぜ: SessionLauncher だけが副作用のある起動を行い、テストでは偽実装に差し替えるため
 */
package com.example.lobby.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public interface ProcessHost {

  /** 役割: command を workingDirectory で起動する。 動作: 実行ファイルが無い等は IOException を送出する。 */
  GameProcess spawn(List<String> command, Path workingDirectory) throws IOException;

  /** 役割: bindHost 上で現在空いている TCP ポートを返す。 */
  int freePort(String bindHost) throws IOException;

  /**
   * 役割: 起動したプロセスがポートで接続を受け付けるまで待つ。
   * 動作: timeout 内に接続できれば true、プロセス終了またはタイムアウトなら false を返す。
   */
  boolean awaitReady(GameProcess process, String host, int port, Duration timeout)
      throws InterruptedException;
}
