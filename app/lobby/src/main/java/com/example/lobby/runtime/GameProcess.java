/*
 * どこで: Lobby ランタイム
 * 何を: 起動済み game server プロセスのハンドルを抽象化する
 * なぜ: テストで実プロセスを起動せずにランチャーの分岐を検証するため
 */
package com.example.lobby.runtime;

import java.util.concurrent.CompletableFuture;

public interface GameProcess {

  long pid();

  boolean isAlive();

  /** 役割: プロセスを終了させる。 動作: 既に終了していれば何もしない。 */
  void terminate();

  /** 役割: プロセス終了時に終了コードで完了する future を返す。 */
  CompletableFuture<Integer> onExit();
}
