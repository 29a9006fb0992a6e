/*
 * どこで: Lobby ランタイム (外部協調者)
 * 何を: バージョン本体 (アーカイブ) の保存/取得/展開を抽象化する
 * なぜ: アーカイブ形式の詳細をカタログとランチャーから隠すため
 */
package com.example.lobby.runtime;

import java.io.IOException;
import java.nio.file.Path;

public interface BlobStore {

  /** 役割: アーカイブを保存し、以後の取得に使う参照を返す。 前提: versionId はバージョンごとに一意であること。 */
  String store(String versionId, byte[] content) throws IOException;

  /** 役割: 参照からアーカイブのバイト列を取得する。 動作: 見つからなければ NoSuchFileException を送出する。 */
  byte[] fetch(String blobRef) throws IOException;

  /** 役割: アーカイブを targetDir 以下へ展開する。 動作: targetDir の外へ出るエントリは拒否する。 */
  void unpack(byte[] content, Path targetDir) throws IOException;
}
