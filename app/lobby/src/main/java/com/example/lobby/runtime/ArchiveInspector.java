/*
 * どこで: Lobby ランタイム
 * 何を: zip アーカイブのファイル一覧と、ファイルごとの SHA-256 を読み取る
 * なぜ: 取り込み時に manifest の参照先が実在するかを確かめ、配布物の改ざん検証用の値を返すため
 */
package com.example.lobby.runtime;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import org.springframework.stereotype.Component;

@Component
public class ArchiveInspector {

  private static final Set<String> IGNORED_ROOTS = Set.of("__MACOSX", ".git", ".idea", ".vscode");
  private static final Set<String> IGNORED_FILES = Set.of(".DS_Store", "Thumbs.db");
  private static final int BUFFER_SIZE = 8192;

  /**
   * 役割: アーカイブ内のファイル (ディレクトリを除く) の正規化パスを返す。
   * 動作: zip として読めない、またはファイルを 1 つも含まない場合は ZipException を送出する。
   */
  public Set<String> fileNames(byte[] content) throws IOException {
    final Set<String> names = new LinkedHashSet<>();
    try (ZipInputStream zip = open(content)) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        final String name = normalizePath(entry.getName());
        if (!entry.isDirectory() && !name.isEmpty()) {
          names.add(name);
        }
        zip.closeEntry();
      }
    }
    if (names.isEmpty()) {
      throw new ZipException("archive is not a zip or contains no files");
    }
    return names;
  }

  /**
   * 役割: ファイルごとの SHA-256 (小文字 16 進) をパス順で返す。
   * 動作: OS やエディタ、Python キャッシュが生成するファイルは対象外。
   */
  public SortedMap<String, String> fileDigests(byte[] content) throws IOException {
    final SortedMap<String, String> digests = new TreeMap<>();
    boolean sawEntry = false;
    try (ZipInputStream zip = open(content)) {
      ZipEntry entry;
      final byte[] buffer = new byte[BUFFER_SIZE];
      while ((entry = zip.getNextEntry()) != null) {
        sawEntry = true;
        final String name = normalizePath(entry.getName());
        if (entry.isDirectory() || isIgnored(name)) {
          zip.closeEntry();
          continue;
        }
        final MessageDigest digest = sha256();
        int read;
        while ((read = zip.read(buffer)) != -1) {
          digest.update(buffer, 0, read);
        }
        digests.put(name, toHex(digest.digest()));
        zip.closeEntry();
      }
    }
    if (!sawEntry) {
      throw new ZipException("archive is not a zip or is empty");
    }
    return digests;
  }

  /** パス区切りを '/' に揃え、先頭の "./" と "/" を外す。 */
  public static String normalizePath(String raw) {
    if (raw == null) {
      return "";
    }
    String path = raw.strip().replace('\\', '/');
    while (path.startsWith("./")) {
      path = path.substring(2);
    }
    while (path.startsWith("/")) {
      path = path.substring(1);
    }
    return path;
  }

  static boolean isIgnored(String name) {
    final List<String> parts =
        Arrays.stream(name.split("/")).filter(part -> !part.isEmpty()).toList();
    if (parts.isEmpty()) {
      return true;
    }
    if (IGNORED_ROOTS.contains(parts.get(0)) || parts.contains("__pycache__")) {
      return true;
    }
    final String base = parts.get(parts.size() - 1);
    return IGNORED_FILES.contains(base) || base.endsWith(".pyc") || base.endsWith(".pyo");
  }

  private ZipInputStream open(byte[] content) {
    return new ZipInputStream(new ByteArrayInputStream(content == null ? new byte[0] : content));
  }

  private MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
