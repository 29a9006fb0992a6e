package com.example.lobby.model;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/** バージョンのアーカイブに含まれるファイルごとの SHA-256。キーはアーカイブ内の相対パス。 */
public record VersionIntegrity(String gameId, String version, SortedMap<String, String> files) {

  public VersionIntegrity {
    files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
  }
}
