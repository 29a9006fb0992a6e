package com.example.lobby.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "ダウンロード応答へそのまま書き出す一時的な値でコピーは不要なため")
public record VersionDownload(VersionRecord version, byte[] content) {}
