package com.example.lobby.api.response;

import com.example.lobby.model.GameManifest;
import com.example.lobby.model.VersionRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VersionResponse(
    String versionId,
    String gameId,
    String version,
    String notes,
    String entry,
    String serverEntry,
    int minPlayers,
    int maxPlayers,
    String uploadedAt) {

  public static VersionResponse from(VersionRecord version) {
    final GameManifest manifest = version.manifest();
    return new VersionResponse(
        version.versionId(),
        version.gameId(),
        version.label(),
        version.notes(),
        manifest.entry(),
        manifest.serverEntry(),
        manifest.minPlayers(),
        manifest.maxPlayers(),
        version.uploadedAt().toString());
  }
}
