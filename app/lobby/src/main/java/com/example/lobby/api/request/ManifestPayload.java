package com.example.lobby.api.request;

import com.example.lobby.model.GameManifest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ManifestPayload(
    @NotBlank String entry,
    String serverEntry,
    @NotNull Integer minPlayers,
    @NotNull Integer maxPlayers) {

  public GameManifest toManifest() {
    return new GameManifest(entry, serverEntry, minPlayers, maxPlayers);
  }
}
