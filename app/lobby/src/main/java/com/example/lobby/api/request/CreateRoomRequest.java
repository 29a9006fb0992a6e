package com.example.lobby.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** version を省略するとその時点の最新バージョンでルームを作る。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateRoomRequest(@NotBlank String gameId, String version) {}
