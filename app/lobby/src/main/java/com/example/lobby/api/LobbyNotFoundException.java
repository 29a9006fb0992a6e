package com.example.lobby.api;

public class LobbyNotFoundException extends LobbyException {

  public LobbyNotFoundException(ApiErrorCode code, String entityId) {
    super(code, entityId, describe(code) + ": " + entityId);
  }

  public static LobbyNotFoundException game(String gameId) {
    return new LobbyNotFoundException(ApiErrorCode.GAME_NOT_FOUND, gameId);
  }

  public static LobbyNotFoundException version(String gameId, String label) {
    return new LobbyNotFoundException(ApiErrorCode.VERSION_NOT_FOUND, gameId + "@" + label);
  }

  public static LobbyNotFoundException room(String roomId) {
    return new LobbyNotFoundException(ApiErrorCode.ROOM_NOT_FOUND, roomId);
  }

  private static String describe(ApiErrorCode code) {
    return switch (code) {
      case GAME_NOT_FOUND -> "game not found";
      case VERSION_NOT_FOUND -> "version not found";
      case ROOM_NOT_FOUND -> "room not found";
      default -> "not found";
    };
  }
}
