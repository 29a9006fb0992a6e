package com.example.lobby.api.response;

import com.example.lobby.model.ConnectionInfo;

public record ConnectionResponse(String host, int port) {

  public static ConnectionResponse from(ConnectionInfo connection) {
    return connection == null ? null : new ConnectionResponse(connection.host(), connection.port());
  }
}
