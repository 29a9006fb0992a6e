package com.example.lobby.runtime;

import java.nio.file.Path;

public record RunningGameServer(
    String roomId, GameProcess process, Path workingDirectory, int port) {}
