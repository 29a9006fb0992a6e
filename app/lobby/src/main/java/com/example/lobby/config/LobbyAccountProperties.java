package com.example.lobby.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lobby.accounts")
public record LobbyAccountProperties(Duration onlineTimeout) {}
