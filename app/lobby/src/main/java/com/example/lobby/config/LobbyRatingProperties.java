package com.example.lobby.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lobby.rating")
public record LobbyRatingProperties(int minScore, int maxScore, int maxCommentLength) {}
