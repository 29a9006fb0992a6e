package com.example.lobby.model;

import java.time.Instant;

public record RatingRecord(
    String playerId, String gameId, int score, String comment, Instant ratedAt) {}
