package com.example.lobby.model;

public record GameMetadata(String name, String description, String gameType) {}
