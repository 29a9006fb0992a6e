package com.example.lobby.model;

public record ConnectionInfo(String host, int port) {}
