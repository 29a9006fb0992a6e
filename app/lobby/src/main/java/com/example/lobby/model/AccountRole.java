package com.example.lobby.model;

public enum AccountRole {
  DEVELOPER,
  PLAYER
}
