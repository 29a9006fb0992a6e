package com.example.lobby.model;

import java.time.Instant;

public record AccountRecord(String accountId, AccountRole role, Instant firstSeenAt, Instant lastSeenAt) {

  public AccountRecord seenAt(Instant at) {
    return new AccountRecord(accountId, role, firstSeenAt, at);
  }
}
