package com.example.lobby.api;

import com.example.lobby.api.response.PlayRecordResponse;
import com.example.lobby.api.response.PlayerResponse;
import com.example.lobby.model.AccountRole;
import com.example.lobby.service.AccountDirectory;
import com.example.lobby.service.PlayEligibilityTracker;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/players")
@RequiredArgsConstructor
public class PlayerController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final AccountDirectory accountDirectory;
  private final PlayEligibilityTracker playEligibilityTracker;

  @GetMapping
  public ResponseEntity<List<PlayerResponse>> listPlayers(
      @RequestHeader(HEADER_USER_ID) String playerId) {
    accountDirectory.touch(playerId, AccountRole.PLAYER);
    return ResponseEntity.ok(
        accountDirectory.listPlayers().stream()
            .map(
                account ->
                    new PlayerResponse(
                        account.accountId(),
                        accountDirectory.isOnline(account),
                        account.lastSeenAt().toString()))
            .toList());
  }

  @GetMapping("/me/plays")
  public ResponseEntity<List<PlayRecordResponse>> myPlays(
      @RequestHeader(HEADER_USER_ID) String playerId) {
    accountDirectory.touch(playerId, AccountRole.PLAYER);
    return ResponseEntity.ok(
        playEligibilityTracker.playsOf(playerId).stream().map(PlayRecordResponse::from).toList());
  }
}
