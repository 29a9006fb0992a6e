/*
 * どこで: Lobby API
 * 何を: ルーム (作成/参加/退出/heartbeat/開始/終了/一覧) のエンドポイントを公開する
 * なぜ: プレイヤーがルームを介してゲームを起動する入口を提供するため
 */
package com.example.lobby.api;

import com.example.lobby.api.request.CreateRoomRequest;
import com.example.lobby.api.response.LaunchResponse;
import com.example.lobby.api.response.RoomResponse;
import com.example.lobby.service.RoomService;
import com.example.lobby.service.SessionLauncher;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/rooms")
@RequiredArgsConstructor
public class RoomController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final RoomService roomService;
  private final SessionLauncher sessionLauncher;

  @PostMapping
  public ResponseEntity<RoomResponse> createRoom(
      @RequestHeader(HEADER_USER_ID) String playerId,
      @Valid @RequestBody CreateRoomRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            RoomResponse.from(
                roomService.createRoom(playerId, request.gameId(), request.version())));
  }

  @GetMapping
  public ResponseEntity<List<RoomResponse>> listRooms() {
    return ResponseEntity.ok(roomService.listOpenRooms().stream().map(RoomResponse::from).toList());
  }

  @GetMapping("/{roomId}")
  public ResponseEntity<RoomResponse> getRoom(@PathVariable("roomId") String roomId) {
    return ResponseEntity.ok(RoomResponse.from(roomService.getRoom(roomId)));
  }

  @PostMapping("/{roomId}/join")
  public ResponseEntity<RoomResponse> joinRoom(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String playerId) {
    return ResponseEntity.ok(RoomResponse.from(roomService.joinRoom(roomId, playerId)));
  }

  @PostMapping("/{roomId}/leave")
  public ResponseEntity<RoomResponse> leaveRoom(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String playerId) {
    return ResponseEntity.ok(RoomResponse.from(roomService.leaveRoom(roomId, playerId)));
  }

  @PostMapping("/{roomId}/heartbeat")
  public ResponseEntity<RoomResponse> heartbeat(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String playerId) {
    return ResponseEntity.ok(RoomResponse.from(roomService.heartbeat(roomId, playerId)));
  }

  @PostMapping("/{roomId}/start")
  public ResponseEntity<LaunchResponse> startRoom(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String playerId) {
    return ResponseEntity.ok(LaunchResponse.from(sessionLauncher.start(roomId, playerId)));
  }

  @PostMapping("/{roomId}/close")
  public ResponseEntity<RoomResponse> closeRoom(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String playerId) {
    return ResponseEntity.ok(RoomResponse.from(roomService.closeRoom(roomId, playerId)));
  }
}
