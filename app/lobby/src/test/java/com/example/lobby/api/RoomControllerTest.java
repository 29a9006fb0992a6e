package com.example.lobby.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.lobby.model.ConnectionInfo;
import com.example.lobby.model.GameManifest;
import com.example.lobby.model.LaunchResult;
import com.example.lobby.model.RoomRecord;
import com.example.lobby.model.VersionRecord;
import com.example.lobby.service.RoomService;
import com.example.lobby.service.SessionLauncher;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RoomController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class RoomControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final VersionRecord V1 =
      new VersionRecord(
          "vid-1", "chess", "v1", "vid-1.zip", new GameManifest("client.py", null, 2, 2), null, NOW);

  @Autowired private MockMvc mockMvc;

  @MockitoBean private RoomService roomService;
  @MockitoBean private SessionLauncher sessionLauncher;

  @Test
  void createRoomReturns201() throws Exception {
    when(roomService.createRoom("alice", "chess", null))
        .thenReturn(RoomRecord.waiting("1", V1, "alice", NOW));

    mockMvc
        .perform(
            post("/v1/rooms")
                .header("X-User-Id", "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"game_id\":\"chess\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.room_id").value("1"))
        .andExpect(jsonPath("$.status").value("WAITING"))
        .andExpect(jsonPath("$.players[0]").value("alice"))
        .andExpect(jsonPath("$.max_players").value(2));
  }

  @Test
  void joinFullRoomReturns409() throws Exception {
    when(roomService.joinRoom("1", "carol"))
        .thenThrow(new LobbyConflictException(ApiErrorCode.ROOM_FULL, "1", "room is full: 1"));

    mockMvc
        .perform(post("/v1/rooms/1/join").header("X-User-Id", "carol"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ROOM_FULL"))
        .andExpect(jsonPath("$.entity_id").value("1"));
  }

  @Test
  void heartbeatReturnsRoom() throws Exception {
    when(roomService.heartbeat("1", "alice")).thenReturn(RoomRecord.waiting("1", V1, "alice", NOW));

    mockMvc
        .perform(post("/v1/rooms/1/heartbeat").header("X-User-Id", "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.room_id").value("1"))
        .andExpect(jsonPath("$.status").value("WAITING"));
  }

  @Test
  void heartbeatOnClosedRoomReturns409() throws Exception {
    when(roomService.heartbeat("1", "alice"))
        .thenThrow(new LobbyConflictException(ApiErrorCode.ROOM_CLOSED, "1", "room is closed: 1"));

    mockMvc
        .perform(post("/v1/rooms/1/heartbeat").header("X-User-Id", "alice"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ROOM_CLOSED"));
  }

  @Test
  void startReturnsEntryAndConnection() throws Exception {
    when(sessionLauncher.start("1", "alice"))
        .thenReturn(
            new LaunchResult("1", "chess", "v1", "client.py", new ConnectionInfo("lobby.example.net", 41001)));

    mockMvc
        .perform(post("/v1/rooms/1/start").header("X-User-Id", "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.entry").value("client.py"))
        .andExpect(jsonPath("$.connection.host").value("lobby.example.net"))
        .andExpect(jsonPath("$.connection.port").value(41001));
  }

  @Test
  void startFailureReturns503() throws Exception {
    when(sessionLauncher.start("1", "alice"))
        .thenThrow(LobbyResourceException.launchFailed("1", "no interpreter", null));

    mockMvc
        .perform(post("/v1/rooms/1/start").header("X-User-Id", "alice"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("LAUNCH_FAILED"));
  }

  @Test
  void closeByNonHostReturns403() throws Exception {
    when(roomService.closeRoom("1", "bob"))
        .thenThrow(LobbyAccessDeniedException.notAuthorized("1", "bob"));

    mockMvc
        .perform(post("/v1/rooms/1/close").header("X-User-Id", "bob"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_AUTHORIZED"));
  }

  @Test
  void leaveReturnsUpdatedRoom() throws Exception {
    when(roomService.leaveRoom("1", "bob"))
        .thenReturn(RoomRecord.waiting("1", V1, "alice", NOW));

    mockMvc
        .perform(post("/v1/rooms/1/leave").header("X-User-Id", "bob"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.players.length()").value(1));
  }

  @Test
  void listAndGetRooms() throws Exception {
    final RoomRecord room = RoomRecord.waiting("1", V1, "alice", NOW);
    when(roomService.listOpenRooms()).thenReturn(List.of(room));
    when(roomService.getRoom("1")).thenReturn(room);
    when(roomService.getRoom("9")).thenThrow(LobbyNotFoundException.room("9"));

    mockMvc.perform(get("/v1/rooms")).andExpect(jsonPath("$[0].version").value("v1"));
    mockMvc.perform(get("/v1/rooms/1")).andExpect(jsonPath("$.host_player_id").value("alice"));
    mockMvc
        .perform(get("/v1/rooms/9"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ROOM_NOT_FOUND"));
  }
}
