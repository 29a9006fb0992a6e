package com.example.lobby.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.lobby.model.GameManifest;
import com.example.lobby.model.GameMetadata;
import com.example.lobby.model.GameRecord;
import com.example.lobby.model.ListingState;
import com.example.lobby.model.VersionDownload;
import com.example.lobby.model.VersionIntegrity;
import com.example.lobby.model.VersionRecord;
import com.example.lobby.service.CatalogService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CatalogController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class CatalogControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final VersionRecord V1 =
      new VersionRecord(
          "vid-1", "chess", "v1", "vid-1.zip", new GameManifest("client.py", "server.py", 2, 2), "first", NOW);

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CatalogService catalogService;

  @Test
  void createGameReturns201() throws Exception {
    when(catalogService.createGame(eq("dev-1"), any(GameMetadata.class)))
        .thenReturn(game(List.of()));

    mockMvc
        .perform(
            post("/v1/games")
                .header("X-User-Id", "dev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"Chess","description":"classic","game_type":"board"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.game_id").value("chess"))
        .andExpect(jsonPath("$.listing_state").value("LISTED"));
  }

  @Test
  void createGameReturns400WithoutName() throws Exception {
    mockMvc
        .perform(
            post("/v1/games")
                .header("X-User-Id", "dev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"x\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void createGameReturns400WithoutUserHeader() throws Exception {
    mockMvc
        .perform(
            post("/v1/games").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"Chess\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("X-User-Id is required"));
  }

  @Test
  void addVersionDecodesArchiveAndReturns201() throws Exception {
    when(catalogService.addVersion(
            eq("chess"), eq("dev-1"), eq("v1"), any(byte[].class), any(GameManifest.class), eq("first")))
        .thenReturn(V1);

    mockMvc
        .perform(
            post("/v1/games/chess/versions")
                .header("X-User-Id", "dev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"version":"v1","notes":"first","file_data":"UEsDBA==",
                     "manifest":{"entry":"client.py","server_entry":"server.py",
                                 "min_players":2,"max_players":2}}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.version").value("v1"))
        .andExpect(jsonPath("$.server_entry").value("server.py"));

    verify(catalogService)
        .addVersion(
            eq("chess"),
            eq("dev-1"),
            eq("v1"),
            eq(new byte[] {0x50, 0x4b, 0x03, 0x04}),
            eq(new GameManifest("client.py", "server.py", 2, 2)),
            eq("first"));
  }

  @Test
  void addVersionRejectsInvalidBase64() throws Exception {
    mockMvc
        .perform(
            post("/v1/games/chess/versions")
                .header("X-User-Id", "dev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"version":"v1","file_data":"***",
                     "manifest":{"entry":"client.py","min_players":1,"max_players":2}}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void addVersionMapsDuplicateTo409() throws Exception {
    when(catalogService.addVersion(any(), any(), any(), any(), any(), any()))
        .thenThrow(
            new LobbyConflictException(ApiErrorCode.DUPLICATE_VERSION, "chess@v1", "version already exists: v1"));

    mockMvc
        .perform(
            post("/v1/games/chess/versions")
                .header("X-User-Id", "dev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"version":"v1","file_data":"UEsDBA==",
                     "manifest":{"entry":"client.py","min_players":1,"max_players":2}}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DUPLICATE_VERSION"))
        .andExpect(jsonPath("$.entity_id").value("chess@v1"));
  }

  @Test
  void getGameReturnsLatestVersion() throws Exception {
    when(catalogService.getGame("chess")).thenReturn(game(List.of(V1)));

    mockMvc
        .perform(get("/v1/games/chess"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.latest_version").value("v1"))
        .andExpect(jsonPath("$.versions[0].min_players").value(2));
  }

  @Test
  void getUnknownGameReturns404() throws Exception {
    when(catalogService.getGame("nope")).thenThrow(LobbyNotFoundException.game("nope"));

    mockMvc
        .perform(get("/v1/games/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("GAME_NOT_FOUND"))
        .andExpect(jsonPath("$.entity_id").value("nope"));
  }

  @Test
  void listGamesReturnsListedGames() throws Exception {
    when(catalogService.listListedGames()).thenReturn(List.of(game(List.of(V1))));

    mockMvc
        .perform(get("/v1/games"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].game_id").value("chess"));
  }

  @Test
  void delistMapsNotOwnerTo403() throws Exception {
    when(catalogService.delist("chess", "dev-2"))
        .thenThrow(LobbyAccessDeniedException.notOwner("chess", "dev-2"));

    mockMvc
        .perform(delete("/v1/games/chess").header("X-User-Id", "dev-2"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_OWNER"));
  }

  @Test
  void downloadStreamsArchive() throws Exception {
    when(catalogService.download("chess", null))
        .thenReturn(new VersionDownload(V1, new byte[] {1, 2, 3}));

    mockMvc
        .perform(get("/v1/games/chess/download"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Game-Version", "v1"))
        .andExpect(content().contentType("application/zip"))
        .andExpect(content().bytes(new byte[] {1, 2, 3}));
  }

  private static GameRecord game(List<VersionRecord> versions) {
    return new GameRecord(
        "chess", "dev-1", "Chess", "classic", "board", ListingState.LISTED, versions, NOW, null);
  }

  @Test
  void integrityReturnsPerFileDigests() throws Exception {
    when(catalogService.integrity("chess", "v1"))
        .thenReturn(
            new VersionIntegrity(
                "chess", "v1", new TreeMap<>(Map.of("client.py", "ab12", "server.py", "cd34"))));

    mockMvc
        .perform(get("/v1/games/chess/integrity").param("version", "v1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.game_id").value("chess"))
        .andExpect(jsonPath("$.version").value("v1"))
        .andExpect(jsonPath("$.files['client.py']").value("ab12"))
        .andExpect(jsonPath("$.files['server.py']").value("cd34"));
  }

  @Test
  void addVersionMapsBrokenArchiveTo400() throws Exception {
    when(catalogService.addVersion(any(), any(), any(), any(), any(), any()))
        .thenThrow(
            new InvalidLobbyRequestException(
                ApiErrorCode.INVALID_ARCHIVE, "chess", "file_data must be a zip archive with files"));

    mockMvc
        .perform(
            post("/v1/games/chess/versions")
                .header("X-User-Id", "dev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"version":"v1","file_data":"bm90IGEgemlw",
                     "manifest":{"entry":"client.py","min_players":1,"max_players":2}}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ARCHIVE"))
        .andExpect(jsonPath("$.entity_id").value("chess"));
  }
}
