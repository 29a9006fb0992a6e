/*
 * どこで: Lobby API
 * 何を: ゲームカタログ (登録/バージョン追加/下架/一覧/ダウンロード/整合性) のエンドポイントを公開する
 * なぜ: 開発者のアップロードとプレイヤーの閲覧を同じカタログへの入口にまとめるため
 */
package com.example.lobby.api;

import com.example.lobby.api.request.AddVersionRequest;
import com.example.lobby.api.request.CreateGameRequest;
import com.example.lobby.api.response.GameResponse;
import com.example.lobby.api.response.IntegrityResponse;
import com.example.lobby.api.response.VersionResponse;
import com.example.lobby.model.VersionDownload;
import com.example.lobby.model.VersionRecord;
import com.example.lobby.service.CatalogService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/games")
@RequiredArgsConstructor
public class CatalogController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");
  private final CatalogService catalogService;

  @PostMapping
  public ResponseEntity<GameResponse> createGame(
      @RequestHeader(HEADER_USER_ID) String developerId,
      @Valid @RequestBody CreateGameRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(GameResponse.from(catalogService.createGame(developerId, request.toMetadata())));
  }

  @GetMapping
  public ResponseEntity<List<GameResponse>> listGames() {
    return ResponseEntity.ok(
        catalogService.listListedGames().stream().map(GameResponse::from).toList());
  }

  @GetMapping("/{gameId}")
  public ResponseEntity<GameResponse> getGame(@PathVariable("gameId") String gameId) {
    return ResponseEntity.ok(GameResponse.from(catalogService.getGame(gameId)));
  }

  @PostMapping("/{gameId}/versions")
  public ResponseEntity<VersionResponse> addVersion(
      @PathVariable("gameId") String gameId,
      @RequestHeader(HEADER_USER_ID) String developerId,
      @Valid @RequestBody AddVersionRequest request) {
    final VersionRecord version =
        catalogService.addVersion(
            gameId,
            developerId,
            request.version(),
            request.decodeFileData(),
            request.manifest().toManifest(),
            request.notes());
    return ResponseEntity.status(HttpStatus.CREATED).body(VersionResponse.from(version));
  }

  @DeleteMapping("/{gameId}")
  public ResponseEntity<GameResponse> delistGame(
      @PathVariable("gameId") String gameId, @RequestHeader(HEADER_USER_ID) String developerId) {
    return ResponseEntity.ok(GameResponse.from(catalogService.delist(gameId, developerId)));
  }

  @GetMapping("/{gameId}/download")
  public ResponseEntity<byte[]> download(
      @PathVariable("gameId") String gameId,
      @RequestParam(name = "version", required = false) String version) {
    final VersionDownload download = catalogService.download(gameId, version);
    final String filename = gameId + "-" + download.version().label() + ".zip";
    return ResponseEntity.ok()
        .contentType(APPLICATION_ZIP)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .header("X-Game-Version", download.version().label())
        .body(download.content());
  }

  @GetMapping("/{gameId}/integrity")
  public ResponseEntity<IntegrityResponse> integrity(
      @PathVariable("gameId") String gameId,
      @RequestParam(name = "version", required = false) String version) {
    return ResponseEntity.ok(IntegrityResponse.from(catalogService.integrity(gameId, version)));
  }
}
