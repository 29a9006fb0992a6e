/*
 * どこで: Lobby サービス層
 * 何を: ゲーム登録/バージョン追加/下架/ダウンロードを扱う
 * なぜ: 所有者チェックと追記専用のバージョン履歴をゲーム単位のロック内で保証するため
 */
package com.example.lobby.service;

import com.example.lobby.api.ApiErrorCode;
import com.example.lobby.api.InvalidLobbyRequestException;
import com.example.lobby.api.LobbyAccessDeniedException;
import com.example.lobby.api.LobbyConflictException;
import com.example.lobby.api.LobbyNotFoundException;
import com.example.lobby.api.LobbyResourceException;
import com.example.lobby.model.AccountRole;
import com.example.lobby.model.GameManifest;
import com.example.lobby.model.GameMetadata;
import com.example.lobby.model.GameRecord;
import com.example.lobby.model.ListingState;
import com.example.lobby.model.VersionDownload;
import com.example.lobby.model.VersionIntegrity;
import com.example.lobby.model.VersionRecord;
import com.example.lobby.repository.GameCatalogRepository;
import com.example.lobby.runtime.ArchiveInspector;
import com.example.lobby.runtime.BlobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CatalogService {

  private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

  private final GameCatalogRepository gameCatalogRepository;
  private final VersionResolver versionResolver;
  private final ManifestValidator manifestValidator;
  private final BlobStore blobStore;
  private final ArchiveInspector archiveInspector;
  private final AccountDirectory accountDirectory;
  private final EntityLocks entityLocks;
  private final Clock clock;

  public GameRecord createGame(String developerId, GameMetadata metadata) {
    accountDirectory.touch(developerId, AccountRole.DEVELOPER);
    if (metadata == null || metadata.name() == null || metadata.name().isBlank()) {
      throw new InvalidLobbyRequestException("name is required");
    }
    final String gameId = slugOf(metadata.name());
    final GameRecord game =
        new GameRecord(
            gameId,
            developerId,
            metadata.name().strip(),
            metadata.description(),
            metadata.gameType(),
            ListingState.LISTED,
            List.of(),
            Instant.now(clock),
            null);
    if (!gameCatalogRepository.insertIfAbsent(game)) {
      throw new LobbyConflictException(
          ApiErrorCode.DUPLICATE_GAME, gameId, "game already exists: " + gameId);
    }
    logger.info("game created gameId={} developerId={}", gameId, developerId);
    return game;
  }

  /**
   * 役割: バージョンを追記する。
   * 動作: 所有者/掲載状態/ラベル重複をゲーム単位のロック内で検査し、blob 保存に成功した場合のみ追記する。
   * 前提: manifest とアーカイブ内容 (zip として読めること、entry / server_entry が含まれること) はロック取得前に検証する。
   */
  public VersionRecord addVersion(
      String gameId,
      String developerId,
      String label,
      byte[] content,
      GameManifest manifest,
      String notes) {
    accountDirectory.touch(developerId, AccountRole.DEVELOPER);
    if (label == null || label.isBlank()) {
      throw new InvalidLobbyRequestException("version is required");
    }
    if (content == null || content.length == 0) {
      throw new InvalidLobbyRequestException("file_data is required");
    }
    final GameManifest validated = manifestValidator.validate(gameId, manifest);
    manifestValidator.requireEntriesPresent(gameId, validated, archiveFiles(gameId, content));
    return entityLocks.withLock(
        EntityLocks.SCOPE_GAME,
        gameId,
        () -> {
          final GameRecord game = requireGame(gameId);
          if (!game.isOwnedBy(developerId)) {
            throw LobbyAccessDeniedException.notOwner(gameId, developerId);
          }
          if (!game.isListed()) {
            throw new LobbyConflictException(
                ApiErrorCode.GAME_DELISTED, gameId, "game is delisted: " + gameId);
          }
          if (game.findVersion(label).isPresent()) {
            throw new LobbyConflictException(
                ApiErrorCode.DUPLICATE_VERSION,
                gameId + "@" + label,
                "version already exists: " + label);
          }
          final String versionId = UUID.randomUUID().toString();
          final String blobRef;
          try {
            blobRef = blobStore.store(versionId, content);
          } catch (IOException ex) {
            throw LobbyResourceException.uploadFailed(gameId, ex);
          }
          final VersionRecord version =
              new VersionRecord(
                  versionId, gameId, label, blobRef, validated, notes, Instant.now(clock));
          gameCatalogRepository.save(game.withVersionAppended(version));
          logger.info(
              "version added gameId={} version={} versionId={}", gameId, label, versionId);
          return version;
        });
  }

  /** 役割: ゲームを下架する。 動作: 下架済みなら何もせず現在の状態を返す。 */
  public GameRecord delist(String gameId, String developerId) {
    accountDirectory.touch(developerId, AccountRole.DEVELOPER);
    return entityLocks.withLock(
        EntityLocks.SCOPE_GAME,
        gameId,
        () -> {
          final GameRecord game = requireGame(gameId);
          if (!game.isOwnedBy(developerId)) {
            throw LobbyAccessDeniedException.notOwner(gameId, developerId);
          }
          if (!game.isListed()) {
            return game;
          }
          final GameRecord delisted = game.delisted(Instant.now(clock));
          gameCatalogRepository.save(delisted);
          logger.info("game delisted gameId={}", gameId);
          return delisted;
        });
  }

  public VersionRecord latestVersion(String gameId) {
    return versionResolver.resolve(gameId, null);
  }

  public List<GameRecord> listListedGames() {
    return gameCatalogRepository.findAll().stream().filter(GameRecord::isListed).toList();
  }

  public GameRecord getGame(String gameId) {
    return requireGame(gameId);
  }

  /** 役割: バージョン本体を取得する。 動作: 下架済みでも取得できる。 */
  public VersionDownload download(String gameId, String label) {
    final VersionRecord version = versionResolver.resolve(gameId, label);
    try {
      return new VersionDownload(version, blobStore.fetch(version.blobRef()));
    } catch (IOException ex) {
      throw new LobbyResourceException(
          ApiErrorCode.UPLOAD_FAILED,
          gameId + "@" + version.label(),
          "version content is unavailable",
          ex);
    }
  }

  /**
   * 役割: バージョンのアーカイブに含まれるファイルごとの SHA-256 を返す。
   * 動作: ラベル省略時は最新。ダウンロードと同じく下架済みでも取得できる。
   */
  public VersionIntegrity integrity(String gameId, String label) {
    final VersionRecord version = versionResolver.resolve(gameId, label);
    final String entityId = gameId + "@" + version.label();
    final byte[] content;
    try {
      content = blobStore.fetch(version.blobRef());
    } catch (IOException ex) {
      throw new LobbyResourceException(
          ApiErrorCode.UPLOAD_FAILED, entityId, "version content is unavailable", ex);
    }
    try {
      return new VersionIntegrity(gameId, version.label(), archiveInspector.fileDigests(content));
    } catch (IOException ex) {
      throw new LobbyResourceException(
          ApiErrorCode.UPLOAD_FAILED, entityId, "stored archive is unreadable", ex);
    }
  }

  static String slugOf(String name) {
    final String slug =
        name.strip()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
    return slug.isEmpty() ? "game" : slug;
  }

  private Set<String> archiveFiles(String gameId, byte[] content) {
    try {
      return archiveInspector.fileNames(content);
    } catch (IOException ex) {
      throw new InvalidLobbyRequestException(
          ApiErrorCode.INVALID_ARCHIVE, gameId, "file_data must be a zip archive with files", ex);
    }
  }

  private GameRecord requireGame(String gameId) {
    return gameCatalogRepository
        .findById(gameId)
        .orElseThrow(() -> LobbyNotFoundException.game(gameId));
  }
}
