package com.example.lobby.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.example.lobby.api.ApiErrorCode;
import com.example.lobby.api.LobbyNotFoundException;
import com.example.lobby.model.GameManifest;
import com.example.lobby.model.GameRecord;
import com.example.lobby.model.ListingState;
import com.example.lobby.model.VersionRecord;
import com.example.lobby.repository.GameCatalogRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class VersionResolverTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final GameManifest MANIFEST = new GameManifest("client.py", null, 1, 2);

  private GameCatalogRepository repository;
  private VersionResolver resolver;

  @BeforeEach
  void setUp() {
    repository = Mockito.mock(GameCatalogRepository.class);
    resolver = new VersionResolver(repository);
  }

  @Test
  void resolvesLastAppendedVersionWhenLabelIsOmitted() {
    // "v10" は "v9" より後に追加されたので、文字列順ではなく追加順で最新になる。
    when(repository.findById("chess")).thenReturn(Optional.of(game(version("v9"), version("v10"))));

    assertThat(resolver.resolve("chess", null).label()).isEqualTo("v10");
    assertThat(resolver.resolve("chess", " ").label()).isEqualTo("v10");
  }

  @Test
  void resolvesExactLabel() {
    when(repository.findById("chess")).thenReturn(Optional.of(game(version("v1"), version("v2"))));

    assertThat(resolver.resolve("chess", "v1").label()).isEqualTo("v1");
  }

  @Test
  void ignoresListingState() {
    final GameRecord delisted = game(version("v1")).delisted(NOW);
    when(repository.findById("chess")).thenReturn(Optional.of(delisted));

    assertThat(resolver.resolve("chess", "v1").label()).isEqualTo("v1");
  }

  @Test
  void throwsGameNotFoundForUnknownGame() {
    when(repository.findById("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> resolver.resolve("missing", "v1"))
        .isInstanceOf(LobbyNotFoundException.class)
        .extracting("code")
        .isEqualTo(ApiErrorCode.GAME_NOT_FOUND);
  }

  @Test
  void throwsVersionNotFoundForUnknownLabel() {
    when(repository.findById("chess")).thenReturn(Optional.of(game(version("v1"))));

    assertThatThrownBy(() -> resolver.resolve("chess", "v3"))
        .isInstanceOf(LobbyNotFoundException.class)
        .hasMessageContaining("chess@v3")
        .extracting("code")
        .isEqualTo(ApiErrorCode.VERSION_NOT_FOUND);
  }

  @Test
  void throwsVersionNotFoundWhenGameHasNoVersions() {
    when(repository.findById("chess")).thenReturn(Optional.of(game()));

    assertThatThrownBy(() -> resolver.resolve("chess", null))
        .isInstanceOf(LobbyNotFoundException.class)
        .extracting("code")
        .isEqualTo(ApiErrorCode.VERSION_NOT_FOUND);
  }

  private static GameRecord game(VersionRecord... versions) {
    return new GameRecord(
        "chess", "dev-1", "Chess", null, null, ListingState.LISTED, List.of(versions), NOW, null);
  }

  private static VersionRecord version(String label) {
    return new VersionRecord(
        "id-" + label, "chess", label, "id-" + label + ".zip", MANIFEST, null, NOW);
  }
}
