package com.example.lobby.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.lobby.model.RatingRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

class RedisRatingRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
  private HashOperations<String, Object, Object> hashOps;
  private RedisRatingRepository repository;

  @SuppressWarnings("unchecked")
  @BeforeEach
  void setUp() {
    final StringRedisTemplate redisTemplate = Mockito.mock(StringRedisTemplate.class);
    hashOps = Mockito.mock(HashOperations.class);
    when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOps);
    repository = new RedisRatingRepository(redisTemplate, objectMapper);
  }

  @Test
  void upsertOverwritesFieldAndReturnsPrevious() throws Exception {
    final RatingRecord previous = new RatingRecord("bob", "chess", 2, null, NOW);
    when(hashOps.get("lobby:ratings:chess", "bob"))
        .thenReturn(objectMapper.writeValueAsString(previous));

    final RatingRecord next = new RatingRecord("bob", "chess", 5, "better", NOW.plusSeconds(60));
    assertThat(repository.upsert(next)).contains(previous);

    final ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    verify(hashOps).put(eq("lobby:ratings:chess"), eq("bob"), json.capture());
    assertThat(objectMapper.readValue(json.getValue(), RatingRecord.class)).isEqualTo(next);
  }

  @Test
  void findByGameReturnsNewestFirst() throws Exception {
    when(hashOps.values("lobby:ratings:chess"))
        .thenReturn(
            List.of(
                objectMapper.writeValueAsString(new RatingRecord("amy", "chess", 3, null, NOW)),
                objectMapper.writeValueAsString(
                    new RatingRecord("bob", "chess", 4, null, NOW.plusSeconds(5)))));

    assertThat(repository.findByGame("chess"))
        .extracting(RatingRecord::playerId)
        .containsExactly("bob", "amy");
  }

  @Test
  void findReturnsEmptyWhenMissing() {
    when(hashOps.get(anyString(), anyString())).thenReturn(null);

    assertThat(repository.find("bob", "chess")).isEmpty();
  }
}
