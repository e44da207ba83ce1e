package com.valkyrlabs.gruff.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Ticker;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GruffCacheTest {

  private static final TypeReference<List<String>> STRINGS = new TypeReference<List<String>>() {
  };

  private ManualClock clock;
  private GuavaCacheStore store;
  private GruffCache sut;

  @BeforeEach
  void setUp() {
    clock = new ManualClock(Instant.parse("2024-05-01T12:00:00Z"));
    store = new GuavaCacheStore(100, clock.ticker());
    sut = new GruffCache(store, 1, clock);
  }

  @Nested
  class SetAndGet {

    @Test
    void storedValueComesBackTyped() {
      sut.set("k", List.of("a", "b"), Duration.ofMinutes(1));

      assertEquals(Optional.of(List.of("a", "b")), sut.get("k", STRINGS));
    }

    @Test
    void recordCarriesEnvelope() {
      sut.set("k", 42L, Duration.ofSeconds(90));

      String raw = store.get("k");
      assertTrue(raw.contains("\"data\":42"));
      assertTrue(raw.contains("\"ttl\":90"));
      assertTrue(raw.contains("\"version\":1"));
      assertTrue(raw.contains("\"cachedAt\":" + clock.millis()));
    }

    @Test
    void absentKeyIsMiss() {
      assertFalse(sut.get("nope", Long.class).isPresent());
    }

    @Test
    void deleteRemovesValue() {
      sut.set("k", 1L, Duration.ofMinutes(1));
      sut.delete("k");

      assertFalse(sut.get("k", Long.class).isPresent());
    }
  }

  @Nested
  class Misses {

    @Test
    void otherFormatVersionIsMissAndDeleted() {
      new GruffCache(store, 0, clock).set("k", 1L, Duration.ofMinutes(1));

      assertFalse(sut.get("k", Long.class).isPresent());
      assertNull(store.get("k"));
    }

    @Test
    void recordPastItsTtlIsMiss() {
      Ticker frozen = new Ticker() {
        @Override
        public long read() {
          return 0L;
        }
      };
      GruffCache laggingStoreCache = new GruffCache(new GuavaCacheStore(100, frozen), 1, clock);
      laggingStoreCache.set("k", 1L, Duration.ofSeconds(30));

      clock.advance(Duration.ofSeconds(31));

      assertFalse(laggingStoreCache.get("k", Long.class).isPresent());
    }

    @Test
    void storeExpiryIsMiss() {
      sut.set("k", 1L, Duration.ofSeconds(30));

      clock.advance(Duration.ofSeconds(30));

      assertNull(store.get("k"));
      assertFalse(sut.get("k", Long.class).isPresent());
    }

    @Test
    void unreadablePayloadIsMissAndDeleted() {
      store.put("k", "{not json", Duration.ofMinutes(1));

      assertFalse(sut.get("k", Long.class).isPresent());
      assertNull(store.get("k"));
    }

    @Test
    void payloadOfWrongShapeIsMiss() {
      sut.set("k", "text", Duration.ofMinutes(1));

      assertFalse(sut.get("k", STRINGS).isPresent());
    }
  }

  @Nested
  class GetOrCompute {

    @Test
    void computesOnceThenHits() {
      AtomicInteger calls = new AtomicInteger();

      List<String> first = sut.getOrCompute("k", STRINGS, () -> {
        calls.incrementAndGet();
        return List.of("x");
      }, Duration.ofMinutes(1));
      List<String> second = sut.getOrCompute("k", STRINGS, () -> {
        calls.incrementAndGet();
        return List.of("y");
      }, Duration.ofMinutes(1));

      assertEquals(List.of("x"), first);
      assertEquals(List.of("x"), second);
      assertEquals(1, calls.get());
      assertEquals(1, sut.getStatistics().getHits());
      assertEquals(1, sut.getStatistics().getMisses());
      assertEquals(0.5d, sut.getStatistics().getHitRate());
    }

    @Test
    void writeFailureStillReturnsComputedValue() {
      CacheStore failing = mock(CacheStore.class);
      doThrow(new IllegalStateException("store down")).when(failing).put(anyString(), anyString(), any());
      GruffCache cache = new GruffCache(failing, 1, clock);
      List<String> value = List.of("computed");

      assertSame(value, cache.getOrCompute("k", STRINGS, () -> value, Duration.ofMinutes(1)));
    }

    @Test
    void readFailurePropagates() {
      CacheStore failing = mock(CacheStore.class);
      when(failing.get("k")).thenThrow(new IllegalStateException("store down"));
      GruffCache cache = new GruffCache(failing, 1, clock);

      assertThrows(IllegalStateException.class,
          () -> cache.getOrCompute("k", STRINGS, () -> List.of("x"), Duration.ofMinutes(1)));
    }

    @Test
    void nullResultIsNotCached() {
      assertNull(sut.getOrCompute("k", STRINGS, () -> null, Duration.ofMinutes(1)));
      assertNull(store.get("k"));
    }
  }

  @Test
  void hitRateWithoutLookupsIsZero() {
    assertEquals(0d, sut.getStatistics().getHitRate());
  }
}
