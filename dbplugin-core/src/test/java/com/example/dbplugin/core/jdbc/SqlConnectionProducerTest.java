package com.example.dbplugin.core.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.example.dbplugin.core.contract.CallContext;
import com.example.dbplugin.core.errors.ConnectionException;
import com.example.dbplugin.core.errors.OperationCancelledException;
import com.example.dbplugin.core.errors.ValidationException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class SqlConnectionProducerTest {

  private SqlConnectionProducer producer;
  private Map<String, Object> config;

  @BeforeEach
  void setUp() {
    producer = new SqlConnectionProducer("producer-test");
    config =
        Map.of(
            "connection_url",
            "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
            "username",
            "sa",
            "max_open_connections",
            2);
  }

  @AfterEach
  void tearDown() {
    producer.close();
  }

  @Nested
  @DisplayName("Initialization")
  class Initialization {

    @Test
    @DisplayName("Should open and ping the backend when verifying")
    void shouldVerifyEagerly() {
      producer.initialize(CallContext.background(), config, true);
      assertTrue(producer.isOpen());
    }

    @Test
    @DisplayName("Should connect lazily when not verifying")
    void shouldConnectLazily() {
      producer.initialize(CallContext.background(), config, false);
      assertFalse(producer.isOpen());

      final boolean valid =
          producer.withConnection(CallContext.background(), connection -> isValid(connection));
      assertTrue(valid);
      assertTrue(producer.isOpen());
    }

    @Test
    @DisplayName("Should keep the configuration when verification fails")
    void shouldKeepConfigurationWhenVerificationFails() {
      final var broken =
          Map.<String, Object>of("connection_url", "jdbc:nosuchdriver:db", "password", "pw");

      assertThrows(
          ConnectionException.class,
          () -> producer.initialize(CallContext.background(), broken, true));
      assertFalse(producer.isOpen());
      assertEquals(Map.of("pw", "[password]"), producer.secretValues());

      producer.initialize(CallContext.background(), config, true);
      assertTrue(producer.isOpen());
    }

    @Test
    @DisplayName("Should reject invalid configuration before touching the backend")
    void shouldRejectInvalidConfiguration() {
      assertThrows(
          ValidationException.class,
          () -> producer.initialize(CallContext.background(), Map.of("username", "sa"), true));
      assertFalse(producer.isOpen());
    }
  }

  @Nested
  @DisplayName("Connection access")
  class ConnectionAccess {

    @Test
    @DisplayName("Should fail when not initialized")
    void shouldFailWhenNotInitialized() {
      assertThrows(
          ConnectionException.class,
          () -> producer.withConnection(CallContext.background(), connection -> 1));
    }

    @Test
    @DisplayName("Should reopen after close")
    void shouldReopenAfterClose() {
      producer.initialize(CallContext.background(), config, true);
      producer.close();
      assertFalse(producer.isOpen());

      final boolean valid =
          producer.withConnection(CallContext.background(), connection -> isValid(connection));
      assertTrue(valid);
      assertTrue(producer.isOpen());
    }

    @Test
    @DisplayName("Should tolerate repeated close")
    void shouldTolerateRepeatedClose() {
      producer.initialize(CallContext.background(), config, true);
      assertDoesNotThrow(
          () -> {
            producer.close();
            producer.close();
          });
    }

    @Test
    @DisplayName("Should never run two callbacks at once")
    void shouldSerializeCallbacks() throws Exception {
      producer.initialize(CallContext.background(), config, true);
      final var active = new AtomicInteger();
      final var overlap = new AtomicBoolean(false);
      final var pool = Executors.newFixedThreadPool(4);
      try {
        final var done = new CountDownLatch(8);
        for (int i = 0; i < 8; i++) {
          pool.submit(
              () -> {
                try {
                  producer.withConnection(
                      CallContext.background(),
                      connection -> {
                        if (active.incrementAndGet() > 1) overlap.set(true);
                        sleep(20);
                        active.decrementAndGet();
                        return null;
                      });
                } finally {
                  done.countDown();
                }
              });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
      } finally {
        pool.shutdownNow();
      }
      assertFalse(overlap.get());
    }
  }

  @Test
  @DisplayName("Should keep the callback result when returning the connection fails")
  void shouldIgnoreFailedRelease() throws Exception {
    final var connection = mock(Connection.class);
    doThrow(new SQLException("connection reset")).when(connection).close();
    final var failingRelease =
        new SqlConnectionProducer("release-test") {
          @Override
          Connection borrow() {
            return connection;
          }
        };
    failingRelease.initialize(CallContext.background(), config, false);

    final var result = failingRelease.withConnection(CallContext.background(), c -> "committed");

    assertEquals("committed", result);
    verify(connection).close();
  }

  @Nested
  @DisplayName("Cancellation")
  class Cancellation {

    @Test
    @DisplayName("Should return without I/O when cancelled before the lock")
    void shouldReturnWhenCancelledBeforeLock() {
      final var ctx = CallContext.background();
      ctx.cancel();
      final var called = new AtomicBoolean(false);

      assertThrows(
          OperationCancelledException.class,
          () ->
              producer.withConnection(
                  ctx,
                  connection -> {
                    called.set(true);
                    return null;
                  }));
      assertFalse(called.get());
    }

    @Test
    @DisplayName("Should give up waiting for the lock when the deadline passes")
    void shouldGiveUpWaitingForLock() throws Exception {
      producer.initialize(CallContext.background(), config, true);
      final var holding = new CountDownLatch(1);
      final var release = new CountDownLatch(1);
      final var holder =
          new Thread(
              () ->
                  producer.withConnection(
                      CallContext.background(),
                      connection -> {
                        holding.countDown();
                        await(release);
                        return null;
                      }));
      holder.start();
      try {
        assertTrue(holding.await(5, TimeUnit.SECONDS));
        final var started = System.nanoTime();

        assertThrows(
            OperationCancelledException.class,
            () ->
                producer.withConnection(
                    CallContext.withTimeout(Duration.ofMillis(100)), connection -> null));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 5_000);
      } finally {
        release.countDown();
        holder.join(5_000);
      }
    }
  }

  private static boolean isValid(final Connection connection) {
    try {
      return connection.isValid(1);
    } catch (final SQLException e) {
      throw new RuntimeException(e);
    }
  }

  private static void sleep(final long millis) {
    try {
      Thread.sleep(millis);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void await(final CountDownLatch latch) {
    try {
      latch.await(10, TimeUnit.SECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
