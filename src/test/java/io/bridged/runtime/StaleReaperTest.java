package io.bridged.runtime;

import io.bridged.config.BridgeSettings;
import io.bridged.model.HandleKind;
import io.bridged.pool.HandlePool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class StaleReaperTest {

    @Test
    void sweepRemovesOnlyHandlesIdlePastTheirKindThreshold() throws Exception {
        Path root = Files.createTempDirectory("bridged-reaper-test-");
        try {
            BridgeSettings settings = settings(root, """
                    {
                      "idleThresholdMs": 1000,
                      "idleThresholdsMs": {"lock_manager": 5000}
                    }
                    """);
            MutableClock clock = new MutableClock(10_000L);
            HandlePool pool = new HandlePool(10, clock);
            StaleReaper reaper = new StaleReaper(pool, settings);
            String cipher = pool.create(HandleKind.CIPHER_CONTEXT, () -> { }, "x1");
            String manager = pool.create(HandleKind.LOCK_MANAGER, () -> { }, "x2");
            String busy = pool.create(HandleKind.FTP_SESSION, () -> { }, "x3");

            Assertions.assertEquals(-1L, reaper.lastSweepAgeMs());
            clock.advance(1_500L);
            pool.touch(busy);

            StaleReaper.CleanupReport report = reaper.sweep();
            Assertions.assertEquals(1, report.cleanedConnections());
            Assertions.assertEquals(List.of(cipher), report.cleanedIds());
            Assertions.assertEquals(1, report.remainingConnections());
            Assertions.assertEquals(2, report.remainingHandles());
            Assertions.assertEquals("cipher_context", report.connectionsDetails().get(0).kind());
            Assertions.assertEquals(1.5d, report.connectionsDetails().get(0).idleTime(), 0.0001d);
            Assertions.assertTrue(pool.find(manager).isPresent());
            Assertions.assertEquals(0L, reaper.lastSweepAgeMs());

            clock.advance(4_000L);
            report = reaper.sweep();
            Assertions.assertEquals(2, report.cleanedConnections());
            Assertions.assertEquals(0, pool.size());
            Assertions.assertEquals(3L, reaper.reapedTotal());
            Assertions.assertEquals(2L, reaper.sweeps());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sweepSkipsHandleThatIsCheckedOut() throws Exception {
        Path root = Files.createTempDirectory("bridged-reaper-test-");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            BridgeSettings settings = settings(root, "{\"idleThresholdMs\": 100}");
            MutableClock clock = new MutableClock(0L);
            HandlePool pool = new HandlePool(10, clock);
            StaleReaper reaper = new StaleReaper(pool, settings);
            String id = pool.create(HandleKind.FTP_SESSION, () -> { }, "x1");
            clock.advance(500L);

            CountDownLatch inside = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Future<String> inUse = executor.submit(() -> pool.withHandle(id, HandleKind.FTP_SESSION, h -> {
                inside.countDown();
                release.await(5, TimeUnit.SECONDS);
                return h.id();
            }));
            Assertions.assertTrue(inside.await(5, TimeUnit.SECONDS));

            Assertions.assertEquals(0, reaper.sweep().cleanedConnections());
            release.countDown();
            Assertions.assertEquals(id, inUse.get(5, TimeUnit.SECONDS));
            Assertions.assertTrue(pool.find(id).isPresent());
        } finally {
            executor.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void sweepKeepsConnectionWhoseStatementIsCheckedOut() throws Exception {
        Path root = Files.createTempDirectory("bridged-reaper-test-");
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            BridgeSettings settings = settings(root, "{\"idleThresholdMs\": 100}");
            MutableClock clock = new MutableClock(0L);
            HandlePool pool = new HandlePool(10, clock);
            StaleReaper reaper = new StaleReaper(pool, settings);
            String connection = pool.create(HandleKind.DATABASE_CONNECTION, () -> { }, "x1");
            String statement = pool.create(HandleKind.PREPARED_STATEMENT, () -> { }, "x2", connection);
            clock.advance(500L);

            CountDownLatch inside = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Future<Boolean> inUse = executor.submit(() -> pool.withHandle(statement, HandleKind.PREPARED_STATEMENT, h -> {
                inside.countDown();
                release.await(5, TimeUnit.SECONDS);
                return pool.find(connection).isPresent();
            }));
            Assertions.assertTrue(inside.await(5, TimeUnit.SECONDS));

            StaleReaper.CleanupReport report = executor.submit(reaper::sweep).get(2, TimeUnit.SECONDS);
            Assertions.assertEquals(0, report.cleanedConnections());
            Assertions.assertEquals(1, report.remainingConnections());
            Assertions.assertEquals(2, report.remainingHandles());

            release.countDown();
            Assertions.assertTrue(inUse.get(5, TimeUnit.SECONDS), "connection must outlive the statement operation");
            Assertions.assertTrue(pool.find(statement).isPresent());
        } finally {
            executor.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static BridgeSettings settings(Path root, String json) throws IOException {
        Path file = root.resolve("bridged-settings.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return BridgeSettings.load(file);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class MutableClock extends Clock {
        private volatile long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long deltaMs) {
            millis += deltaMs;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
