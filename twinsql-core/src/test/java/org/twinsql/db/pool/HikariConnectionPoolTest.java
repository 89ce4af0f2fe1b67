package org.twinsql.db.pool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.twinsql.db.ClientConfig;
import org.twinsql.db.error.DatabaseException;
import org.twinsql.db.error.PoolCreationException;
import org.twinsql.db.error.PoolExhaustedException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against H2 in PostgreSQL mode standing in for a server.
 */
class HikariConnectionPoolTest {

    private HikariConnectionPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private static ClientConfig h2(String db, String password, int min, int max) {
        return ClientConfig.postgres("localhost", 5432, db, "sa")
                .jdbcUrl("jdbc:h2:mem:" + db + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1")
                .password(password)
                .poolSize(min, max)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @Test
    void borrowsWorkingConnectionsWithAutoCommitOff() throws Exception {
        pool = HikariConnectionPool.create(h2("hikari_basic", "", 1, 2));

        Connection c = pool.acquire();
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
        }
        assertFalse(c.getAutoCommit());
        assertEquals(1, pool.stats().borrowed());

        pool.release(c);
        assertEquals(0, pool.stats().borrowed());
    }

    @Test
    void failsFastWhenAllConnectionsAreBorrowed() {
        pool = HikariConnectionPool.create(h2("hikari_bound", "", 1, 2));

        Connection a = pool.acquire();
        Connection b = pool.acquire();

        long t0 = System.nanoTime();
        PoolExhaustedException ex = assertThrows(PoolExhaustedException.class, pool::acquire);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        assertEquals(2, ex.maxSize());
        assertTrue(elapsedMs < 1000, "exhaustion should not wait for the connection timeout");

        pool.release(a);
        Connection again = assertDoesNotThrow(pool::acquire);
        pool.release(again);
        pool.release(b);
        assertEquals(0, pool.stats().borrowed());
    }

    @Test
    void releasingTwiceIsIgnored() {
        pool = HikariConnectionPool.create(h2("hikari_double", "", 0, 1));

        Connection c = pool.acquire();
        pool.release(c);
        pool.release(c);

        assertEquals(0, pool.stats().borrowed());
        Connection next = pool.acquire();
        assertNotNull(next);
        pool.release(next);
    }

    @Test
    void badCredentialsFailAtConstruction() throws Exception {
        // the first connection creates the database with the empty password
        try (Connection owner = DriverManager.getConnection("jdbc:h2:mem:hikari_auth;MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "")) {
            PoolCreationException ex = assertThrows(PoolCreationException.class,
                    () -> HikariConnectionPool.create(h2("hikari_auth", "wrong", 1, 2)));
            assertTrue(ex.getMessage().contains("localhost:5432/hikari_auth@sa"));
        }
    }

    @Test
    void concurrentAcquireAndReleaseStayWithinBound() throws Exception {
        pool = HikariConnectionPool.create(h2("hikari_race", "", 1, 3));
        int threads = 8;
        int opsPerThread = 50;
        AtomicInteger ok = new AtomicInteger();
        AtomicInteger exhausted = new AtomicInteger();
        AtomicInteger mostBorrowed = new AtomicInteger();
        Queue<Throwable> unexpected = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);

        ExecutorService exec = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(exec.submit(() -> {
                    start.await();
                    for (int i = 0; i < opsPerThread; i++) {
                        Connection c;
                        try {
                            c = pool.acquire();
                        } catch (PoolExhaustedException e) {
                            exhausted.incrementAndGet();
                            continue;
                        } catch (RuntimeException e) {
                            unexpected.add(e);
                            continue;
                        }
                        try (Statement st = c.createStatement();
                             ResultSet rs = st.executeQuery("SELECT 1")) {
                            rs.next();
                            mostBorrowed.accumulateAndGet(pool.stats().borrowed(), Math::max);
                            ok.incrementAndGet();
                        } catch (Exception e) {
                            unexpected.add(e);
                        } finally {
                            pool.release(c);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(1, TimeUnit.MINUTES);
            }
        } finally {
            exec.shutdownNow();
        }

        assertTrue(unexpected.isEmpty(), () -> "unexpected failures: " + unexpected);
        assertEquals(threads * opsPerThread, ok.get() + exhausted.get());
        assertTrue(ok.get() > 0);
        assertTrue(mostBorrowed.get() <= 3, "borrowed peaked at " + mostBorrowed.get());
        assertEquals(0, pool.stats().borrowed());
        assertTrue(pool.stats().total() <= 3);
    }

    @Test
    void acquireAfterCloseFails() {
        pool = HikariConnectionPool.create(h2("hikari_closed", "", 1, 1));
        pool.close();

        assertThrows(DatabaseException.class, pool::acquire);
    }
}
