package io.difflite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class FileTxStoreTest {

    @TempDir Path dataDir;

    private static byte[] b(String s) { return s.getBytes(StandardCharsets.UTF_8); }

    private static String s(byte[] b) { return b == null ? null : new String(b, StandardCharsets.UTF_8); }

    @Test
    void committed_writes_survive_restart() {
        try (var store = FileTxStore.open(dataDir)) {
            store.update(tx -> {
                var ns = tx.createBucketIfNotExists("ns");
                ns.put(b("k1"), b("v1"));
                ns.createBucketIfNotExists("inner").put(b("k2"), b("v2"));
                return null;
            });
            store.update(tx -> {
                tx.bucket("ns").put(b("k1"), b("v1b"));
                return null;
            });
        }

        // "Crash": new instance recovers from disk
        try (var store = FileTxStore.open(dataDir)) {
            store.view(tx -> {
                var ns = tx.bucket("ns");
                assertNotNull(ns);
                assertEquals("v1b", s(ns.get(b("k1"))));
                assertEquals("v2", s(ns.bucket("inner").get(b("k2"))));
                assertEquals(1, ns.count(), "nested buckets are not entries");
                return null;
            });
        }
    }

    @Test
    void rollback_discards_everything_including_bucket_creation() {
        try (var store = FileTxStore.open(dataDir)) {
            try (var tx = store.begin(true)) {
                tx.createBucketIfNotExists("ns").put(b("k"), b("v"));
                // read-your-writes before rollback
                assertEquals("v", s(tx.bucket("ns").get(b("k"))));
            } // close without commit => rollback

            store.view(tx -> {
                assertNull(tx.bucket("ns"));
                return null;
            });
        }
    }

    @Test
    void thrown_exception_in_update_rolls_back() {
        try (var store = FileTxStore.open(dataDir)) {
            store.update(tx -> tx.createBucketIfNotExists("ns"));

            assertThrows(IllegalStateException.class, () -> store.update(tx -> {
                tx.bucket("ns").put(b("k"), b("v"));
                throw new IllegalStateException("boom");
            }));

            int count = store.view(tx -> tx.bucket("ns").count());
            assertEquals(0, count);
        }
    }

    @Test
    void cursor_iterates_in_unsigned_key_order_merging_uncommitted_writes() {
        try (var store = FileTxStore.open(dataDir)) {
            store.update(tx -> {
                var ns = tx.createBucketIfNotExists("ns");
                ns.put(new byte[]{(byte) 0xFF}, b("ff"));
                ns.put(new byte[]{0x01}, b("01"));
                ns.put(new byte[]{(byte) 0x80}, b("80"));
                return null;
            });

            store.update(tx -> {
                var ns = tx.bucket("ns");
                ns.put(new byte[]{0x7F}, b("7f"));
                ns.delete(new byte[]{(byte) 0x80});
                ns.put(new byte[]{0x01}, b("01b"));

                List<String> seen = new ArrayList<>();
                var c = ns.cursor();
                for (var e = c.first(); e != null; e = c.next()) {
                    seen.add(s(e.value()));
                }
                assertEquals(List.of("01b", "7f", "ff"), seen);
                assertEquals(3, ns.count());

                var at = c.seek(new byte[]{0x02});
                assertEquals("7f", s(at.value()));
                return null;
            });
        }
    }

    @Test
    void deleting_current_entry_while_iterating_is_safe() {
        try (var store = FileTxStore.open(dataDir)) {
            store.update(tx -> {
                var ns = tx.createBucketIfNotExists("ns");
                for (int i = 0; i < 5; i++) ns.put(b("k" + i), b("v" + i));
                return null;
            });

            int visited = store.update(tx -> {
                var ns = tx.bucket("ns");
                var c = ns.cursor();
                int n = 0;
                for (var e = c.first(); e != null; e = c.next()) {
                    ns.delete(e.key());
                    n++;
                }
                return n;
            });

            assertEquals(5, visited);
            assertEquals(0, (int) store.view(tx -> tx.bucket("ns").count()));
        }
    }

    @Test
    void delete_bucket_drops_nested_buckets_and_recreate_starts_empty() {
        try (var store = FileTxStore.open(dataDir)) {
            store.update(tx -> {
                var ns = tx.createBucketIfNotExists("ns");
                ns.put(b("k"), b("v"));
                ns.createBucketIfNotExists("child").put(b("c"), b("1"));
                return null;
            });

            store.update(tx -> {
                tx.deleteBucket("ns");
                var again = tx.createBucketIfNotExists("ns");
                assertNull(again.get(b("k")));
                assertNull(again.bucket("child"));
                return null;
            });
        }

        try (var store = FileTxStore.open(dataDir)) {
            store.view(tx -> {
                assertEquals(List.of("ns"), tx.bucketNames());
                assertEquals(0, tx.bucket("ns").count());
                assertEquals(List.of(), tx.bucket("ns").bucketNames());
                return null;
            });
        }
    }

    @Test
    void missing_bucket_and_read_only_writes_are_store_errors() {
        try (var store = FileTxStore.open(dataDir)) {
            store.update(tx -> tx.createBucketIfNotExists("ns"));

            try (var tx = store.begin(false)) {
                assertThrows(StoreException.class, () -> tx.bucket("ns").put(b("k"), b("v")));
                assertThrows(StoreException.class, () -> tx.deleteBucket("ns"));
            }
            try (var tx = store.begin(true)) {
                assertThrows(StoreException.class, () -> tx.deleteBucket("nope"));
                var ns = tx.bucket("ns");
                tx.deleteBucket("ns");
                assertThrows(StoreException.class, () -> ns.get(b("k")), "handle is dead after delete");
            }
        }
    }

    @Test
    void commit_hook_runs_only_after_commit() {
        try (var store = FileTxStore.open(dataDir)) {
            var fired = new AtomicBoolean(false);

            try (var tx = store.begin(true)) {
                tx.createBucketIfNotExists("ns");
                tx.onCommit(() -> fired.set(true));
                assertFalse(fired.get());
                tx.rollback();
            }
            assertFalse(fired.get(), "hook must not run on rollback");

            try (var tx = store.begin(true)) {
                tx.createBucketIfNotExists("ns");
                tx.onCommit(() -> fired.set(true));
                tx.commit();
            }
            assertTrue(fired.get());
        }
    }

    @Test
    void second_writer_waits_for_first_to_finish() throws Exception {
        try (var store = FileTxStore.open(dataDir)) {
            store.update(tx -> tx.createBucketIfNotExists("ns"));

            var first = store.begin(true);
            first.bucket("ns").put(b("k"), b("first"));

            var started = new CountDownLatch(1);
            var acquired = new CountDownLatch(1);
            var seen = new ArrayList<String>();
            Thread t = new Thread(() -> {
                started.countDown();
                try (var tx = store.begin(true)) {
                    acquired.countDown();
                    seen.add(s(tx.bucket("ns").get(b("k"))));
                    tx.commit();
                }
            });
            t.start();

            assertTrue(started.await(5, TimeUnit.SECONDS));
            assertFalse(acquired.await(200, TimeUnit.MILLISECONDS), "second writer must block");

            first.commit();
            assertTrue(acquired.await(5, TimeUnit.SECONDS));
            t.join(5_000);
            assertEquals(List.of("first"), seen, "second writer sees the first one's commit");
        }
    }

    @Test
    void use_after_close_fails() {
        var store = FileTxStore.open(dataDir);
        store.close();

        assertThrows(StoreException.class, () -> store.begin(false));
        assertThrows(StoreException.class, () -> store.begin(true));
    }
}
