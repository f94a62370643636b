package io.difflite.diff;

import io.difflite.storage.Bucket;
import io.difflite.storage.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class DifferentialTest {

    @TempDir Path dataDir;

    private DiffDb db;
    private Differential diff;

    @BeforeEach
    void setUp() {
        db = DiffDb.open(dataDir);
        diff = db.open("rows");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private static byte[] b(String s) { return s.getBytes(StandardCharsets.UTF_8); }

    private static String s(byte[] b) { return new String(b, StandardCharsets.UTF_8); }

    private <T> T table(String table, Function<Bucket, T> fn) {
        return db.store().view(tx -> fn.apply(tx.bucket("rows").bucket(table)));
    }

    private List<String> pendingKeys() {
        List<String> out = new ArrayList<>();
        for (byte[] id : diff.pendingIds()) out.add(s(id));
        return out;
    }

    // ---------------- stage ----------------

    @Test
    void staging_identical_content_twice_is_a_noop() {
        assertTrue(diff.add(new Row("a", "v1")));
        assertFalse(diff.add(new Row("a", "v1")), "same content as pending");
        assertEquals(1, diff.countChanges());
        assertEquals(1, table(Differential.PENDING_DATA, Bucket::count));
    }

    @Test
    void restaging_supersedes_pending_version_and_drops_its_payload() {
        byte[] h1 = diff.hashOf(new Row("a", "v1")).bytes();
        byte[] h2 = diff.hashOf(new Row("a", "v2")).bytes();

        assertTrue(diff.add(new Row("a", "v1")));
        assertTrue(diff.add(new Row("a", "v2")));

        assertEquals(1, diff.countChanges());
        assertNull(table(Differential.PENDING_DATA, t -> t.get(h1)), "orphaned payload removed");
        assertNotNull(table(Differential.PENDING_DATA, t -> t.get(h2)));
        assertArrayEquals(h2, table(Differential.PENDING_HASHES, t -> t.get(b("a"))));
    }

    @Test
    void staging_rejects_empty_id() {
        assertThrows(IllegalArgumentException.class, () -> diff.add(new Row("", "v")));
        assertEquals(0, diff.countChanges());
    }

    @Test
    void addTx_joins_the_callers_transaction() {
        try (var tx = db.store().begin(true)) {
            assertTrue(diff.addTx(tx, new Row("a", "v1")));
            tx.bucket("rows").bucket(Differential.USER_DATA).put(b("cursor"), b("42"));
            // rolled back on close
        }
        assertEquals(0, diff.countChanges());
        assertNull(diff.viewUserData(ud -> ud.get(b("cursor"))));

        db.store().update(tx -> {
            diff.addTx(tx, new Row("a", "v1"));
            tx.bucket("rows").bucket(Differential.USER_DATA).put(b("cursor"), b("42"));
            return null;
        });
        assertEquals(1, diff.countChanges());
        assertEquals("42", diff.viewUserData(ud -> s(ud.get(b("cursor")))));
    }

    // ---------------- apply ----------------

    @Test
    void successful_apply_promotes_the_change() {
        diff.add(new Row("a", "v1"));

        List<Row> applied = new ArrayList<>();
        ApplyResult r = diff.each((id, data) -> applied.add(data.decode(Row.class)));

        assertTrue(r.isSuccess());
        assertEquals(1, r.promoted());
        assertEquals(List.of(new Row("a", "v1")), applied);
        assertEquals(0, diff.countChanges());
        assertEquals(1, diff.countTracking());
        assertEquals(0, table(Differential.PENDING_DATA, Bucket::count));
        assertFalse(diff.changed(b("a"), new Row("a", "v1")));
        assertFalse(diff.add(new Row("a", "v1")), "same content as committed");
        assertEquals(0, diff.countChanges());
    }

    @Test
    void failed_items_stay_pending_while_the_rest_are_promoted() {
        diff.add(new Row("a", "1"));
        diff.add(new Row("b", "2"));
        diff.add(new Row("c", "3"));

        ApplyResult r = diff.each((id, data) -> {
            if (s(id).equals("b")) throw new IllegalStateException("downstream rejected b");
        });

        assertFalse(r.isSuccess());
        assertFalse(r.cancelled());
        assertEquals(2, r.promoted());
        assertEquals(1, r.failures().size());
        assertEquals("b", r.failures().get(0).displayId());
        assertEquals("downstream rejected b", r.failures().get(0).cause().getMessage());
        assertEquals(List.of("b"), pendingKeys());
        assertEquals(2, diff.countTracking());

        ApplyException ex = assertThrows(ApplyException.class, r::throwIfFailed);
        assertSame(r, ex.result());

        // retry succeeds
        List<String> seen = new ArrayList<>();
        ApplyResult retry = diff.each((id, data) -> seen.add(data.decode(Row.class).value()));
        assertTrue(retry.isSuccess());
        assertEquals(List.of("2"), seen);
        assertEquals(0, diff.countChanges());
        assertEquals(3, diff.countTracking());
    }

    @Test
    void bounded_apply_promotes_at_most_n_per_pass() {
        for (int i = 0; i < 5; i++) diff.add(new Row("k" + i, "v" + i));

        assertEquals(2, diff.eachN(CancellationToken.none(), (id, data) -> { }, 2).promoted());
        assertEquals(3, diff.countChanges());
        assertEquals(2, diff.eachN(CancellationToken.none(), (id, data) -> { }, 2).promoted());
        assertEquals(1, diff.countChanges());
        assertEquals(1, diff.eachN(CancellationToken.none(), (id, data) -> { }, 2).promoted());
        assertEquals(0, diff.countChanges());
        assertEquals(5, diff.countTracking());
    }

    @Test
    void bounded_apply_counts_promotions_not_attempts() {
        diff.add(new Row("a", "1"));
        diff.add(new Row("b", "2"));
        diff.add(new Row("c", "3"));

        ApplyResult r = diff.eachN(CancellationToken.none(), (id, data) -> {
            if (s(id).equals("a")) throw new RuntimeException("nope");
        }, 2);

        assertEquals(2, r.promoted());
        assertEquals(1, r.failures().size());
        assertEquals(List.of("a"), pendingKeys());
    }

    @Test
    void cancellation_between_items_keeps_earlier_promotions() {
        for (int i = 0; i < 5; i++) diff.add(new Row("k" + i, "v" + i));
        CancellationToken token = new CancellationToken();

        List<String> seen = new ArrayList<>();
        ApplyResult r = diff.each(token, (id, data) -> {
            seen.add(s(id));
            if (seen.size() == 3) token.cancel("shutting down");
        });

        assertTrue(r.cancelled());
        assertFalse(r.isSuccess());
        assertEquals(3, r.promoted(), "the item being processed when cancelled still completes");
        assertEquals(List.of("k0", "k1", "k2"), seen);
        assertEquals(List.of("k3", "k4"), pendingKeys());
        assertEquals(3, diff.countTracking());

        ApplyException ex = assertThrows(ApplyException.class, r::throwIfFailed);
        assertTrue(ex.getMessage().contains("cancelled"));

        // a later unbounded pass finishes the rest
        ApplyResult rest = diff.each((id, data) -> { });
        assertTrue(rest.isSuccess());
        assertEquals(2, rest.promoted());
        assertEquals(0, diff.countChanges());
        assertEquals(5, diff.countTracking());
    }

    @Test
    void apply_visits_ids_in_unsigned_byte_order() {
        diff.add(new Raw(new byte[]{(byte) 0xFF}, "ff"));
        diff.add(new Raw(new byte[]{0x01}, "01"));
        diff.add(new Raw(new byte[]{0x7F}, "7f"));

        List<Integer> order = new ArrayList<>();
        diff.each((id, data) -> order.add(id[0] & 0xFF));

        assertEquals(List.of(0x01, 0x7F, 0xFF), order);
    }

    @Test
    void missing_payload_is_fatal_and_rolls_back_the_pass() {
        diff.add(new Row("a", "1"));
        diff.add(new Row("b", "2"));
        byte[] hb = diff.hashOf(new Row("b", "2")).bytes();
        db.store().update(tx -> {
            tx.bucket("rows").bucket(Differential.PENDING_DATA).delete(hb);
            return null;
        });

        List<String> seen = new ArrayList<>();
        assertThrows(InconsistentStateException.class, () -> diff.each((id, data) -> seen.add(s(id))));

        assertEquals(List.of("a"), seen);
        assertEquals(List.of("a", "b"), pendingKeys(), "promotion of a rolled back");
        assertEquals(0, diff.countTracking());
    }

    @Test
    void identical_content_under_different_ids_shares_one_payload() {
        assertTrue(diff.add(new Setting("x", true)));
        assertTrue(diff.add(new Setting("y", true)));
        assertEquals(2, diff.countChanges());
        assertEquals(1, table(Differential.PENDING_DATA, Bucket::count));

        // promoting x must not take y's payload with it
        ApplyResult first = diff.each((id, data) -> {
            if (s(id).equals("y")) throw new RuntimeException("later");
        });
        assertEquals(1, first.promoted());
        assertEquals(1, table(Differential.PENDING_DATA, Bucket::count));

        // neither must superseding y's sibling
        assertTrue(diff.add(new Setting("x", false)));
        assertEquals(2, table(Differential.PENDING_DATA, Bucket::count));

        List<Boolean> seen = new ArrayList<>();
        ApplyResult second = diff.each((id, data) -> seen.add(data.tree().get("enabled").asBoolean()));
        assertTrue(second.isSuccess());
        assertEquals(List.of(false, true), seen);
        assertEquals(0, table(Differential.PENDING_DATA, Bucket::count));
    }

    @Test
    void decode_failure_is_an_item_failure() {
        diff.add(new Row("a", "1"));

        ApplyResult r = diff.each((id, data) -> data.decode(Integer.class));

        assertEquals(1, r.failures().size());
        assertEquals(1, diff.countChanges());
    }

    // ---------------- queries ----------------

    @Test
    void changed_compares_against_committed_only() {
        assertTrue(diff.changed(b("a"), new Row("a", "1")), "unknown id");
        diff.add(new Row("a", "1"));
        assertTrue(diff.changed(b("a"), new Row("a", "1")), "pending is not committed");
        diff.each((id, data) -> { });
        assertFalse(diff.changed(b("a"), new Row("a", "1")));
        assertTrue(diff.changed(b("a"), new Row("a", "2")));
    }

    // ---------------- conflicts ----------------

    @Test
    void conflict_tracking_rejects_second_stage_of_an_id_in_one_epoch() {
        assertFalse(diff.conflictTracking());
        diff.mustNotConflict();
        assertTrue(diff.conflictTracking());

        assertTrue(diff.add(new Row("a", "1")));
        ConflictingKeyException ex = assertThrows(ConflictingKeyException.class, () -> diff.add(new Row("a", "2")));
        assertArrayEquals(b("a"), ex.id());

        List<String> values = new ArrayList<>();
        diff.eachN(CancellationToken.none(), (id, data) -> {
            values.add(data.decode(Row.class).value());
            throw new RuntimeException("peek only");
        }, 0);
        assertEquals(List.of("1"), values, "rejected stage left the first version in place");

        // new epoch
        diff.mustNotConflict();
        assertTrue(diff.add(new Row("a", "2")));
    }

    @Test
    void unchanged_objects_do_not_mark_conflicts() {
        diff.add(new Row("a", "1"));
        diff.each((id, data) -> { });
        diff.mustNotConflict();

        assertFalse(diff.add(new Row("a", "1")));
        assertTrue(diff.add(new Row("a", "2")));
    }

    @Test
    void allowConflicts_disables_tracking() {
        diff.mustNotConflict();
        diff.add(new Row("a", "1"));
        diff.allowConflicts();

        assertFalse(diff.conflictTracking());
        assertTrue(diff.add(new Row("a", "2")));
        assertTrue(diff.add(new Row("a", "3")));
        assertEquals(0, table(Differential.KEY_CONFLICTS, Bucket::count));
    }

    // ---------------- user data ----------------

    @Test
    void user_data_is_separate_from_tracking() {
        diff.updateUserData(ud -> {
            ud.put(b("a"), b("meta"));
            return null;
        });
        assertEquals("meta", diff.viewUserData(ud -> s(ud.get(b("a")))));
        assertEquals(0, diff.countChanges());
        assertEquals(0, diff.countTracking());

        assertThrows(StoreException.class, () -> diff.viewUserData(ud -> {
            ud.put(b("b"), b("x"));
            return null;
        }), "read-only view");
    }

    /** Object with a raw binary ID. */
    record Raw(byte[] key, String value) implements DiffObject {
        @Override public byte[] id() { return key; }
    }
}
