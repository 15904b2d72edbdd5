package com.trading.flow.state;

import com.trading.flow.error.FieldTypeException;
import com.trading.flow.error.MissingFieldException;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class StateStoreTest {

    private static final StateKey<Integer> X = StateKey.of("x", Integer.class);
    private static final StateKey<String> NAME = StateKey.of("name", String.class);

    @Test
    public void testSeedIsVisible() {
        StateStore store = new StateStore(Map.of("x", 1));
        assertEquals(Integer.valueOf(1), store.snapshot().get(X));
        assertTrue(store.journal().isEmpty());
    }

    @Test
    public void testMergeAddsAndOverwrites() {
        StateStore store = new StateStore(Map.of("x", 1));
        store.merge("A", StateDelta.builder().put("x", 5).put("y", "new").build());

        StateSnapshot s = store.snapshot();
        assertEquals(5, s.get("x"));
        assertEquals("new", s.get("y"));
        assertEquals(2, s.size());
    }

    @Test
    public void testSnapshotIsUnaffectedByLaterMerges() {
        StateStore store = new StateStore(Map.of("x", 1));
        StateSnapshot before = store.snapshot();
        store.merge("A", StateDelta.of("x", 2));
        assertEquals(1, before.get("x"));
        assertEquals(2, store.snapshot().get("x"));
    }

    @Test
    public void testEmptyDeltaChangesNothing() {
        StateStore store = new StateStore(Map.of("x", 1));
        StateSnapshot before = store.snapshot();
        store.merge(StateDelta.empty());
        assertEquals(before, store.snapshot());
    }

    @Test
    public void testSnapshotOfSeesOnlyGivenProducers() {
        StateStore store = new StateStore(Map.of("x", 1));
        store.merge("A", StateDelta.of("a", 10));
        store.merge("B", StateDelta.of("b", 20));
        store.merge(StateDelta.of("external", true));

        StateSnapshot scoped = store.snapshotOf(Set.of("A"));
        assertEquals(Set.of("x", "a", "external"), scoped.fieldNames());
        assertFalse(scoped.contains("b"));
    }

    @Test
    public void testSnapshotOfReplaysInMergeOrder() {
        StateStore store = new StateStore(Map.of());
        store.merge("A", StateDelta.of("v", "from A"));
        store.merge("B", StateDelta.of("v", "from B"));
        assertEquals("from B", store.snapshotOf(Set.of("A", "B")).get("v"));
        assertEquals("from A", store.snapshotOf(Set.of("A")).get("v"));
    }

    @Test
    public void testSchemaRejectsWrongTypeAtomically() {
        StateStore store = new StateStore(Map.of("x", 1), StateSchema.lenient(X));
        try {
            store.merge("A", StateDelta.builder().put("other", 1).put("x", "not a number").build());
            fail("Expected FieldTypeException");
        } catch (FieldTypeException e) {
            assertEquals("x", e.field());
        }
        assertFalse(store.snapshot().contains("other"));
        assertEquals(1, store.snapshot().get("x"));
    }

    @Test(expected = FieldTypeException.class)
    public void testStrictSchemaRejectsUnknownField() {
        new StateStore(Map.of("x", 1, "unknown", 2), StateSchema.strict(X, NAME));
    }

    @Test
    public void testNullSeedValueRejected() {
        Map<String, Object> seed = new HashMap<>();
        seed.put("x", 1);
        seed.put("name", null);
        for (StateSchema schema : new StateSchema[] { StateSchema.open(), StateSchema.strict(X, NAME) }) {
            try {
                new StateStore(seed, schema);
                fail("Expected NullPointerException");
            } catch (NullPointerException e) {
                assertEquals("Null value for seed field 'name'", e.getMessage());
            }
        }
    }

    @Test
    public void testTypedAccess() {
        StateSnapshot s = StateSnapshot.of(Map.of("x", 3, "name", "flow"));
        assertEquals(Integer.valueOf(3), s.get(X));
        assertEquals("flow", s.get(NAME));
        assertEquals("dflt", StateSnapshot.empty().getOrDefault(NAME, "dflt"));
    }

    @Test(expected = MissingFieldException.class)
    public void testMissingFieldThrows() {
        StateSnapshot.empty().get(X);
    }

    @Test(expected = FieldTypeException.class)
    public void testMistypedFieldThrows() {
        StateSnapshot.of(Map.of("x", "three")).get(X);
    }

    @Test(expected = NullPointerException.class)
    public void testDeltaRejectsNullValues() {
        StateDelta.builder().put("x", null);
    }
}
