package com.loomcom.keymap.keys;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for binding physical keys to virtual keys.
 */
public class KeyRegistryTest {

    private KeyCodec codec;
    private KeyRegistry registry;

    @BeforeEach
    public void setUp() {
        codec = new KeyCodec();
        registry = new KeyRegistry(codec);
    }

    @Test
    public void testFreshRegistryIsUninitialized() {
        for (VirtualKey key : VirtualKey.values()) {
            assertEquals(BindingState.UNINITIALIZED, registry.getState(key));
            assertEquals(0, registry.count(key));
        }
        assertTrue(registry.isUninitializedAny());
        assertFalse(registry.isUndefinedAny());
        assertNull(registry.lookup('a'));
    }

    @Test
    public void testAssignThenLookupThenRemove() {
        int[] codes = { 'a', KeyCodes.ESCAPE, KeyCodes.KEY_UP, KeyCodes.keyF(3), codec.nameToCode("é") };
        for (int code : codes) {
            assertEquals(AssignResult.OK, registry.assign(code, VirtualKey.ADD_ITEM));
            assertEquals(VirtualKey.ADD_ITEM, registry.lookup(code));
            registry.remove(code, VirtualKey.ADD_ITEM);
            assertNull(registry.lookup(code), "key " + code + " should be unbound");
        }
    }

    @Test
    public void testConflictLeavesExistingBinding() {
        assertEquals(AssignResult.OK, registry.assign('a', VirtualKey.ADD_ITEM));
        assertEquals(AssignResult.CONFLICT, registry.assign('a', VirtualKey.DEL_ITEM));
        assertEquals(VirtualKey.ADD_ITEM, registry.lookup('a'));
        assertEquals(BindingState.UNINITIALIZED, registry.getState(VirtualKey.DEL_ITEM));
        assertEquals(1, registry.count(VirtualKey.ADD_ITEM));
    }

    @Test
    public void testConflictForMultibyteKey() {
        int key = codec.nameToCode("ü");
        assertEquals(AssignResult.OK, registry.assign(key, VirtualKey.MOVE_UP));
        assertEquals(AssignResult.CONFLICT, registry.assign(key, VirtualKey.MOVE_DOWN));
        assertEquals(VirtualKey.MOVE_UP, registry.lookup(key));
    }

    @Test
    public void testSameKeyTwiceForSameActionIsRefused() {
        registry.assign('a', VirtualKey.ADD_ITEM);
        assertEquals(AssignResult.CONFLICT, registry.assign('a', VirtualKey.ADD_ITEM));
        assertEquals(1, registry.count(VirtualKey.ADD_ITEM));
    }

    @Test
    public void testRemoveOneOfTwoKeys() {
        registry.assign('a', VirtualKey.ADD_ITEM);
        registry.assign('A', VirtualKey.ADD_ITEM);

        registry.remove('A', VirtualKey.ADD_ITEM);

        assertEquals(1, registry.count(VirtualKey.ADD_ITEM));
        assertEquals("a", registry.first(VirtualKey.ADD_ITEM));
        assertEquals(BindingState.BOUND, registry.getState(VirtualKey.ADD_ITEM));
        assertNull(registry.lookup('A'));
    }

    @Test
    public void testRemovingLastKeyLeavesActionUndefined() {
        registry.assign('?', VirtualKey.GENERIC_HELP);
        registry.remove('?', VirtualKey.GENERIC_HELP);

        assertEquals(BindingState.UNDEFINED, registry.getState(VirtualKey.GENERIC_HELP));
        assertEquals(0, registry.count(VirtualKey.GENERIC_HELP));
        assertEquals(KeyRegistry.NO_KEY, registry.first(VirtualKey.GENERIC_HELP));
        assertEquals(KeyRegistry.UNDEFINED, registry.all(VirtualKey.GENERIC_HELP));
        assertTrue(registry.isUndefinedAny());
    }

    @Test
    public void testRemoveIsIdempotent() {
        registry.assign('x', VirtualKey.GENERIC_EXPORT);
        registry.remove('x', VirtualKey.GENERIC_EXPORT);
        registry.remove('x', VirtualKey.GENERIC_EXPORT);
        registry.remove(KeyCodes.NONE, VirtualKey.GENERIC_EXPORT);
        assertNull(registry.lookup('x'));
        assertEquals(BindingState.UNDEFINED, registry.getState(VirtualKey.GENERIC_EXPORT));
    }

    @Test
    public void testQueriesKeepInsertionOrder() {
        registry.assign('s', VirtualKey.GENERIC_SAVE);
        registry.assign('S', VirtualKey.GENERIC_SAVE);
        registry.assign(0x13, VirtualKey.GENERIC_SAVE);

        assertEquals(3, registry.count(VirtualKey.GENERIC_SAVE));
        assertEquals("s", registry.first(VirtualKey.GENERIC_SAVE));
        assertEquals("S", registry.nth(VirtualKey.GENERIC_SAVE, 1));
        assertEquals("^S", registry.nth(VirtualKey.GENERIC_SAVE, 2));
        assertNull(registry.nth(VirtualKey.GENERIC_SAVE, 3));
        assertNull(registry.nth(VirtualKey.GENERIC_SAVE, -1));
        assertEquals("s S ^S", registry.all(VirtualKey.GENERIC_SAVE));
        assertEquals(List.of("s", "S", "^S"), registry.keys(VirtualKey.GENERIC_SAVE));
    }

    @Test
    public void testAssigningNoKeyMarksUndefined() {
        assertEquals(AssignResult.OK, registry.assign(KeyCodes.NONE, VirtualKey.REPEAT_ITEM));
        assertEquals(BindingState.UNDEFINED, registry.getState(VirtualKey.REPEAT_ITEM));

        // A later key replaces the undefined state
        registry.assign('r', VirtualKey.REPEAT_ITEM);
        assertEquals(BindingState.BOUND, registry.getState(VirtualKey.REPEAT_ITEM));
        assertEquals("r", registry.all(VirtualKey.REPEAT_ITEM));
    }

    @Test
    public void testMarkUndefinedDoesNotTouchBoundAction() {
        registry.assign('r', VirtualKey.REPEAT_ITEM);
        registry.markUndefined(VirtualKey.REPEAT_ITEM);
        assertEquals(BindingState.BOUND, registry.getState(VirtualKey.REPEAT_ITEM));
    }

    @Test
    public void testKeysWithoutNameAreInvalid() {
        assertEquals(AssignResult.INVALID, registry.assign(0, VirtualKey.ADD_ITEM));
        assertEquals(AssignResult.INVALID, registry.assign(KeyCodes.UNICODE_OFFSET + 'a', VirtualKey.ADD_ITEM));
        assertEquals(AssignResult.INVALID, registry.assign('a', null));
        assertEquals(BindingState.UNINITIALIZED, registry.getState(VirtualKey.ADD_ITEM));
    }

    @Test
    public void testNegativeLookup() {
        assertNull(registry.lookup(KeyCodes.NONE));
        assertNull(registry.lookup(-1000));
    }

    @Test
    public void testQueriesOnUnboundKeyResult() {
        VirtualKey none = registry.lookup('z');
        assertNull(none);

        assertEquals(0, registry.count(none));
        assertEquals(KeyRegistry.NO_KEY, registry.first(none));
        assertNull(registry.nth(none, 0));
        assertEquals(KeyRegistry.UNDEFINED, registry.all(none));
        assertTrue(registry.keys(none).isEmpty());
        assertEquals(BindingState.UNDEFINED, registry.getState(none));

        registry.markUndefined(none);
        assertFalse(registry.isUndefinedAny());
        assertTrue(registry.isUninitializedAny());
    }

    @Test
    public void testUndefinedAndUninitializedScans() {
        for (VirtualKey key : VirtualKey.values()) {
            registry.assign(KeyCodes.NONE, key);
        }
        assertFalse(registry.isUninitializedAny());
        assertTrue(registry.isUndefinedAny());

        for (VirtualKey key : VirtualKey.values()) {
            registry.assign(KeyCodes.keyF(1 + key.index()), key);
        }
        assertFalse(registry.isUninitializedAny());
        assertFalse(registry.isUndefinedAny());
    }

    @Test
    public void testClear() {
        registry.assign('a', VirtualKey.ADD_ITEM);
        registry.assign(codec.nameToCode("ß"), VirtualKey.DEL_ITEM);
        registry.clear();

        assertNull(registry.lookup('a'));
        assertNull(registry.lookup(codec.nameToCode("ß")));
        assertEquals(BindingState.UNINITIALIZED, registry.getState(VirtualKey.ADD_ITEM));
        assertTrue(registry.isUninitializedAny());
    }

    @Test
    public void testConcurrentAssignmentKeepsKeysUnique() throws InterruptedException {
        List<Thread> threads = new ArrayList<>();
        int[] wins = new int[VirtualKey.count()];
        for (VirtualKey key : VirtualKey.values()) {
            Thread t = new Thread(() -> {
                for (int cp = 0x100; cp < 0x300; cp++) {
                    if (registry.assign(KeyCodes.UNICODE_OFFSET + cp, key).isOk()) {
                        wins[key.index()]++;
                    }
                }
            });
            threads.add(t);
            t.start();
        }
        for (Thread t : threads) {
            t.join();
        }

        int total = 0;
        for (VirtualKey key : VirtualKey.values()) {
            assertEquals(wins[key.index()], registry.count(key));
            total += wins[key.index()];
        }
        assertEquals(0x200, total);
        for (int cp = 0x100; cp < 0x300; cp++) {
            VirtualKey owner = registry.lookup(KeyCodes.UNICODE_OFFSET + cp);
            assertNotNull(owner);
            assertTrue(registry.keys(owner).contains(new String(Character.toChars(cp))));
        }
    }
}
