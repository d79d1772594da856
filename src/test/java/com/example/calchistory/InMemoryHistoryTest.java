package com.example.calchistory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryHistoryTest {

    private InMemoryHistory history;

    @BeforeEach
    void setUp() {
        history = new InMemoryHistory();
    }

    @Test
    void storesEntriesInOrder() {
        history.record("2 + 2 = 4");
        history.record("5 - 3 = 2");
        assertEquals(List.of("2 + 2 = 4", "5 - 3 = 2"), history.getLast(2));
        assertEquals(2, history.size());
    }

    @Test
    void getLastReturnsMostRecentOldestFirst() {
        history.record("e1");
        history.record("e2");
        history.record("e3");
        assertEquals(List.of("e2", "e3"), history.getLast(2));
    }

    @Test
    void getLastMoreThanAvailable() {
        history.record("1 + 1 = 2");
        assertEquals(List.of("1 + 1 = 2"), history.getLast(5));
    }

    @Test
    void emptyHistoryAndZeroCount() {
        assertTrue(history.getLast(1).isEmpty());
        history.record("1 + 1 = 2");
        assertTrue(history.getLast(0).isEmpty());
    }

    @Test
    void negativeCountRejected() {
        assertThrows(IllegalArgumentException.class, () -> history.getLast(-1));
    }

    @Test
    void nullEntryRejected() {
        assertThrows(NullPointerException.class, () -> history.record(null));
    }

    @Test
    void noCapacityLimit() {
        for (int i = 0; i < 10000; i++) {
            history.record("1 + 1 = 2");
        }
        assertEquals(10000, history.getLast(10000).size());
    }

    @Test
    void returnedListIsASnapshot() {
        history.record("a");
        List<String> last = history.getLast(1);
        history.record("b");
        assertEquals(List.of("a"), last);
        assertThrows(UnsupportedOperationException.class, () -> last.add("c"));
    }
}
