package org.Aayush.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilIDMapperTest {

    @Test
    @DisplayName("Baseline Correctness: indices follow input order")
    void testOrderedMapping() {
        IDMapper mapper = IDMapper.ofOrdered(List.of("ORD-7", "ORD-3", "ORD-9"));

        assertEquals(0, mapper.toInternal("ORD-7"));
        assertEquals(2, mapper.toInternal("ORD-9"));
        assertEquals("ORD-3", mapper.toExternal(1));

        assertTrue(mapper.containsExternal("ORD-3"));
        assertFalse(mapper.containsExternal("ORD-1"));
        assertFalse(mapper.containsExternal(null));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Empty input yields an empty mapper")
    void testEmptyMapping() {
        IDMapper mapper = IDMapper.ofOrdered(List.of());
        assertEquals(0, mapper.size());
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(0));
    }

    @Test
    @DisplayName("Exception Path: unknown external id")
    void testUnknownExternalId() {
        IDMapper mapper = IDMapper.ofOrdered(List.of("A", "B"));
        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal("Z"));
        assertThrows(IllegalArgumentException.class, () -> mapper.toInternal(null));
    }

    @Test
    @DisplayName("Exception Path: internal index out of bounds")
    void testInvalidInternalId() {
        IDMapper mapper = IDMapper.ofOrdered(List.of("A", "B"));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(2));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Constructor Validation: duplicate ids are rejected")
    void testDuplicateRejected() {
        IDMapper.DuplicateIDException ex = assertThrows(
                IDMapper.DuplicateIDException.class,
                () -> IDMapper.ofOrdered(List.of("A", "B", "A"))
        );
        assertTrue(ex.getMessage().contains("position 2"));
    }

    @Test
    @DisplayName("Constructor Validation: null and blank ids are rejected")
    void testBlankRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(null));
        assertThrows(IllegalArgumentException.class, () -> IDMapper.ofOrdered(Arrays.asList("A", null)));
        assertThrows(IllegalArgumentException.class, () -> IDMapper.ofOrdered(List.of("A", "  ")));
    }

    @Test
    @DisplayName("Concurrency: parallel reads are consistent")
    void testConcurrentReads() throws InterruptedException {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            ids.add("D" + i);
        }
        IDMapper mapper = IDMapper.ofOrdered(ids);
        AtomicInteger failures = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            executor.submit(() -> {
                for (int i = 0; i < ids.size(); i++) {
                    if (mapper.toInternal("D" + i) != i || !mapper.toExternal(i).equals("D" + i)) {
                        failures.incrementAndGet();
                    }
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(0, failures.get());
    }
}
