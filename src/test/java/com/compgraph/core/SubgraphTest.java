package com.compgraph.core;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.Assert.*;

public class SubgraphTest {

    private static NodeHandle h(int i) {
        return new NodeHandle(i);
    }

    @Test
    public void testSortsAndDeduplicates() {
        Subgraph s = Subgraph.of(Arrays.asList(h(5), h(1), h(3), h(1), h(5)));
        assertEquals(List.of(h(1), h(3), h(5)), s.handles());
        assertEquals(3, s.size());
        assertEquals(h(1), s.first());
        assertEquals(h(5), s.last());
    }

    @Test
    public void testContains() {
        Subgraph s = Subgraph.of(h(2), h(4));
        assertTrue(s.contains(h(4)));
        assertFalse(s.contains(h(3)));
    }

    @Test
    public void testRange() {
        Subgraph s = Subgraph.range(2, 5);
        assertEquals(List.of(h(2), h(3), h(4)), s.handles());
        assertTrue(Subgraph.range(3, 3).isEmpty());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testHandlesAreUnmodifiable() {
        Subgraph.of(h(0)).handles().add(h(1));
    }

    @Test(expected = NoSuchElementException.class)
    public void testEmptyHasNoFirst() {
        Subgraph.empty().first();
    }

    @Test
    public void testEquality() {
        assertEquals(Subgraph.of(h(1), h(0)), Subgraph.range(0, 2));
        assertNotEquals(Subgraph.of(h(1)), Subgraph.of(h(2)));
    }
}
