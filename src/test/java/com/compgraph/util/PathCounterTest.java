package com.compgraph.util;

import com.compgraph.core.Graph;
import com.compgraph.core.NodeHandle;
import com.compgraph.node.Sum;
import com.compgraph.node.Variable;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class PathCounterTest {

    private static NodeHandle chain(Graph g, int n) {
        List<NodeHandle> all = new ArrayList<>();
        all.add(g.append(new Variable()));
        for (int i = 1; i < n; i++)
            all.add(g.append(new Sum(all)));
        return all.get(n - 1);
    }

    @Test
    public void testFourPathsToD() {
        // a -> b -> c -> d
        // a -> b ------> d
        // a ------> c -> d
        // a -----------> d
        Graph g = new Graph();
        NodeHandle a = g.append(new Variable());
        NodeHandle b = g.append(Sum.of(a));
        NodeHandle c = g.append(Sum.of(a, b));
        NodeHandle d = g.append(Sum.of(a, b, c));
        assertEquals(4, PathCounter.countPaths(g, d));
        assertEquals(1, PathCounter.countPaths(g, a));
    }

    @Test
    public void testChainGrowsExponentially() {
        Graph g = new Graph();
        NodeHandle last = chain(g, 40);
        assertEquals(1L << 38, PathCounter.countPaths(g, last));
    }

    @Test(expected = ArithmeticException.class)
    public void testOverflowDetected() {
        Graph g = new Graph();
        NodeHandle last = chain(g, 70);
        PathCounter.countPaths(g, last);
    }
}
