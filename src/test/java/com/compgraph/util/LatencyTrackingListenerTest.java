package com.compgraph.util;

import com.compgraph.core.Graph;
import com.compgraph.core.NodeHandle;
import com.compgraph.engine.EvaluationException;
import com.compgraph.engine.Evaluator;
import com.compgraph.node.Sum;
import com.compgraph.node.Variable;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class LatencyTrackingListenerTest {

    private Graph graph;
    private NodeHandle x;
    private Evaluator evaluator;
    private LatencyTrackingListener latency;
    private CompositeEvaluationListener composite;

    @Before
    public void setUp() {
        graph = new Graph();
        x = graph.append(new Variable());
        graph.append(Sum.of(x, x));

        latency = new LatencyTrackingListener();
        composite = new CompositeEvaluationListener();
        composite.addForComposite(latency);
        evaluator = new Evaluator();
        evaluator.setListener(composite);
    }

    @Test
    public void testTracksPasses() {
        evaluator.evaluate(graph, Map.of(x, 1.0));
        evaluator.evaluate(graph, Map.of(x, 2.0));

        assertEquals(2, latency.getTotalPasses());
        assertEquals(2, latency.getLastNodesEvaluated());
        assertEquals(0, latency.getTotalErrors());
        assertTrue(latency.minLatencyNanos() <= latency.maxLatencyNanos());
        assertTrue(latency.dump().contains("Total Passes"));
    }

    @Test
    public void testCountsErrors() {
        try {
            evaluator.evaluate(graph, Map.of());
            fail("Expected EvaluationException");
        } catch (EvaluationException expected) {
            // counted below
        }
        assertEquals(1, latency.getTotalErrors());
        assertEquals(1, latency.getTotalPasses());
        assertEquals(0, latency.getLastNodesEvaluated());
    }

    @Test
    public void testReset() {
        evaluator.evaluate(graph, Map.of(x, 1.0));
        latency.reset();
        assertEquals(0, latency.getTotalPasses());
        assertEquals(0, latency.minLatencyNanos());
        assertEquals(0.0, latency.avgLatencyNanos(), 0.0);
    }

    @Test
    public void testCompositeFansOut() {
        LatencyTrackingListener second = new LatencyTrackingListener();
        composite.addForComposite(second);
        assertEquals(2, composite.size());

        evaluator.evaluate(graph, Map.of(x, 1.0));
        assertEquals(1, latency.getTotalPasses());
        assertEquals(1, second.getTotalPasses());
    }
}
