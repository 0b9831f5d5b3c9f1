package com.compgraph.node;

import com.compgraph.core.Graph;
import com.compgraph.core.NodeHandle;
import com.compgraph.engine.Derivative;
import com.compgraph.engine.Differentiator;
import com.compgraph.engine.Evaluator;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * Product is not one of the three core kinds; these tests show it plugs into
 * the unchanged evaluator and differentiator.
 */
public class ProductTest {

    private Graph graph;
    private Evaluator evaluator;
    private Differentiator differentiator;
    private NodeHandle x;
    private NodeHandle y;

    @Before
    public void setUp() {
        graph = new Graph();
        evaluator = new Evaluator();
        differentiator = new Differentiator();
        x = graph.append(new Variable());
        y = graph.append(new Variable());
    }

    @Test
    public void testValue() {
        NodeHandle p = graph.append(Product.of(x, y));
        Map<NodeHandle, Double> values = evaluator.evaluate(graph, Map.of(x, 3.0, y, 4.0));
        assertEquals(12.0, values.get(p), 1e-12);
    }

    @Test
    public void testEmptyProductIsOne() {
        NodeHandle p = graph.append(Product.of());
        assertEquals(1.0, evaluator.evaluate(graph, Map.of(x, 0.0, y, 0.0)).get(p), 0.0);
    }

    @Test
    public void testProductRule() {
        NodeHandle p = graph.append(Product.of(x, y));
        Map<NodeHandle, Double> bindings = Map.of(x, 3.0, y, 4.0);
        Map<NodeHandle, Double> original = evaluator.evaluate(graph, bindings);

        // The derivative reads x and y, so seed the pass with the original values.
        Derivative dx = differentiator.differentiate(graph, p, Set.of(x));
        assertEquals(4.0, evaluator.evaluate(graph, dx.subgraph(), original).get(dx.handle()), 1e-12);
    }

    @Test
    public void testProductRuleAfterEarlierPasses() {
        NodeHandle p = graph.append(Product.of(x, y));
        Derivative dx = differentiator.differentiate(graph, p, Set.of(x));
        Derivative dy = differentiator.differentiate(graph, p, Set.of(y));
        Derivative both = differentiator.differentiate(graph, p, Set.of(x, y));

        // Later passes also differentiate earlier derivative nodes; a full
        // evaluation covers every reference.
        Map<NodeHandle, Double> values = evaluator.evaluate(graph, Map.of(x, 3.0, y, 4.0));
        assertEquals(4.0, values.get(dx.handle()), 1e-12);
        assertEquals(3.0, values.get(dy.handle()), 1e-12);
        assertEquals(7.0, values.get(both.handle()), 1e-12);
    }

    @Test
    public void testDerivativeIsSumOfProducts() {
        NodeHandle p = graph.append(Product.of(x, y));
        Derivative d = differentiator.differentiate(graph, p, Set.of(x));

        SumOfProducts node = (SumOfProducts) graph.node(d.handle());
        NodeHandle dxHandle = d.subgraph().handles().get(0);
        NodeHandle dyHandle = d.subgraph().handles().get(1);
        assertEquals(List.of(List.of(dxHandle, y), List.of(dyHandle, x)), node.terms());
    }

    @Test
    public void testSquareSecondDerivative() {
        // p = x * x, p' = 2x, p'' = 2
        NodeHandle p = graph.append(Product.of(x, x));
        Derivative first = differentiator.differentiate(graph, p, Set.of(x));
        Derivative second = differentiator.differentiate(graph, first.handle(), Set.of(x));

        Map<NodeHandle, Double> values = evaluator.evaluate(graph, Map.of(x, 3.0, y, 0.0));
        assertEquals(9.0, values.get(p), 1e-12);
        assertEquals(6.0, values.get(first.handle()), 1e-12);
        assertEquals(2.0, values.get(second.handle()), 1e-12);
    }

    @Test
    public void testSumOfProductsValue() {
        SumOfProducts sop = new SumOfProducts(List.of(List.of(x, y), List.of(x), List.of()));
        // x*y + x + 1
        assertEquals(2 * 5 + 2 + 1, sop.value(null, Map.of(x, 2.0, y, 5.0)), 1e-12);
        assertEquals(List.of(x, y), sop.children());
        assertEquals(0.0, new SumOfProducts(List.of()).value(null, Map.of()), 0.0);
    }
}
