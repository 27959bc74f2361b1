package com.neurosim.graph.engine;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.config.CompositionConfig;
import com.neurosim.graph.node.Matrix;
import com.neurosim.graph.node.Mechanism;
import com.neurosim.graph.node.Projection;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.*;

public class ConsiderationQueueTest {

    private Composition comp;
    private NodeId a, b, c, d, e;

    @Before
    public void setUp() {
        comp = new Composition("queue", CompositionConfig.defaults());
        a = add("A");
        b = add("B");
        c = add("C");
        d = add("D");
        e = add("E");
    }

    private NodeId add(String name) {
        return comp.addNode(Mechanism.builder(name).build());
    }

    private void link(NodeId from, NodeId to) {
        comp.addProjection(from, to);
    }

    private void feedback(NodeId from, NodeId to) {
        comp.addProjection(from, to, Matrix.identity(), true);
    }

    private List<Set<NodeId>> queue() {
        return comp.considerationQueue().asList();
    }

    @Test
    public void testFeedbackEdgeKeepsChainLevels() {
        comp.addLinearPathway(a, b, c, d, e);
        feedback(d, b);
        assertEquals(List.of(Set.of(a), Set.of(b), Set.of(c), Set.of(d), Set.of(e)), queue());
    }

    @Test
    public void testUnmarkedInnerLoopSharesSet() {
        comp.addLinearPathway(a, b, c, d, e);
        feedback(d, b);
        link(d, c);
        assertEquals(List.of(Set.of(a), Set.of(b), Set.of(c, d), Set.of(e)), queue());
    }

    @Test
    public void testUnmarkedOuterLoopSharesSet() {
        comp.addLinearPathway(a, b, c, d, e);
        link(d, b);
        feedback(d, c);
        assertEquals(List.of(Set.of(a), Set.of(b, c, d), Set.of(e)), queue());
    }

    @Test
    public void testOriginLoop() {
        comp.addLinearPathway(a, b, c, d, e);
        link(c, a);
        assertEquals(List.of(Set.of(a, b, c), Set.of(d), Set.of(e)), queue());

        NodeId newOrigin = add("new_origin");
        link(newOrigin, b);
        assertEquals(List.of(Set.of(newOrigin), Set.of(a, b, c), Set.of(d), Set.of(e)), queue());
    }

    @Test
    public void testTerminalLoop() {
        comp.addLinearPathway(a, b, c, d, e);
        link(e, c);
        assertEquals(List.of(Set.of(a), Set.of(b), Set.of(c, d, e)), queue());

        NodeId newTerminal = add("new_terminal");
        link(d, newTerminal);
        assertEquals(List.of(Set.of(a), Set.of(b), Set.of(c, d, e), Set.of(newTerminal)), queue());
    }

    @Test
    public void testSelfProjectionDoesNotAffectLevels() {
        comp.addLinearPathway(a, b);
        link(b, b);
        assertEquals(0, comp.considerationQueue().levelOf(a));
        assertEquals(1, comp.considerationQueue().levelOf(b));
    }

    @Test
    public void testRemovingProjectionRelevels() {
        comp.addLinearPathway(a, b, c, d, e);
        var back = comp.addProjection(d, b);
        assertEquals(3, comp.considerationQueue().size());
        comp.removeProjection(back);
        assertEquals(5, comp.considerationQueue().size());
    }

    @Test
    public void testRebuildIsIdempotent() {
        comp.addLinearPathway(a, b, c, d, e);
        ConsiderationQueue first = comp.considerationQueue();
        assertSame(first, comp.considerationQueue());
        DependencyGraph g = new DependencyGraph();
        for (NodeId n : comp.nodes())
            g.addNode(n);
        for (Projection p : comp.projections())
            g.addEdge(p.id(), p.sender().node(), p.receiver().node(), p.feedback());
        assertEquals(first.asList(), ConsiderationQueue.build(g).asList());
        assertEquals(first.asList(), ConsiderationQueue.build(g).asList());
    }

    @Test
    public void testRandomDagRespectsSenderBeforeReceiver() {
        Random rnd = new Random(42);
        Composition dag = new Composition("dag", CompositionConfig.defaults());
        NodeId[] nodes = new NodeId[40];
        for (int i = 0; i < nodes.length; i++)
            nodes[i] = dag.addNode(Mechanism.builder("N" + i).build());
        for (int i = 0; i < 120; i++) {
            int from = rnd.nextInt(nodes.length - 1);
            int to = from + 1 + rnd.nextInt(nodes.length - from - 1);
            dag.addProjection(nodes[from], nodes[to]);
        }
        ConsiderationQueue q = dag.considerationQueue();
        for (Projection p : dag.projections())
            assertTrue(p.toString(), q.levelOf(p.sender().node()) < q.levelOf(p.receiver().node()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLevelOfUnknownNode() {
        comp.considerationQueue().levelOf(new NodeId(99, "ghost"));
    }
}
