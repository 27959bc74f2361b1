package com.neurosim.graph.engine;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.NodeRole;
import com.neurosim.graph.config.CompositionConfig;
import com.neurosim.graph.node.Matrix;
import com.neurosim.graph.node.Mechanism;
import org.junit.Before;
import org.junit.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.Assert.*;

public class NodeRoleClassifierTest {

    private Composition comp;
    private NodeId a, b, c;

    @Before
    public void setUp() {
        comp = new Composition("roles", CompositionConfig.defaults());
        a = comp.addNode(Mechanism.builder("A").build());
        b = comp.addNode(Mechanism.builder("B").build());
        c = comp.addNode(Mechanism.builder("C").build());
        comp.addLinearPathway(a, b, c);
    }

    @Test
    public void testChainRoles() {
        assertEquals(Set.of(a), comp.nodesByRole(NodeRole.ORIGIN));
        assertEquals(Set.of(c), comp.nodesByRole(NodeRole.TERMINAL));
        assertEquals(Set.of(b), comp.nodesByRole(NodeRole.INTERNAL));
        assertTrue(comp.nodesByRole(NodeRole.CYCLE).isEmpty());
    }

    @Test
    public void testExplicitFeedbackRoles() {
        comp.addProjection(c, a, Matrix.identity(), true);
        assertEquals(Set.of(c), comp.nodesByRole(NodeRole.FEEDBACK_SENDER));
        assertEquals(Set.of(a), comp.nodesByRole(NodeRole.FEEDBACK_RECEIVER));
        assertTrue(comp.nodesByRole(NodeRole.CYCLE).isEmpty());
        assertEquals(EnumSet.of(NodeRole.ORIGIN, NodeRole.FEEDBACK_RECEIVER), comp.rolesOf(a));
        assertEquals(EnumSet.of(NodeRole.TERMINAL, NodeRole.FEEDBACK_SENDER), comp.rolesOf(c));
    }

    @Test
    public void testUnmarkedCycleRoles() {
        comp.addProjection(c, a);
        assertEquals(Set.of(a, b, c), comp.nodesByRole(NodeRole.CYCLE));
        assertTrue(comp.nodesByRole(NodeRole.FEEDBACK_SENDER).isEmpty());
        // Nothing enters or leaves the cycle, so every member is both ORIGIN and TERMINAL.
        assertEquals(Set.of(a, b, c), comp.nodesByRole(NodeRole.ORIGIN));
        assertEquals(Set.of(a, b, c), comp.nodesByRole(NodeRole.TERMINAL));
        assertTrue(comp.nodesByRole(NodeRole.INTERNAL).isEmpty());
    }

    @Test
    public void testNewParentDemotesOrigin() {
        NodeId x = comp.addNode(Mechanism.builder("X").build());
        assertTrue(comp.rolesOf(x).containsAll(EnumSet.of(NodeRole.ORIGIN, NodeRole.TERMINAL)));
        comp.addProjection(x, a);
        assertFalse(comp.rolesOf(a).contains(NodeRole.ORIGIN));
        assertEquals(EnumSet.of(NodeRole.INTERNAL), comp.rolesOf(a));
        assertEquals(EnumSet.of(NodeRole.ORIGIN), comp.rolesOf(x));
    }

    @Test
    public void testRoleConsistencyWithParentsAndChildren() {
        NodeId d = comp.addNode(Mechanism.builder("D").build());
        comp.addProjection(b, d);
        comp.addProjection(d, b, Matrix.identity(), true);
        comp.addProjection(d, d);
        for (NodeId n : comp.nodes()) {
            boolean noParents = comp.projections().stream().noneMatch(p -> !p.feedback()
                    && p.receiver().node().equals(n) && !p.sender().node().equals(n));
            boolean noChildren = comp.projections().stream().noneMatch(p -> !p.feedback()
                    && p.sender().node().equals(n) && !p.receiver().node().equals(n));
            assertEquals(n.name(), noParents, comp.rolesOf(n).contains(NodeRole.ORIGIN));
            assertEquals(n.name(), noChildren, comp.rolesOf(n).contains(NodeRole.TERMINAL));
        }
    }
}
