package com.neurosim.graph.util;

import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.NodeRole;
import com.neurosim.graph.engine.Composition;
import com.neurosim.graph.engine.ConsiderationQueue;
import com.neurosim.graph.node.Mechanism;
import com.neurosim.graph.node.MechanismState;
import com.neurosim.graph.node.ParameterPort;
import com.neurosim.graph.node.Projection;

import java.util.Set;

/**
 * Diagnostic utility for inspecting a composition's structure and the state
 * of its nodes.
 *
 * <p>
 * Generates human-readable text for debugging sessions and error logs.
 * Do <b>not</b> use on the hot path (allocates strings, iterates collections).
 */
public final class GraphExplain {
    private final Composition composition;

    public GraphExplain(Composition composition) {
        this.composition = composition;
    }

    /**
     * Dumps the consideration queue, one line per set.
     */
    public String dumpQueue() {
        ConsiderationQueue queue = composition.considerationQueue();
        StringBuilder sb = new StringBuilder(256);
        sb.append("Consideration queue (").append(queue.size()).append(" sets):\n");
        for (int i = 0; i < queue.size(); i++) {
            sb.append("  [").append(i).append("] ");
            appendNames(sb, queue.get(i));
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the nodes holding each role. Roles nobody holds are omitted.
     */
    public String dumpRoles() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Roles:\n");
        for (NodeRole role : NodeRole.values()) {
            Set<NodeId> nodes = composition.nodesByRole(role);
            if (nodes.isEmpty())
                continue;
            sb.append("  ").append(role).append(": ");
            appendNames(sb, nodes);
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps every projection in creation order.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Composition ").append(composition.name()).append(" (").append(composition.nodes().size())
                .append(" nodes, ").append(composition.projections().size()).append(" projections):\n");
        for (Projection p : composition.projections())
            sb.append("  ").append(p).append('\n');
        return sb.toString();
    }

    /**
     * Dumps configuration and current state of a single node in one context.
     */
    public String explainNode(NodeId node, ExecutionId id) {
        Mechanism m = composition.mechanism(node);
        MechanismState s = composition.state(node, id);
        StringBuilder sb = new StringBuilder(512);
        sb.append("Node: ").append(node.name()).append('\n')
                .append("  Level: ").append(composition.considerationQueue().levelOf(node)).append('\n')
                .append("  Roles: ").append(composition.rolesOf(node)).append('\n')
                .append("  Function: ").append(m.getFunction()).append('\n')
                .append("  Integrator mode: ").append(m.isIntegratorMode()).append('\n');
        if (m.hasTerminationThreshold())
            sb.append("  Termination: ").append(m.getTerminationMeasure()).append(' ')
                    .append(m.getTerminationComparison().symbol()).append(' ')
                    .append(m.getTerminationThreshold()).append('\n');
        sb.append("  Parameters:");
        for (ParameterPort p : m.getParameterPorts())
            sb.append(' ').append(p.name()).append('=').append(s.effectiveParameters().get(p.name()));
        sb.append('\n')
                .append("  Variable: ").append(Arrays2D.toString(s.variable())).append('\n')
                .append("  Value: ").append(Arrays2D.toString(s.value())).append('\n')
                .append("  Previous: ").append(Arrays2D.toString(s.previousValue())).append('\n')
                .append("  Outputs: ").append(Arrays2D.toString(s.publishedOutputs())).append('\n')
                .append("  Executions: ").append(s.executionCount())
                .append(", last iterations: ").append(s.lastIterations())
                .append(", finished: ").append(s.isFinished()).append('\n');
        return sb.toString();
    }

    private static void appendNames(StringBuilder sb, Set<NodeId> nodes) {
        sb.append('{');
        boolean first = true;
        for (NodeId n : nodes) {
            if (!first)
                sb.append(", ");
            sb.append(n.name());
            first = false;
        }
        sb.append('}');
    }
}
