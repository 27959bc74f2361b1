package com.neurosim.graph.engine;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.NodeRole;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives node roles from the graph and its components.
 *
 * ORIGIN and TERMINAL are judged on the component graph: a node is ORIGIN
 * when no non-feedback edge enters its component from outside, TERMINAL when
 * none leaves it. A cycle without outside parents therefore makes every
 * member ORIGIN.
 */
public final class NodeRoleClassifier {
    private NodeRoleClassifier() {
        // Utility class
    }

    public static NodeRoles classify(DependencyGraph graph, CycleAnalyzer.Components components) {
        Map<NodeId, EnumSet<NodeRole>> roles = new LinkedHashMap<>();
        for (NodeId node : graph.nodes())
            roles.put(node, EnumSet.noneOf(NodeRole.class));

        for (NodeId node : graph.nodes()) {
            int comp = components.componentOf().get(node);
            EnumSet<NodeRole> r = roles.get(node);
            if (components.inCycle(node))
                r.add(NodeRole.CYCLE);
            if (!hasExternalParent(graph, components, comp))
                r.add(NodeRole.ORIGIN);
            if (!hasExternalChild(graph, components, comp))
                r.add(NodeRole.TERMINAL);
        }

        for (DependencyGraph.Edge e : graph.edges().values()) {
            if (e.feedback()) {
                roles.get(e.sender()).add(NodeRole.FEEDBACK_SENDER);
                roles.get(e.receiver()).add(NodeRole.FEEDBACK_RECEIVER);
            }
        }

        for (EnumSet<NodeRole> r : roles.values())
            if (r.isEmpty())
                r.add(NodeRole.INTERNAL);
        return new NodeRoles(roles);
    }

    private static boolean hasExternalParent(DependencyGraph graph, CycleAnalyzer.Components components, int comp) {
        for (NodeId member : components.components().get(comp))
            for (NodeId parent : graph.parents(member))
                if (components.componentOf().get(parent) != comp)
                    return true;
        return false;
    }

    private static boolean hasExternalChild(DependencyGraph graph, CycleAnalyzer.Components components, int comp) {
        for (NodeId member : components.components().get(comp))
            for (NodeId child : graph.children(member))
                if (components.componentOf().get(child) != comp)
                    return true;
        return false;
    }
}
