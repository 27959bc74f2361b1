package com.neurosim.graph.engine;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.NodeRole;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Role assignment of one graph revision.
 */
public final class NodeRoles {
    private final Map<NodeId, Set<NodeRole>> roles;

    NodeRoles(Map<NodeId, EnumSet<NodeRole>> roles) {
        Map<NodeId, Set<NodeRole>> copy = new LinkedHashMap<>();
        for (var e : roles.entrySet())
            copy.put(e.getKey(), Collections.unmodifiableSet(EnumSet.copyOf(e.getValue())));
        this.roles = Collections.unmodifiableMap(copy);
    }

    /**
     * Roles of a node.
     *
     * @throws IllegalArgumentException if the node is unknown.
     */
    public Set<NodeRole> rolesOf(NodeId node) {
        Set<NodeRole> r = roles.get(node);
        if (r == null)
            throw new IllegalArgumentException("Unknown node: " + node);
        return r;
    }

    public boolean hasRole(NodeId node, NodeRole role) {
        return rolesOf(node).contains(role);
    }

    /** Nodes holding the role, in graph insertion order. */
    public Set<NodeId> nodesWith(NodeRole role) {
        Set<NodeId> out = new LinkedHashSet<>();
        for (var e : roles.entrySet())
            if (e.getValue().contains(role))
                out.add(e.getKey());
        return Collections.unmodifiableSet(out);
    }

    @Override
    public String toString() {
        return roles.toString();
    }
}
