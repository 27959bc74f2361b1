package com.neurosim.graph.engine;

import com.neurosim.graph.api.GraphStructureException;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.ProjectionId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable scheduling graph: one vertex per mechanism, one edge per
 * projection. Edges carry connectivity and the feedback flag only, never
 * values.
 *
 * Every mutation bumps {@link #revision()} so derived structures (queue,
 * roles) can be rebuilt lazily. Iteration order is insertion order
 * throughout, which keeps every derived structure deterministic.
 */
public final class DependencyGraph {

    /** Node-level edge mirroring a projection. */
    public record Edge(ProjectionId id, NodeId sender, NodeId receiver, boolean feedback) {

        public boolean isSelfLoop() {
            return sender.equals(receiver);
        }
    }

    private final Set<NodeId> nodes = new LinkedHashSet<>();
    private final Map<ProjectionId, Edge> edges = new LinkedHashMap<>();
    private final Map<NodeId, Set<Edge>> outgoing = new LinkedHashMap<>();
    private final Map<NodeId, Set<Edge>> incoming = new LinkedHashMap<>();
    private long revision;

    public void addNode(NodeId node) {
        if (!nodes.add(node))
            throw new GraphStructureException("Node already in graph: " + node);
        outgoing.put(node, new LinkedHashSet<>());
        incoming.put(node, new LinkedHashSet<>());
        revision++;
    }

    /**
     * Removes a node and every edge touching it.
     *
     * @return The removed edges.
     */
    public Set<Edge> removeNode(NodeId node) {
        requireNode(node);
        Set<Edge> removed = new LinkedHashSet<>(outgoing.get(node));
        removed.addAll(incoming.get(node));
        for (Edge e : removed)
            unlink(e);
        nodes.remove(node);
        outgoing.remove(node);
        incoming.remove(node);
        revision++;
        return removed;
    }

    public Edge addEdge(ProjectionId id, NodeId sender, NodeId receiver, boolean feedback) {
        requireNode(sender);
        requireNode(receiver);
        if (edges.containsKey(id))
            throw new GraphStructureException("Edge already in graph: " + id);
        Edge e = new Edge(id, sender, receiver, feedback);
        edges.put(id, e);
        outgoing.get(sender).add(e);
        incoming.get(receiver).add(e);
        revision++;
        return e;
    }

    public Edge removeEdge(ProjectionId id) {
        Edge e = edges.get(id);
        if (e == null)
            throw new GraphStructureException("Unknown edge: " + id);
        unlink(e);
        revision++;
        return e;
    }

    private void unlink(Edge e) {
        edges.remove(e.id());
        outgoing.get(e.sender()).remove(e);
        incoming.get(e.receiver()).remove(e);
    }

    private void requireNode(NodeId node) {
        if (!nodes.contains(node))
            throw new GraphStructureException("Unknown node: " + node);
    }

    public boolean contains(NodeId node) {
        return nodes.contains(node);
    }

    public Set<NodeId> nodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public Map<ProjectionId, Edge> edges() {
        return Collections.unmodifiableMap(edges);
    }

    public Set<Edge> outgoing(NodeId node) {
        requireNode(node);
        return Collections.unmodifiableSet(outgoing.get(node));
    }

    public Set<Edge> incoming(NodeId node) {
        requireNode(node);
        return Collections.unmodifiableSet(incoming.get(node));
    }

    /** Distinct receivers of the node's non-feedback edges, self excluded. */
    public Set<NodeId> children(NodeId node) {
        Set<NodeId> out = new LinkedHashSet<>();
        for (Edge e : outgoing(node))
            if (!e.feedback() && !e.isSelfLoop())
                out.add(e.receiver());
        return out;
    }

    /** Distinct senders of the node's non-feedback edges, self excluded. */
    public Set<NodeId> parents(NodeId node) {
        Set<NodeId> in = new LinkedHashSet<>();
        for (Edge e : incoming(node))
            if (!e.feedback() && !e.isSelfLoop())
                in.add(e.sender());
        return in;
    }

    public long revision() {
        return revision;
    }
}
