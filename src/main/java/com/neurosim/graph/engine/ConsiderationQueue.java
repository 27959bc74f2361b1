package com.neurosim.graph.engine;

import com.neurosim.graph.api.GraphStructureException;
import com.neurosim.graph.api.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Leveled execution plan: an ordered list of consideration sets.
 *
 * Built by collapsing every strongly connected component into one vertex
 * and leveling the resulting DAG with Kahn's algorithm, where a vertex's
 * level is {@code 1 + max(level(parent))} and parentless vertices sit at
 * level 0. Each level is then expanded back into the nodes it holds.
 *
 * Invariants:
 * - for every non-feedback, non-self edge, level(sender) < level(receiver)
 * unless both are in the same component, in which case they share a level;
 * - nodes within a set appear in graph insertion order.
 *
 * Because levels depend only on ancestors, adding a node or edge never moves
 * nodes that are not downstream of the change.
 */
public final class ConsiderationQueue {
    private final List<Set<NodeId>> sets;
    private final Map<NodeId, Integer> levelOf;

    private ConsiderationQueue(List<Set<NodeId>> sets, Map<NodeId, Integer> levelOf) {
        this.sets = sets;
        this.levelOf = levelOf;
    }

    public static ConsiderationQueue build(DependencyGraph graph) {
        return build(graph, CycleAnalyzer.analyze(graph));
    }

    public static ConsiderationQueue build(DependencyGraph graph, CycleAnalyzer.Components components) {
        int c = components.count();

        // 1. Condensation edges between distinct components (deduplicated)
        List<Set<Integer>> forward = new ArrayList<>(c);
        for (int i = 0; i < c; i++)
            forward.add(new LinkedHashSet<>());
        for (DependencyGraph.Edge e : graph.edges().values()) {
            if (e.feedback() || e.isSelfLoop())
                continue;
            int from = components.componentOf().get(e.sender());
            int to = components.componentOf().get(e.receiver());
            if (from != to)
                forward.get(from).add(to);
        }

        // 2. In-degrees
        int[] inDegree = new int[c];
        for (Set<Integer> children : forward)
            for (int child : children)
                inDegree[child]++;

        // 3. Kahn's algorithm, tracking the longest path to each component
        int[] queue = new int[c];
        int head = 0, tail = 0;
        for (int i = 0; i < c; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;
        int[] level = new int[c];
        int maxLevel = -1;
        while (head < tail) {
            int curr = queue[head++];
            maxLevel = Math.max(maxLevel, level[curr]);
            for (int child : forward.get(curr)) {
                level[child] = Math.max(level[child], level[curr] + 1);
                if (--inDegree[child] == 0)
                    queue[tail++] = child;
            }
        }
        if (tail != c)
            throw new GraphStructureException("Condensation is not acyclic: processed " + tail + " of " + c
                    + " components");

        // 4. Expand levels back into node sets, in insertion order
        List<Set<NodeId>> levels = new ArrayList<>();
        for (int i = 0; i <= maxLevel; i++)
            levels.add(new LinkedHashSet<>());
        Map<NodeId, Integer> levelOf = new HashMap<>();
        for (NodeId node : graph.nodes()) {
            int l = level[components.componentOf().get(node)];
            levels.get(l).add(node);
            levelOf.put(node, l);
        }
        List<Set<NodeId>> frozen = new ArrayList<>(levels.size());
        for (Set<NodeId> s : levels)
            frozen.add(Collections.unmodifiableSet(s));
        return new ConsiderationQueue(Collections.unmodifiableList(frozen), Collections.unmodifiableMap(levelOf));
    }

    /** Number of consideration sets. */
    public int size() {
        return sets.size();
    }

    public Set<NodeId> get(int level) {
        return sets.get(level);
    }

    /**
     * Level of a node.
     *
     * @throws IllegalArgumentException if the node is not scheduled.
     */
    public int levelOf(NodeId node) {
        Integer l = levelOf.get(node);
        if (l == null)
            throw new IllegalArgumentException("Node not in queue: " + node);
        return l;
    }

    public List<Set<NodeId>> asList() {
        return sets;
    }

    /** All nodes in queue order. */
    public Set<NodeId> nodes() {
        Set<NodeId> all = new LinkedHashSet<>();
        for (Set<NodeId> s : sets)
            all.addAll(s);
        return all;
    }

    @Override
    public String toString() {
        return sets.toString();
    }
}
