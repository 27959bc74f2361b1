package com.neurosim.graph.engine;

import com.neurosim.graph.api.NodeId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strongly connected components of the non-feedback subgraph (Tarjan,
 * O(V + E)).
 *
 * Edges explicitly marked feedback are left out entirely, which is what
 * splits an otherwise cyclic group across several consideration sets.
 * Unmarked cycles stay whole and end up in one set.
 *
 * The traversal is iterative so deep chains cannot overflow the stack.
 */
public final class CycleAnalyzer {
    private CycleAnalyzer() {
        // Utility class
    }

    /**
     * Result of the analysis.
     *
     * @param components  components in discovery order; members of each in
     *                    graph insertion order
     * @param componentOf component index of every node
     */
    public record Components(List<Set<NodeId>> components, Map<NodeId, Integer> componentOf) {

        public int count() {
            return components.size();
        }

        public Set<NodeId> componentContaining(NodeId node) {
            return components.get(componentOf.get(node));
        }

        public boolean inCycle(NodeId node) {
            return componentContaining(node).size() > 1;
        }
    }

    public static Components analyze(DependencyGraph graph) {
        List<NodeId> order = new ArrayList<>(graph.nodes());
        Map<NodeId, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++)
            position.put(order.get(i), i);

        int n = order.size();
        int[] index = new int[n];
        int[] lowLink = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        List<List<Integer>> found = new ArrayList<>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != -1)
                continue;
            // Frames: node plus an iterator over its remaining children.
            Deque<Integer> callNodes = new ArrayDeque<>();
            Deque<Iterator<NodeId>> callIters = new ArrayDeque<>();
            index[root] = lowLink[root] = counter++;
            stack.push(root);
            onStack[root] = true;
            callNodes.push(root);
            callIters.push(graph.children(order.get(root)).iterator());

            while (!callNodes.isEmpty()) {
                int v = callNodes.peek();
                Iterator<NodeId> it = callIters.peek();
                if (it.hasNext()) {
                    int w = position.get(it.next());
                    if (index[w] == -1) {
                        index[w] = lowLink[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        callNodes.push(w);
                        callIters.push(graph.children(order.get(w)).iterator());
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], index[w]);
                    }
                    continue;
                }
                callNodes.pop();
                callIters.pop();
                if (!callNodes.isEmpty()) {
                    int parent = callNodes.peek();
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
                if (lowLink[v] == index[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    found.add(component);
                }
            }
        }

        // Tarjan emits components in reverse topological order; flip them so
        // discovery order follows the graph, and sort members by insertion.
        Collections.reverse(found);
        List<Set<NodeId>> components = new ArrayList<>(found.size());
        Map<NodeId, Integer> componentOf = new HashMap<>();
        for (List<Integer> members : found) {
            Collections.sort(members);
            Set<NodeId> set = new LinkedHashSet<>();
            for (int m : members) {
                set.add(order.get(m));
                componentOf.put(order.get(m), components.size());
            }
            components.add(Collections.unmodifiableSet(set));
        }
        return new Components(Collections.unmodifiableList(components), Collections.unmodifiableMap(componentOf));
    }
}
