package com.neurosim.graph.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lazily rebuilt view of the derived structures (components, queue, roles)
 * of a {@link DependencyGraph}. Mutations only bump the graph revision; the
 * next query rebuilds everything at once, so batches of edits cost one
 * rebuild.
 */
public final class GraphAnalysis {
    private static final Logger log = LogManager.getLogger(GraphAnalysis.class);

    private final DependencyGraph graph;
    private long analyzedRevision = -1;
    private CycleAnalyzer.Components components;
    private ConsiderationQueue queue;
    private NodeRoles roles;

    public GraphAnalysis(DependencyGraph graph) {
        this.graph = graph;
    }

    public CycleAnalyzer.Components components() {
        refresh();
        return components;
    }

    public ConsiderationQueue queue() {
        refresh();
        return queue;
    }

    public NodeRoles roles() {
        refresh();
        return roles;
    }

    public boolean isStale() {
        return analyzedRevision != graph.revision();
    }

    private void refresh() {
        if (!isStale())
            return;
        CycleAnalyzer.Components c = CycleAnalyzer.analyze(graph);
        ConsiderationQueue q = ConsiderationQueue.build(graph, c);
        NodeRoles r = NodeRoleClassifier.classify(graph, c);
        components = c;
        queue = q;
        roles = r;
        analyzedRevision = graph.revision();
        log.info("Graph revision {} analyzed: {} nodes, {} components, {} consideration sets",
                analyzedRevision, graph.nodeCount(), c.count(), q.size());
    }
}
