package com.neurosim.graph.engine;

import com.neurosim.graph.api.ConfigurationException;
import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.ExecutionResult;
import com.neurosim.graph.api.GraphStructureException;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.NodeRole;
import com.neurosim.graph.api.PortId;
import com.neurosim.graph.api.PortKind;
import com.neurosim.graph.api.ProjectionId;
import com.neurosim.graph.api.SchedulerListener;
import com.neurosim.graph.condition.Condition;
import com.neurosim.graph.condition.Conditions;
import com.neurosim.graph.condition.SchedulingClock;
import com.neurosim.graph.config.CompositionConfig;
import com.neurosim.graph.fn.ModulationOperator;
import com.neurosim.graph.node.InputPort;
import com.neurosim.graph.node.Matrix;
import com.neurosim.graph.node.Mechanism;
import com.neurosim.graph.node.MechanismState;
import com.neurosim.graph.node.PortSpec;
import com.neurosim.graph.node.Projection;
import com.neurosim.graph.util.Arrays2D;
import com.neurosim.graph.util.CompositeSchedulerListener;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A network of mechanisms connected by projections, and the entry point for
 * running it.
 *
 * The composition is the arena: it owns mechanisms and projections and hands
 * out stable handles ({@link NodeId}, {@link ProjectionId}, {@link PortId}).
 * Relationships are index lookups, never object references between nodes.
 * Structural changes bump the scheduling graph's revision; the
 * consideration queue and roles are rebuilt on the next query.
 *
 * Run-time values live in execution contexts keyed by {@link ExecutionId},
 * so the same topology can be run under several keys without interference.
 *
 * The topology must not change while a run is in progress; mutators throw
 * {@link IllegalStateException} if called from a callback or listener.
 */
public final class Composition {
    private static final Logger log = LogManager.getLogger(Composition.class);

    private final String name;
    private final CompositionConfig config;
    private final List<Mechanism> mechanisms = new ArrayList<>();
    private final Map<String, NodeId> byName = new LinkedHashMap<>();
    private final Map<ProjectionId, Projection> projections = new LinkedHashMap<>();
    private final Map<PortId, List<Projection>> afferents = new HashMap<>();
    private final Map<NodeId, Condition> conditions = new HashMap<>();
    private final Map<ExecutionId, ExecutionContext> contexts = new HashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final GraphAnalysis analysis = new GraphAnalysis(graph);
    private final CompositeSchedulerListener listeners = new CompositeSchedulerListener();
    private final MechanismExecutor executor;
    private final TrialScheduler scheduler;
    private int nextProjection;
    private boolean running;

    public Composition(String name) {
        this(name, CompositionConfig.load());
    }

    public Composition(String name, CompositionConfig config) {
        this.name = name;
        this.config = config.validate();
        this.executor = new MechanismExecutor(config.getMaxExecutionsBeforeFinished(),
                config.getWarningThrottleMillis());
        this.scheduler = new TrialScheduler(this, executor, listeners, config.getMaxPassesPerTrial());
    }

    public String name() {
        return name;
    }

    public CompositionConfig config() {
        return config;
    }

    // --- Structure ---

    /**
     * Adds a mechanism and creates the projections declared by its input
     * port specs.
     *
     * @throws GraphStructureException if the name is taken or a declared
     *                                 projection is invalid; nothing is added
     *                                 in that case
     */
    public NodeId addNode(Mechanism mechanism) {
        checkNotRunning();
        if (byName.containsKey(mechanism.getName()))
            throw new GraphStructureException("Duplicate node name: " + mechanism.getName());
        NodeId id = new NodeId(mechanisms.size(), mechanism.getName());
        mechanisms.add(mechanism);
        byName.put(id.name(), id);
        graph.addNode(id);
        try {
            List<InputPort> ports = mechanism.getInputPorts();
            for (int p = 0; p < ports.size(); p++)
                for (PortSpec.ProjectionRef ref : ports.get(p).afferents())
                    addProjection(ref.sender(), PortId.input(id, p), ref.matrix(), ref.feedback());
        } catch (RuntimeException e) {
            removeNode(id);
            throw e;
        }
        return id;
    }

    /**
     * Removes a node together with every projection that touches it. Its
     * state is dropped from all execution contexts.
     */
    public void removeNode(NodeId node) {
        checkNotRunning();
        requireNode(node);
        for (DependencyGraph.Edge e : graph.removeNode(node))
            unlinkProjection(e.id());
        mechanisms.set(node.index(), null);
        byName.remove(node.name());
        conditions.remove(node);
        for (ExecutionContext ctx : contexts.values())
            ctx.forget(node);
    }

    /** Identity projection from the first output of one node to the first input of another. */
    public ProjectionId addProjection(NodeId sender, NodeId receiver) {
        return addProjection(sender, receiver, Matrix.identity(), false);
    }

    public ProjectionId addProjection(NodeId sender, NodeId receiver, Matrix matrix, boolean feedback) {
        return addProjection(PortId.output(sender, 0), PortId.input(receiver, 0), matrix, feedback);
    }

    /**
     * Adds a pathway projection.
     *
     * @param feedback true to exclude the edge from cycle and level
     *                 computation
     * @throws GraphStructureException if an endpoint is unknown or of the
     *                                 wrong kind, or the matrix does not fit
     */
    public ProjectionId addProjection(PortId sender, PortId receiver, Matrix matrix, boolean feedback) {
        checkNotRunning();
        int senderSize = outputSize(sender);
        if (receiver.kind() != PortKind.INPUT)
            throw new GraphStructureException("Pathway receiver must be an input port: " + receiver);
        Mechanism rm = requireNode(receiver.node());
        if (receiver.index() < 0 || receiver.index() >= rm.getInputPorts().size())
            throw new GraphStructureException("Unknown input port: " + receiver);
        matrix.checkDimensions(senderSize, rm.getInputPorts().get(receiver.index()).size());
        return link(new Projection(new ProjectionId(nextProjection), Projection.Kind.PATHWAY, sender, receiver,
                matrix, feedback, null));
    }

    /**
     * Adds a projection whose single-element output modulates a parameter of
     * another node.
     *
     * @throws GraphStructureException if the sender output has more than one
     *                                 element or the parameter is unknown
     */
    public ProjectionId addModulatoryProjection(PortId sender, NodeId receiver, String parameter,
            ModulationOperator operator) {
        checkNotRunning();
        int senderSize = outputSize(sender);
        if (senderSize != 1)
            throw new GraphStructureException("Modulatory sender " + sender + " must have one element, has "
                    + senderSize);
        Mechanism rm = requireNode(receiver);
        int index = rm.parameterIndex(parameter);
        if (index < 0)
            throw new GraphStructureException(receiver + " has no parameter " + parameter);
        return link(new Projection(new ProjectionId(nextProjection), Projection.Kind.MODULATORY, sender,
                PortId.parameter(receiver, index), Matrix.identity(), false, operator));
    }

    /** Chains the nodes with identity projections, first output to first input. */
    public List<ProjectionId> addLinearPathway(NodeId... nodes) {
        List<ProjectionId> ids = new ArrayList<>();
        for (int i = 1; i < nodes.length; i++)
            ids.add(addProjection(nodes[i - 1], nodes[i]));
        return ids;
    }

    public void removeProjection(ProjectionId id) {
        checkNotRunning();
        if (!projections.containsKey(id))
            throw new GraphStructureException("Unknown projection: " + id);
        graph.removeEdge(id);
        unlinkProjection(id);
    }

    private ProjectionId link(Projection p) {
        graph.addEdge(p.id(), p.sender().node(), p.receiver().node(), p.feedback());
        nextProjection++;
        projections.put(p.id(), p);
        afferents.computeIfAbsent(p.receiver(), k -> new ArrayList<>()).add(p);
        return p.id();
    }

    private void unlinkProjection(ProjectionId id) {
        Projection p = projections.remove(id);
        List<Projection> list = afferents.get(p.receiver());
        list.remove(p);
        if (list.isEmpty())
            afferents.remove(p.receiver());
    }

    private int outputSize(PortId sender) {
        if (sender.kind() != PortKind.OUTPUT)
            throw new GraphStructureException("Projection sender must be an output port: " + sender);
        Mechanism sm = requireNode(sender.node());
        if (sender.index() < 0 || sender.index() >= sm.getOutputPorts().size())
            throw new GraphStructureException("Unknown output port: " + sender);
        return sm.outputSize(sender.index());
    }

    /** Sets the firing condition of a node (default: always). */
    public void setCondition(NodeId node, Condition condition) {
        checkNotRunning();
        requireNode(node);
        conditions.put(node, condition);
    }

    // --- Lookups ---

    public NodeId node(String nodeName) {
        NodeId id = byName.get(nodeName);
        if (id == null)
            throw new GraphStructureException("Unknown node: " + nodeName);
        return id;
    }

    public Mechanism mechanism(NodeId node) {
        return requireNode(node);
    }

    public Set<NodeId> nodes() {
        return graph.nodes();
    }

    public Projection projection(ProjectionId id) {
        Projection p = projections.get(id);
        if (p == null)
            throw new GraphStructureException("Unknown projection: " + id);
        return p;
    }

    public Collection<Projection> projections() {
        return Collections.unmodifiableCollection(projections.values());
    }

    public PortId inputPort(NodeId node, String port) {
        int i = requireNode(node).inputIndex(port);
        if (i < 0)
            throw new GraphStructureException(node + " has no input port " + port);
        return PortId.input(node, i);
    }

    public PortId outputPort(NodeId node, String port) {
        int i = requireNode(node).outputIndex(port);
        if (i < 0)
            throw new GraphStructureException(node + " has no output port " + port);
        return PortId.output(node, i);
    }

    public PortId parameterPort(NodeId node, String parameter) {
        int i = requireNode(node).parameterIndex(parameter);
        if (i < 0)
            throw new GraphStructureException(node + " has no parameter " + parameter);
        return PortId.parameter(node, i);
    }

    List<Projection> afferentsOf(PortId port) {
        List<Projection> list = afferents.get(port);
        return list == null ? List.of() : list;
    }

    Condition conditionOf(NodeId node) {
        return conditions.getOrDefault(node, Conditions.always());
    }

    // --- Derived structure ---

    public ConsiderationQueue considerationQueue() {
        return analysis.queue();
    }

    public Set<NodeId> nodesByRole(NodeRole role) {
        return analysis.roles().nodesWith(role);
    }

    public Set<NodeRole> rolesOf(NodeId node) {
        requireNode(node);
        return analysis.roles().rolesOf(node);
    }

    public CycleAnalyzer.Components components() {
        return analysis.components();
    }

    // --- Execution ---

    public void addListener(SchedulerListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(SchedulerListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Runs trials in the request's execution context.
     *
     * @throws ConfigurationException if an input targets a node that is not
     *                                ORIGIN or a runtime parameter is unknown
     * @throws com.neurosim.graph.api.TrialExecutionException if a trial fails;
     *                                the context keeps the state it had
     *                                before that trial
     */
    public RunResult run(RunRequest request) {
        if (running)
            throw new IllegalStateException("Composition " + name + " is already running");
        validate(request);
        ExecutionContext ctx = context(request.executionId());
        running = true;
        long start = System.nanoTime();
        try {
            log.info("Running {} for {} trials in context {}", name, request.numTrials(), ctx.id());
            RunResult result = scheduler.run(ctx, request);
            log.info("Run of {} in context {} completed {} trials in {} ms", name, ctx.id(), result.size(),
                    (System.nanoTime() - start) / 1_000_000);
            return result;
        } finally {
            running = false;
        }
    }

    private void validate(RunRequest request) {
        Set<NodeId> origins = nodesByRole(NodeRole.ORIGIN);
        for (NodeId node : request.inputs().keySet()) {
            requireNode(node);
            if (!origins.contains(node))
                throw new ConfigurationException("Input given for " + node + ", which is not an ORIGIN node");
        }
        for (var e : request.runtimeParams().entrySet()) {
            Mechanism m = requireNode(e.getKey());
            for (String key : e.getValue().keySet())
                if (m.parameterIndex(key) < 0)
                    throw new ConfigurationException(e.getKey() + " has no parameter " + key);
        }
    }

    /**
     * Fires one node outside any trial, on an explicit variable. The new
     * outputs are published immediately.
     */
    public ExecutionResult execute(NodeId node, double[][] variable, Map<String, Double> runtimeParams,
            ExecutionId id) {
        checkNotRunning();
        Mechanism m = requireNode(node);
        return executor.execute(m, context(id).state(node, m), variable, runtimeParams);
    }

    /**
     * Resets a node's integrator and value in one context.
     *
     * @param value new value, or {@code null} for the mechanism's initial value
     */
    public void reinitialize(NodeId node, ExecutionId id, double[][] value) {
        checkNotRunning();
        Mechanism m = requireNode(node);
        executor.reinitialize(m, context(id).state(node, m), value);
    }

    public boolean isFinished(NodeId node, ExecutionId id) {
        MechanismState s = stateOrNull(node, id);
        return s != null && executor.isFinished(s);
    }

    /** Copy of a node's current value in a context. */
    public double[][] valueOf(NodeId node, ExecutionId id) {
        Mechanism m = requireNode(node);
        return Arrays2D.copy(context(id).state(node, m).value());
    }

    public double[][] valueOf(NodeId node) {
        return valueOf(node, ExecutionId.DEFAULT);
    }

    /** Copy of a node's published output-port values in a context. */
    public double[][] outputValuesOf(NodeId node, ExecutionId id) {
        Mechanism m = requireNode(node);
        return Arrays2D.copy(context(id).state(node, m).publishedOutputs());
    }

    /** Snapshot of a node's full state in a context. */
    public MechanismState state(NodeId node, ExecutionId id) {
        Mechanism m = requireNode(node);
        return context(id).state(node, m).copy();
    }

    public SchedulingClock clock(ExecutionId id) {
        return context(id).clock();
    }

    public Set<ExecutionId> executionIds() {
        return Collections.unmodifiableSet(contexts.keySet());
    }

    private MechanismState stateOrNull(NodeId node, ExecutionId id) {
        requireNode(node);
        ExecutionContext ctx = contexts.get(id);
        return ctx == null ? null : ctx.existingState(node);
    }

    private ExecutionContext context(ExecutionId id) {
        return contexts.computeIfAbsent(id, ExecutionContext::new);
    }

    private Mechanism requireNode(NodeId node) {
        if (node == null || node.index() < 0 || node.index() >= mechanisms.size())
            throw new GraphStructureException("Unknown node: " + node);
        Mechanism m = mechanisms.get(node.index());
        if (m == null || !graph.contains(node))
            throw new GraphStructureException("Unknown node: " + node);
        return m;
    }

    private void checkNotRunning() {
        if (running)
            throw new IllegalStateException("Composition " + name + " cannot change while a trial is running");
    }

    @Override
    public String toString() {
        return "Composition[" + name + ", " + graph.nodeCount() + " nodes, " + projections.size() + " projections]";
    }
}
