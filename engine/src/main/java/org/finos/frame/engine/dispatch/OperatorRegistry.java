package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.execution.Backend;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.Literal;
import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.time.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry of operator implementations for the five hook families.
 *
 * <p>Implementations are selected by the runtime types of the node and its
 * arguments, preferring the most specific registered signature. Registration
 * is only allowed until the first lookup; after that the registry is frozen.
 *
 * <p>Missing implementations fall back as follows:
 * <ul>
 * <li>{@code execute_node}: {@link OperatorNotImplementedException}</li>
 * <li>{@code execute_literal}: the value as a scalar of the literal's type</li>
 * <li>{@code pre_execute}: an empty scope</li>
 * <li>{@code post_execute}: the value unchanged</li>
 * <li>{@code compute_time_context}: the node's range for every input</li>
 * </ul>
 *
 * Usage:
 * <pre>
 * OperatorRegistry registry = OperatorRegistry.create()
 *     .install(new FrameOperators())
 *     .install(new CsvOperators());
 * </pre>
 */
public final class OperatorRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorRegistry.class);

    private final Map<Hook, DispatchTable<?>> tables = new EnumMap<>(Hook.class);
    private final List<String> modules = new ArrayList<>();
    private volatile boolean frozen;

    private OperatorRegistry() {
        for (Hook hook : Hook.values()) {
            tables.put(hook, new DispatchTable<>(hook));
        }
    }

    /**
     * Creates an empty registry.
     */
    public static OperatorRegistry create() {
        return new OperatorRegistry();
    }

    /**
     * Returns the process-wide registry holding every {@link OperatorModule}
     * found on the class path.
     */
    public static OperatorRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Creates a registry with the modules visible to {@code classLoader}.
     */
    public static OperatorRegistry fromServiceLoader(ClassLoader classLoader) {
        OperatorRegistry registry = create();
        for (OperatorModule module : ServiceLoader.load(OperatorModule.class, classLoader)) {
            registry.install(module);
        }
        return registry;
    }

    public synchronized OperatorRegistry install(OperatorModule module) {
        checkNotFrozen();
        module.register(this);
        modules.add(module.getClass().getName());
        LOGGER.debug("Installed operator module {}", module.getClass().getName());
        return this;
    }

    // ==================== Registration ====================

    public synchronized <N extends Node> OperatorRegistry registerExecuteNode(
            Class<N> nodeType, List<Class<?>> argTypes, ExecuteNodeFunction<? super N> function) {
        register(Hook.EXECUTE_NODE, Signature.of(prepend(nodeType, argTypes)), function);
        return this;
    }

    /**
     * Registers a {@code pre_execute} implementation for a node type and the
     * exact list of backend types collaborating in the evaluation.
     */
    public synchronized <N extends Node> OperatorRegistry registerPreExecute(
            Class<N> nodeType, List<Class<? extends Backend>> backendTypes, PreExecuteFunction<? super N> function) {
        register(Hook.PRE_EXECUTE, Signature.of(prepend(nodeType, new ArrayList<>(backendTypes))), function);
        return this;
    }

    /**
     * Registers a {@code pre_execute} implementation applying whenever all
     * collaborating backends are of {@code backendType}.
     */
    public synchronized <N extends Node> OperatorRegistry registerPreExecuteAny(
            Class<N> nodeType, Class<? extends Backend> backendType, PreExecuteFunction<? super N> function) {
        register(Hook.PRE_EXECUTE, Signature.variadic(List.of(nodeType), backendType), function);
        return this;
    }

    public synchronized <N extends Node, V extends Value> OperatorRegistry registerPostExecute(
            Class<N> nodeType, Class<V> valueType, PostExecuteFunction<? super N, ? super V> function) {
        register(Hook.POST_EXECUTE, Signature.of(nodeType, valueType), function);
        return this;
    }

    public synchronized <N extends Node> OperatorRegistry registerTimeContext(
            Class<N> nodeType, TimeContextFunction<? super N> function) {
        register(Hook.COMPUTE_TIME_CONTEXT, Signature.of(nodeType), function);
        return this;
    }

    public synchronized <T> OperatorRegistry registerLiteral(Class<T> valueType, LiteralFunction<? super T> function) {
        register(Hook.EXECUTE_LITERAL, Signature.of(Literal.class, valueType), function);
        return this;
    }

    // ==================== Dispatch ====================

    /**
     * Computes a node's value.
     *
     * @throws OperatorNotImplementedException if nothing matches
     */
    @SuppressWarnings("unchecked")
    public Value executeNode(Node node, List<Object> args, ExecutionContext context) {
        List<Class<?>> runtime = Signature.runtimeTypes(node, args);
        ExecuteNodeFunction<Node> function = (ExecuteNodeFunction<Node>) lookup(Hook.EXECUTE_NODE, runtime)
                .orElseThrow(() -> new OperatorNotImplementedException(Hook.EXECUTE_NODE, runtime));
        Value value = function.execute(node, args, context);
        if (value == null) {
            throw new EvaluationException("Operator for " + node.getClass().getSimpleName() + " returned no value");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Scope preExecute(Node node, List<Backend> backends, ExecutionContext context) {
        Optional<?> function = lookup(Hook.PRE_EXECUTE, Signature.runtimeTypes(node, backends));
        if (function.isEmpty()) {
            return Scope.empty();
        }
        Scope scope = ((PreExecuteFunction<Node>) function.get()).preExecute(node, backends, context);
        return scope == null ? Scope.empty() : scope;
    }

    @SuppressWarnings("unchecked")
    public Value postExecute(Node node, Value value, ExecutionContext context) {
        Optional<?> function = lookup(Hook.POST_EXECUTE, Signature.runtimeTypes(node, List.of(value)));
        if (function.isEmpty()) {
            return value;
        }
        return ((PostExecuteFunction<Node, Value>) function.get()).postExecute(node, value, context);
    }

    @SuppressWarnings("unchecked")
    public List<TimeRange> computeTimeContext(Node node, TimeRange range, int inputCount) {
        Optional<?> function = lookup(Hook.COMPUTE_TIME_CONTEXT, List.of(node.getClass()));
        if (function.isEmpty()) {
            return Collections.nCopies(inputCount, range);
        }
        return ((TimeContextFunction<Node>) function.get()).computeTimeContext(node, range, inputCount);
    }

    /**
     * Evaluates a literal. Without a matching implementation the value is
     * wrapped as a scalar of the literal's declared type.
     */
    @SuppressWarnings("unchecked")
    public Value executeLiteral(Literal literal, ExecutionContext context) {
        List<Class<?>> runtime = List.of(Literal.class, Signature.typeOf(literal.value()));
        Optional<?> function = lookup(Hook.EXECUTE_LITERAL, runtime);
        if (function.isEmpty()) {
            return new ScalarValue(literal.value(), literal.type());
        }
        return ((LiteralFunction<Object>) function.get()).executeLiteral(literal, literal.value(), context);
    }

    // ==================== Introspection ====================

    /**
     * Number of lookups performed in a hook family since creation.
     */
    public long lookupCount(Hook hook) {
        return tables.get(hook).lookupCount();
    }

    /**
     * Number of implementations registered in a hook family.
     */
    public int implementationCount(Hook hook) {
        return tables.get(hook).size();
    }

    public boolean isFrozen() {
        return frozen;
    }

    public List<String> installedModules() {
        return List.copyOf(modules);
    }

    // ==================== Internals ====================

    @SuppressWarnings("unchecked")
    private <F> void register(Hook hook, Signature signature, F function) {
        checkNotFrozen();
        ((DispatchTable<F>) tables.get(hook)).register(signature, function);
    }

    private Optional<?> lookup(Hook hook, List<Class<?>> runtime) {
        if (!frozen) {
            synchronized (this) {
                frozen = true;
            }
        }
        return tables.get(hook).resolve(runtime);
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Operator registry is frozen after its first lookup");
        }
    }

    private static List<Class<?>> prepend(Class<?> first, List<? extends Class<?>> rest) {
        List<Class<?>> types = new ArrayList<>(rest.size() + 1);
        types.add(first);
        types.addAll(rest);
        return types;
    }

    private static final class GlobalHolder {
        private static final OperatorRegistry INSTANCE =
                fromServiceLoader(OperatorRegistry.class.getClassLoader());
    }
}
