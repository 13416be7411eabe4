package org.finos.frame.engine.dispatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Implementations of one hook family keyed by signature, with a cache of
 * resolutions per runtime type list.
 *
 * @param <F> The function type of the hook family
 */
final class DispatchTable<F> {

    private final Hook hook;
    private final Map<Signature, F> implementations = new LinkedHashMap<>();
    private final Map<List<Class<?>>, Optional<F>> resolved = new ConcurrentHashMap<>();
    private final AtomicLong lookups = new AtomicLong();

    DispatchTable(Hook hook) {
        this.hook = hook;
    }

    void register(Signature signature, F implementation) {
        if (implementations.putIfAbsent(signature, implementation) != null) {
            throw new IllegalStateException("Duplicate " + hook + " implementation for " + signature);
        }
        resolved.clear();
    }

    /**
     * Finds the most specific implementation accepting the runtime types.
     *
     * @throws AmbiguousDispatchException if no single candidate is most specific
     */
    Optional<F> resolve(List<Class<?>> runtime) {
        lookups.incrementAndGet();
        return resolved.computeIfAbsent(List.copyOf(runtime), this::mostSpecific);
    }

    private Optional<F> mostSpecific(List<Class<?>> runtime) {
        List<Signature> candidates = new ArrayList<>();
        for (Signature signature : implementations.keySet()) {
            if (signature.accepts(runtime)) {
                candidates.add(signature);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        for (Signature candidate : candidates) {
            boolean best = true;
            for (Signature other : candidates) {
                if (other != candidate && !candidate.dominates(other, runtime.size())) {
                    best = false;
                    break;
                }
            }
            if (best) {
                return Optional.of(implementations.get(candidate));
            }
        }
        throw new AmbiguousDispatchException(hook, runtime, candidates);
    }

    long lookupCount() {
        return lookups.get();
    }

    int size() {
        return implementations.size();
    }
}
