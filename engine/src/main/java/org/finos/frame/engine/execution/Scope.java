package org.finos.frame.engine.execution;

import org.eclipse.collections.api.block.HashingStrategy;
import org.eclipse.collections.impl.block.factory.HashingStrategies;
import org.eclipse.collections.impl.map.strategy.mutable.UnifiedMapWithHashingStrategy;
import org.finos.frame.engine.plan.RangeSensitiveLeaf;
import org.finos.frame.engine.time.TimeRange;
import org.finos.frame.engine.time.TimeRangeRelation;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Memo of evaluated values, keyed by node identity.
 *
 * <p>A scope is immutable: {@link #store} and {@link #merge} return new scopes.
 * Reads are range-aware, writes are not:
 * <ul>
 * <li>{@link #lookup} without a range returns whatever is stored.</li>
 * <li>{@link #lookup} with a range honours an entry only for
 * {@link RangeSensitiveLeaf} keys whose stored range contains the requested one.</li>
 * <li>{@link #merge} is a right-biased union that never compares ranges.</li>
 * </ul>
 *
 * Keys are usually nodes but raw operator inputs (scalars, backend handles) are
 * stored as well.
 */
public final class Scope {

    private static final HashingStrategy<Object> IDENTITY = HashingStrategies.identityStrategy();

    private static final Scope EMPTY = new Scope(UnifiedMapWithHashingStrategy.newMap(IDENTITY));

    private final UnifiedMapWithHashingStrategy<Object, ScopeEntry> entries;

    private Scope(UnifiedMapWithHashingStrategy<Object, ScopeEntry> entries) {
        this.entries = entries;
    }

    public static Scope empty() {
        return EMPTY;
    }

    /**
     * Creates a scope holding a single entry.
     */
    public static Scope of(Object key, Object value, TimeRange range) {
        return EMPTY.store(key, value, range);
    }

    /**
     * Looks up the value memoized for {@code key}.
     *
     * @param key   The node (or raw input) to look up
     * @param range The range the caller needs the value for, or {@code null}
     * @return the value if it may be reused for {@code range}
     */
    public Optional<Object> lookup(Object key, TimeRange range) {
        ScopeEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (range == null) {
            return Optional.of(entry.value());
        }
        // Aggregates and order-dependent operators give different answers over a
        // different slice of data, so only leaves are reused under a range.
        if (key instanceof RangeSensitiveLeaf && entry.range() != null
                && TimeRange.compare(range, entry.range()) == TimeRangeRelation.SUBSET) {
            return Optional.of(entry.value());
        }
        return Optional.empty();
    }

    /**
     * Returns the raw entry for {@code key}, ignoring ranges, or {@code null}.
     */
    public ScopeEntry entry(Object key) {
        return entries.get(key);
    }

    public boolean contains(Object key) {
        return entries.containsKey(key);
    }

    /**
     * Returns a scope with {@code key} bound to {@code value} for {@code range},
     * replacing any previous entry.
     */
    public Scope store(Object key, Object value, TimeRange range) {
        Objects.requireNonNull(key, "Scope key cannot be null");
        UnifiedMapWithHashingStrategy<Object, ScopeEntry> copy = copyEntries();
        copy.put(key, new ScopeEntry(value, range));
        return new Scope(copy);
    }

    /**
     * Right-biased union: entries of {@code other} win over entries of this scope.
     */
    public Scope merge(Scope other) {
        if (other == null || other.entries.isEmpty()) {
            return this;
        }
        if (entries.isEmpty()) {
            return other;
        }
        UnifiedMapWithHashingStrategy<Object, ScopeEntry> copy = copyEntries();
        copy.putAll(other.entries);
        return new Scope(copy);
    }

    /**
     * Returns a scope holding only the entries whose key satisfies {@code predicate}.
     */
    public Scope retainKeys(Predicate<Object> predicate) {
        UnifiedMapWithHashingStrategy<Object, ScopeEntry> kept = UnifiedMapWithHashingStrategy.newMap(IDENTITY);
        entries.forEachKeyValue((key, entry) -> {
            if (predicate.test(key)) {
                kept.put(key, entry);
            }
        });
        return new Scope(kept);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private UnifiedMapWithHashingStrategy<Object, ScopeEntry> copyEntries() {
        UnifiedMapWithHashingStrategy<Object, ScopeEntry> copy = UnifiedMapWithHashingStrategy.newMap(IDENTITY);
        copy.putAll(entries);
        return copy;
    }

    @Override
    public String toString() {
        return "Scope(" + entries.size() + " entries)";
    }
}
