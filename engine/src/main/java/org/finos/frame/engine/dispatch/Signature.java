package org.finos.frame.engine.dispatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The parameter types an implementation is registered for.
 *
 * A signature has fixed leading types and an optional variadic type matching
 * any number of trailing arguments. A {@code null} argument has runtime type
 * {@link Void}, which {@code Object} and {@code Void} accept.
 *
 * @param types    Fixed parameter types
 * @param variadic Type of any further arguments, or null
 */
public record Signature(List<Class<?>> types, Class<?> variadic) {

    public Signature {
        types = List.copyOf(Objects.requireNonNull(types, "Signature types cannot be null"));
    }

    public static Signature of(Class<?>... types) {
        return new Signature(Arrays.asList(types), null);
    }

    public static Signature of(List<Class<?>> types) {
        return new Signature(types, null);
    }

    /**
     * Creates a signature whose trailing arguments all match {@code variadic}.
     */
    public static Signature variadic(List<Class<?>> types, Class<?> variadic) {
        return new Signature(types, Objects.requireNonNull(variadic, "Variadic type cannot be null"));
    }

    /**
     * The runtime types of the given arguments.
     */
    public static List<Class<?>> runtimeTypes(Object first, List<?> rest) {
        List<Class<?>> runtime = new ArrayList<>(rest.size() + 1);
        runtime.add(typeOf(first));
        for (Object arg : rest) {
            runtime.add(typeOf(arg));
        }
        return runtime;
    }

    public static Class<?> typeOf(Object arg) {
        return arg == null ? Void.class : arg.getClass();
    }

    /**
     * Whether an invocation with these runtime types may use this signature.
     */
    public boolean accepts(List<Class<?>> runtime) {
        if (variadic == null ? runtime.size() != types.size() : runtime.size() < types.size()) {
            return false;
        }
        for (int i = 0; i < runtime.size(); i++) {
            if (!typeAt(i).isAssignableFrom(runtime.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether this signature is strictly preferred over {@code other} for an
     * invocation of {@code arity} arguments both accept.
     */
    boolean dominates(Signature other, int arity) {
        if (!atLeastAsSpecificAs(other, arity)) {
            return false;
        }
        return !other.atLeastAsSpecificAs(this, arity) || (variadic == null && other.variadic != null);
    }

    private boolean atLeastAsSpecificAs(Signature other, int arity) {
        for (int i = 0; i < arity; i++) {
            if (!other.typeAt(i).isAssignableFrom(typeAt(i))) {
                return false;
            }
        }
        return true;
    }

    private Class<?> typeAt(int position) {
        return position < types.size() ? types.get(position) : variadic;
    }

    @Override
    public String toString() {
        String fixed = types.stream().map(Class::getSimpleName).collect(Collectors.joining(", "));
        if (variadic == null) {
            return "(" + fixed + ")";
        }
        return "(" + fixed + (types.isEmpty() ? "" : ", ") + variadic.getSimpleName() + "...)";
    }
}
