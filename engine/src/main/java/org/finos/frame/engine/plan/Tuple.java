package org.finos.frame.engine.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable tuple of metadata passed to an operator as a single input.
 * Unlike a plain list, a tuple is handed to the operator's implementation as
 * an evaluated argument.
 */
public record Tuple(List<Object> items) {

    public Tuple {
        items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static Tuple of(Object... items) {
        List<Object> list = new ArrayList<>(items.length);
        Collections.addAll(list, items);
        return new Tuple(list);
    }

    public int size() {
        return items.size();
    }

    public Object get(int index) {
        return items.get(index);
    }
}
