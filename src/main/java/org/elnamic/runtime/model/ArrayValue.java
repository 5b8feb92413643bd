package org.elnamic.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * A mutable, ordered sequence of values. Two arrays are equal only if they are the same array.
 */
public final class ArrayValue implements Value {

    private final List<Value> elements;

    public ArrayValue(List<Value> elements) {
        this.elements = new ArrayList<>(elements);
    }

    public int size() {
        return elements.size();
    }

    public Value get(int index) {
        return elements.get(index);
    }

    public void set(int index, Value value) {
        elements.set(index, value);
    }

    public void add(Value value) {
        elements.add(value);
    }

    /**
     * @return A copy of the current elements; later mutation of the array does not affect it.
     */
    public List<Value> snapshot() {
        return List.copyOf(elements);
    }

    public List<Value> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public String kindName() {
        return "array";
    }

    /**
     * Renders the elements in brackets. An array reached again while it is being rendered
     * prints as {@code [...]}.
     */
    @Override
    public String toDisplayString() {
        return render(Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private String render(Set<ArrayValue> inProgress) {
        if (!inProgress.add(this)) {
            return "[...]";
        }
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Value element : elements) {
            if (element instanceof StringValue s) {
                joiner.add("\"" + s.value() + "\"");
            } else if (element instanceof ArrayValue nested) {
                joiner.add(nested.render(inProgress));
            } else {
                joiner.add(element.toDisplayString());
            }
        }
        inProgress.remove(this);
        return joiner.toString();
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
