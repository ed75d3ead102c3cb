package com.beacon.eventmodel;

import java.util.List;

/**
 * An ordered list of values.
 *
 * @param elements the elements in order; copied, so later changes to the source list are not seen
 */
public record ListValue(List<CanonicalValue> elements) implements CanonicalValue {

    private static final ListValue EMPTY = new ListValue(List.of());

    public ListValue {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static ListValue empty() {
        return EMPTY;
    }

    public static ListValue of(CanonicalValue... elements) {
        return new ListValue(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    public CanonicalValue get(int index) {
        return elements.get(index);
    }

    @Override
    public String kind() {
        return "list";
    }
}
