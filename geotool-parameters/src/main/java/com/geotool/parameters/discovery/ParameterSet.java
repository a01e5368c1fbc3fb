package com.geotool.parameters.discovery;

import com.geotool.parameters.ToolParameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parameters of one tool, by slot id, in declaration order. Unmodifiable; the parameter objects
 * themselves stay mutable so tools and UIs can set values.
 */
public final class ParameterSet implements Iterable<ToolParameter> {

    private final Map<String, ToolParameter> bySlot;
    private final List<ToolParameter> ordered;

    ParameterSet(Map<String, ToolParameter> bySlot) {
        this.bySlot = Collections.unmodifiableMap(new LinkedHashMap<>(bySlot));
        this.ordered = List.copyOf(bySlot.values());
    }

    /** Parameters in declaration order. */
    public List<ToolParameter> asList() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }

    public boolean contains(String slotId) {
        return bySlot.containsKey(slotId);
    }

    /** The parameter of the slot, or null if the slot was not declared or was skipped. */
    public ToolParameter get(String slotId) {
        return bySlot.get(slotId);
    }

    /**
     * Typed lookup.
     *
     * @return the parameter, or null if the slot was not declared or was skipped
     * @throws IllegalArgumentException if the slot holds a different variant
     */
    public <T extends ToolParameter> T get(String slotId, Class<T> type) {
        ToolParameter p = bySlot.get(slotId);
        if (p == null) return null;
        if (!type.isInstance(p)) {
            throw new IllegalArgumentException("Parameter " + slotId + " is " + p.getClass().getSimpleName()
                    + ", not " + type.getSimpleName());
        }
        return type.cast(p);
    }

    /** Parameters of the given variant class, in declaration order. */
    public <T extends ToolParameter> List<T> ofType(Class<T> type) {
        return ordered.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    /** Copy sorted by declared index; ties keep declaration order. */
    public List<ToolParameter> sortedByIndex() {
        List<ToolParameter> copy = new ArrayList<>(ordered);
        copy.sort(Comparator.comparingInt(ToolParameter::getIndex));
        return copy;
    }

    @Override
    public Iterator<ToolParameter> iterator() {
        return ordered.iterator();
    }
}
