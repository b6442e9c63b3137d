package com.hpcwatch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class EntityUniverse {

    private final List<String> ids;
    private final Set<String> index;

    public EntityUniverse(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new IllegalArgumentException("Entity universe must not be empty");
        }
        this.index = Collections.unmodifiableSet(new LinkedHashSet<>(ids));
        this.ids = List.copyOf(index);
    }

    public static EntityUniverse generate(String prefix, int count, int padWidth) {
        if (count <= 0) {
            throw new IllegalArgumentException("Entity count must be positive: " + count);
        }
        List<String> ids = new ArrayList<>(count);
        String format = "%s%0" + Math.max(1, padWidth) + "d";
        for (int i = 1; i <= count; i++) {
            ids.add(String.format(format, prefix, i));
        }
        return new EntityUniverse(ids);
    }

    public List<String> ids() {
        return ids;
    }

    public boolean contains(String id) {
        return index.contains(id);
    }

    public int size() {
        return ids.size();
    }

    @Override
    public String toString() {
        return "EntityUniverse[" + ids.size() + " entities]";
    }
}
