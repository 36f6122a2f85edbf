package com.endpointdoc.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Wire names pruned from a request body, in removal order.
 *
 * <p>Lookups ignore case, matching the way examples are stripped of pruned keys.
 */
public class RemovedFields {

    private final List<String> names = new ArrayList<>();
    private final Set<String> index = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    public void add(String name) {
        if (name != null && index.add(name)) {
            names.add(name);
        }
    }

    public boolean contains(String name) {
        return name != null && index.contains(name);
    }

    public List<String> names() {
        return Collections.unmodifiableList(names);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    @Override
    public String toString() {
        return String.join(", ", names);
    }
}
