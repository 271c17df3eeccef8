package com.cdm.modelgraph.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One multi-valued field of a selector: either the ALL wildcard or an
 * explicit, ordered set of driver names (possibly empty). {@code text} is the
 * field as it appeared in the driver string and takes no part in equality.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldSelection {

    public static final FieldSelection ALL = new FieldSelection(true, Collections.emptySet(), "ALL");
    public static final FieldSelection NONE = new FieldSelection(false, Collections.emptySet(), "None");

    boolean wildcard;
    Set<String> values;

    @EqualsAndHashCode.Exclude
    String text;

    public static FieldSelection of(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return NONE;
        }
        Set<String> values = Collections.unmodifiableSet(new LinkedHashSet<>(names));
        return new FieldSelection(false, values, String.join(",", values));
    }

    public static FieldSelection of(String... names) {
        return of(Arrays.asList(names));
    }

    public static FieldSelection parsed(String text, boolean wildcard, Collection<String> names) {
        Set<String> values = wildcard || names.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(names));
        return new FieldSelection(wildcard, values, text);
    }

    public boolean isEmpty() {
        return !wildcard && values.isEmpty();
    }
}
