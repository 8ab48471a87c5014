package com.coursepicker.coursepicker_api.solver.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * User constraints for one solve request.
 */
public final class Constraints {
    private final int targetCredits;
    private final Set<String> fields;
    private final Set<String> formats;

    public Constraints(int targetCredits, Collection<String> fields, Collection<String> formats) {
        if (targetCredits <= 0) {
            throw new IllegalArgumentException("Target credits must be positive, got " + targetCredits + ".");
        }
        this.targetCredits = targetCredits;
        this.fields = normalize(fields);
        this.formats = normalize(formats);
    }

    public static Constraints ofCredits(int targetCredits) {
        return new Constraints(targetCredits, Set.of(), Set.of());
    }

    private static Set<String> normalize(Collection<String> terms) {
        Set<String> result = new LinkedHashSet<>();
        if (terms != null) {
            for (String term : terms) {
                if (term != null && !term.isBlank()) {
                    result.add(term.trim());
                }
            }
        }
        return Set.copyOf(result);
    }

    // Getters
    public int getTargetCredits() { return targetCredits; }
    public Set<String> getFields() { return fields; }
    public Set<String> getFormats() { return formats; }

    @Override
    public String toString() {
        return "Constraints{targetCredits=" + targetCredits + ", fields=" + fields + ", formats=" + formats + '}';
    }
}
