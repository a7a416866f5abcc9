package com.refgraph.core.model;

import java.util.Objects;

/**
 * An occurrence together with its activity verdict.
 *
 * @param occurrence the located match
 * @param activity active or inactive
 */
public record ClassifiedOccurrence(Occurrence occurrence, Activity activity) {

    /**
     * Compact constructor with validation.
     */
    public ClassifiedOccurrence {
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        Objects.requireNonNull(activity, "activity must not be null");
    }

    public boolean isActive() {
        return activity == Activity.ACTIVE;
    }

    public ReferenceTarget target() {
        return occurrence.target();
    }

    public String documentKey() {
        return occurrence.documentKey();
    }

    public Span span() {
        return occurrence.span();
    }
}
