package com.refgraph.core.activity;

import com.refgraph.core.model.Activity;
import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.Occurrence;
import com.refgraph.core.model.Region;
import com.refgraph.core.model.RegionKind;
import com.refgraph.core.scanner.RegionMap;

import java.util.List;

/**
 * Decides whether an occurrence counts as a live reference.
 *
 * <p>An occurrence is {@link Activity#ACTIVE} only if it was opened from code and no part of
 * its span lies in a comment. Any straddle across a comment boundary makes it
 * {@link Activity#INACTIVE}: a reference is only trusted when it is entirely uncommented.
 *
 * <p>Matches after a {@code //} on a line that also carries code are inactive as well; the
 * verdict depends on regions alone, never on what else shares the line.
 */
public final class ActivityClassifier {

    /**
     * Classifies one occurrence.
     *
     * @param occurrence occurrence to classify
     * @param regions region map of the occurrence's document
     * @return activity verdict
     */
    public Activity classify(Occurrence occurrence, RegionMap regions) {
        if (occurrence.containingKind() != RegionKind.CODE) {
            return Activity.INACTIVE;
        }
        for (Region region : regions.overlapping(occurrence.span())) {
            if (region.kind().isComment()) {
                return Activity.INACTIVE;
            }
        }
        return Activity.ACTIVE;
    }

    /**
     * Classifies every occurrence of a document.
     *
     * @param occurrences occurrences of one document
     * @param regions region map of that document
     * @return classified occurrences in input order
     */
    public List<ClassifiedOccurrence> classifyAll(List<Occurrence> occurrences, RegionMap regions) {
        return occurrences.stream()
            .map(o -> new ClassifiedOccurrence(o, classify(o, regions)))
            .toList();
    }
}
