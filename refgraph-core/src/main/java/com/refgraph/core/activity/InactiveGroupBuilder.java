package com.refgraph.core.activity;

import com.refgraph.core.model.ClassifiedOccurrence;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.model.Region;
import com.refgraph.core.model.RegionKind;
import com.refgraph.core.model.Span;
import com.refgraph.core.scanner.LineIndex;
import com.refgraph.core.scanner.RegionMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups inactive occurrences into removable comment extents.
 *
 * <p>A multi-line commented-out statement is one logical unit, so it is grouped as one. Each
 * inactive occurrence seeds an extent:
 * <ul>
 *   <li><b>Comment-marked line</b> (a line comment runs from the line's first non-blank text to
 *       its end): the run of contiguous comment-marked lines around it, as whole lines. The run
 *       stops at a blank line, a line that is not comment-marked, or a separator line holding
 *       nothing but the comment marker.</li>
 *   <li><b>Any other line comment</b>, such as one after code or one cut short by {@code ]]>}:
 *       the comment plus the whitespace before it.</li>
 *   <li><b>Block comment</b>: its whole lines when nothing else shares them, otherwise just the
 *       comment itself.</li>
 * </ul>
 *
 * <p>Occurrences straddling a comment boundary have no extent. Overlapping extents are merged,
 * and the resulting groups never overlap.
 */
public final class InactiveGroupBuilder {

    private static final String LINE_COMMENT_MARKER = "//";

    /**
     * Builds the inactive groups of one document.
     *
     * @param regions region map of the document
     * @param occurrences classified occurrences of the document
     * @return groups in document order
     */
    public List<InactiveGroup> build(RegionMap regions, List<ClassifiedOccurrence> occurrences) {
        List<Seed> seeds = new ArrayList<>();
        for (ClassifiedOccurrence occurrence : occurrences) {
            if (occurrence.isActive()) {
                continue;
            }
            Region region = regions.regionAt(occurrence.span().start());
            if (!region.kind().isComment() || !region.span().contains(occurrence.span())) {
                continue;
            }
            Span extent = region.kind() == RegionKind.LINE_COMMENT
                ? lineCommentExtent(regions, region)
                : blockCommentExtent(regions, region);
            seeds.add(new Seed(extent, occurrence));
        }
        seeds.sort(Comparator.comparing(Seed::extent));
        return merge(regions, seeds);
    }

    // ==================== Extents ====================

    private static Span lineCommentExtent(RegionMap regions, Region comment) {
        LineIndex lines = regions.lines();
        int line = lines.lineOf(comment.start());
        if (!isCommentMarked(regions, line)) {
            return new Span(skipBlanksBackward(regions.text(), lines.lineStart(line), comment.start()), comment.end());
        }

        int first = line;
        while (first > 1 && continuesRun(regions, first - 1)) {
            first--;
        }
        int last = line;
        while (last < lines.lineCount() && continuesRun(regions, last + 1)) {
            last++;
        }
        return new Span(lines.fullLine(first).start(), lines.fullLine(last).end());
    }

    private static Span blockCommentExtent(RegionMap regions, Region comment) {
        LineIndex lines = regions.lines();
        String text = regions.text();
        int firstLine = lines.lineOf(comment.start());
        int lastLine = lines.lineOf(comment.end());

        boolean aloneBefore = skipBlanksBackward(text, lines.lineStart(firstLine), comment.start()) == lines.lineStart(firstLine);
        boolean aloneAfter = text.substring(Math.min(comment.end(), lines.contentEnd(lastLine)), lines.contentEnd(lastLine)).isBlank();
        if (aloneBefore && aloneAfter) {
            return new Span(lines.fullLine(firstLine).start(), lines.fullLine(lastLine).end());
        }
        return comment.span();
    }

    private static boolean isCommentMarked(RegionMap regions, int line) {
        int first = regions.lines().firstNonBlank(line);
        if (first < 0) {
            return false;
        }
        Region region = regions.regionAt(first);
        return region.kind() == RegionKind.LINE_COMMENT
            && region.start() == first
            && region.end() >= regions.lines().contentEnd(line);
    }

    private static boolean continuesRun(RegionMap regions, int line) {
        return isCommentMarked(regions, line)
            && !regions.lines().content(line).strip().equals(LINE_COMMENT_MARKER);
    }

    private static int skipBlanksBackward(String text, int lineStart, int from) {
        int i = from;
        while (i > lineStart && (text.charAt(i - 1) == ' ' || text.charAt(i - 1) == '\t')) {
            i--;
        }
        return i;
    }

    // ==================== Merging ====================

    private static List<InactiveGroup> merge(RegionMap regions, List<Seed> sortedSeeds) {
        List<InactiveGroup> groups = new ArrayList<>();
        int i = 0;
        while (i < sortedSeeds.size()) {
            Span extent = sortedSeeds.get(i).extent();
            List<ClassifiedOccurrence> members = new ArrayList<>();
            members.add(sortedSeeds.get(i).occurrence());
            int j = i + 1;
            while (j < sortedSeeds.size() && sortedSeeds.get(j).extent().start() < extent.end()) {
                Span next = sortedSeeds.get(j).extent();
                extent = new Span(extent.start(), Math.max(extent.end(), next.end()));
                members.add(sortedSeeds.get(j).occurrence());
                j++;
            }
            members.sort(Comparator.comparing(ClassifiedOccurrence::span));
            LineIndex lines = regions.lines();
            groups.add(new InactiveGroup(
                regions.documentKey(),
                extent,
                lines.lineOf(extent.start()),
                lines.lineOf(Math.max(extent.start(), extent.end() - 1)),
                members));
            i = j;
        }
        return groups;
    }

    private record Seed(Span extent, ClassifiedOccurrence occurrence) {
    }
}
