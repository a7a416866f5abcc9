package com.refgraph.core.report;

import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.graph.MissingReference;
import com.refgraph.core.model.Diagnostic;
import com.refgraph.core.model.InactiveGroup;
import com.refgraph.core.model.SourceLocation;
import com.refgraph.core.prune.PruneAction;
import com.refgraph.core.prune.PruneResult;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Plain-text rendering of closure and pruning results.
 *
 * <p>Output is deterministic: every list is in key or offset order.
 */
public final class ReportFormatter {

    private static final String RULE = "=".repeat(70);

    private ReportFormatter() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Renders a closure summary with orphans and diagnostics.
     *
     * @param result closure result
     * @param detailed whether to list inactive groups
     * @return report text
     */
    public static String formatClosure(ClosureResult result, boolean detailed) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("Reachability report").append('\n');
        sb.append(RULE).append('\n');
        sb.append("Roots:       ").append(result.roots().size()).append('\n');
        sb.append("Reachable:   ").append(result.reachable().size()).append('\n');
        sb.append("Orphan:      ").append(result.orphans().size())
            .append(" (").append(result.commentOrphans().size()).append(" comment, ")
            .append(result.pureOrphans().size()).append(" pure)").append('\n');
        sb.append("Missing:     ").append(result.missing().size()).append('\n');
        sb.append("Rounds:      ").append(result.iterations())
            .append(result.converged() ? "" : " (did not converge)").append('\n');

        section(sb, "Comment orphans", result.commentOrphans());
        section(sb, "Pure orphans", result.pureOrphans());
        if (!result.converged()) {
            section(sb, "Unvisited", result.unvisited());
        }
        if (!result.missingReferences().isEmpty()) {
            sb.append('\n').append(formatMissing(result));
        }
        if (detailed && !result.inactiveGroups().isEmpty()) {
            sb.append('\n').append("Inactive groups:").append('\n');
            for (InactiveGroup group : result.inactiveGroups()) {
                sb.append("  ").append(group.documentKey()).append(':').append(group.firstLine());
                if (group.lastLine() != group.firstLine()) {
                    sb.append('-').append(group.lastLine());
                }
                sb.append(' ').append(group.extent()).append(" -> ").append(group.targets()).append('\n');
            }
        }
        appendDiagnostics(sb, result.diagnostics());
        return sb.toString();
    }

    /**
     * Renders missing targets with their sources and, one level up, who references each source.
     *
     * @param result closure result
     * @return report text
     */
    public static String formatMissing(ClosureResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Missing targets:").append('\n');
        for (MissingReference missing : result.missingReferences()) {
            sb.append("  [x] ").append(missing.target()).append('\n');
            for (SourceLocation source : missing.sources()) {
                sb.append("      <- ").append(source).append('\n');
            }
            for (Map.Entry<String, SortedSet<String>> upstream : missing.upstream().entrySet()) {
                if (!upstream.getValue().isEmpty()) {
                    sb.append("         ").append(upstream.getKey()).append(" <- ")
                        .append(String.join(", ", upstream.getValue())).append('\n');
                }
            }
        }
        return sb.toString();
    }

    /**
     * Renders a pruning result.
     *
     * @param result pruning result
     * @return report text
     */
    public static String formatPrune(PruneResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(result.dryRun() ? "Planned (dry run):" : "Applied:").append('\n');
        if (result.planned().isEmpty()) {
            sb.append("  nothing to do").append('\n');
        }
        for (PruneAction action : result.dryRun() ? result.planned() : result.applied()) {
            sb.append("  ").append(action).append('\n');
        }
        int failed = result.planned().size() - result.applied().size();
        if (!result.dryRun() && failed > 0) {
            sb.append("  ").append(failed).append(" action(s) failed").append('\n');
        }
        appendDiagnostics(sb, result.diagnostics());
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, SortedSet<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        sb.append('\n').append(title).append(':').append('\n');
        keys.forEach(k -> sb.append("  ").append(k).append('\n'));
    }

    private static void appendDiagnostics(StringBuilder sb, List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        sb.append('\n').append("Diagnostics:").append('\n');
        diagnostics.forEach(d -> sb.append("  ").append(d).append('\n'));
    }
}
