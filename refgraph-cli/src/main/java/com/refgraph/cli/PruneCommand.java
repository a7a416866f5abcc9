package com.refgraph.cli;

import com.refgraph.core.config.ConfigLoader;
import com.refgraph.core.config.ProjectConfig;
import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.prune.PruneOptions;
import com.refgraph.core.prune.PruneResult;
import com.refgraph.core.prune.PruningExecutor;
import com.refgraph.core.report.JsonReportWriter;
import com.refgraph.core.report.ReportFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command to delete orphans and dead material.
 *
 * <p>Dry run by default: every action is printed but nothing changes until {@code --apply} is
 * given. Each kind of action can be switched off.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Preview
 * refgraph prune ventcontent -D cabinet=SHD_03_1
 *
 * # Delete orphans only
 * refgraph prune ventcontent -D cabinet=SHD_03_1 --no-dead-blocks --no-dedup --apply
 * }</pre>
 */
@Command(
    name = "prune",
    description = "Delete orphans, dead comment blocks and duplicate declarations (dry run unless --apply)",
    mixinStandardHelpOptions = true
)
public class PruneCommand extends CommandSupport {

    @Option(names = "--apply", description = "Apply the changes instead of only listing them")
    private boolean apply;

    @Option(names = "--orphans", negatable = true, description = "Delete orphan documents (default: from config)")
    private Boolean orphans;

    @Option(names = "--dead-blocks", negatable = true, description = "Remove commented-out blocks mentioning only orphans")
    private Boolean deadBlocks;

    @Option(names = "--dedup", negatable = true, description = "Remove repeated declarations")
    private Boolean dedup;

    @Option(names = "--candidates", paramLabel = "GLOB", description = "Limit deletable orphans (overrides config; repeatable)")
    private List<String> candidates;

    @Option(names = "--json", paramLabel = "FILE", description = "Also write the result as JSON")
    private Path jsonOutput;

    @Override
    protected String commandName() {
        return "prune";
    }

    @Override
    protected int execute(ProjectContext context) throws IOException {
        ClosureResult closure = context.closure();
        PruneOptions options = options(context.config());

        System.out.println(apply ? "Applying changes" : "Running in dry-run mode (nothing will be changed)");
        PruneResult result = new PruningExecutor(context.analyzer())
            .execute(closure, context.store(), context.store(), options);
        System.out.println();
        System.out.print(ReportFormatter.formatPrune(result));

        if (jsonOutput != null) {
            JsonReportWriter.write(result, jsonOutput);
            System.out.println("✓ JSON report: " + jsonOutput.toAbsolutePath());
        }

        boolean failed = result.diagnostics().stream().anyMatch(d -> d.kind() == DiagnosticKind.MUTATION_FAILED
            || d.kind() == DiagnosticKind.CLOSURE_DID_NOT_CONVERGE);
        return failed ? 1 : 0;
    }

    PruneOptions options(ProjectConfig config) {
        ProjectConfig.PruneConfig prune = config.prune();
        List<String> scope = candidates == null
            ? config.candidates()
            : candidates.stream().map(c -> ConfigLoader.substitute(c, config.variables())).toList();
        return new PruneOptions(
            orphans != null ? orphans : prune.deleteOrphans(),
            deadBlocks != null ? deadBlocks : prune.removeDeadBlocks(),
            dedup != null ? dedup : prune.deduplicateDeclarations(),
            apply,
            scope);
    }
}
