package com.refgraph.cli;

import com.refgraph.core.config.ProjectConfig;
import com.refgraph.core.graph.ClosureEngine;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.model.Document;
import com.refgraph.core.prune.GuardedBlockPruner;
import com.refgraph.core.prune.PruneResult;
import com.refgraph.core.report.ReportFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Command to remove conditional blocks that guard classes the governing script no longer
 * defines.
 *
 * <p>The known classes are the {@code class} definitions of the guards script plus the
 * configured protected names. Only candidate documents are edited; without candidates, every
 * document is.
 */
@Command(
    name = "guards",
    description = "Remove struct-guarded blocks for undefined classes (dry run unless --apply)",
    mixinStandardHelpOptions = true
)
public class GuardsCommand extends CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(GuardsCommand.class);

    @Option(names = "--script", paramLabel = "KEY", description = "Governing script key (overrides config)")
    private String script;

    @Option(names = "--apply", description = "Apply the changes instead of only listing them")
    private boolean apply;

    @Override
    protected String commandName() {
        return "guards";
    }

    @Override
    protected int execute(ProjectContext context) {
        ProjectConfig config = context.config();
        String scriptKey = script != null ? script : config.guards().script();
        if (scriptKey == null) {
            System.err.println("✗ No guards script given (--script or guards.script)");
            return 1;
        }
        Optional<Document> governing = context.store().find(scriptKey);
        if (governing.isEmpty()) {
            System.err.println("✗ Guards script not found: " + scriptKey);
            return 1;
        }

        Set<String> known = GuardedBlockPruner.knownNames(governing.get(), config.guards().protectedNames());
        log.info("{} known class(es) from {}", known.size(), scriptKey);
        System.out.println("Known classes (" + known.size() + "): " + String.join(", ", known));

        List<String> scope = config.candidates();
        SortedSet<String> keys = new TreeSet<>(scope.isEmpty()
            ? context.store().keys()
            : ClosureEngine.keysMatching(scope, context.store()));
        keys.remove(scriptKey);

        GuardedBlockPruner pruner = GuardedBlockPruner.structGuards();
        PruneResult result = pruner.execute(keys, context.store(), known, context.store(), apply);
        System.out.println();
        System.out.print(ReportFormatter.formatPrune(result));

        return result.diagnostics().stream().anyMatch(d -> d.kind() == DiagnosticKind.MUTATION_FAILED) ? 1 : 0;
    }
}
