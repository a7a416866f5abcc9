package com.refgraph.cli;

import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.model.DiagnosticKind;
import com.refgraph.core.report.ReportFormatter;
import picocli.CommandLine.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to check that every active reference resolves.
 *
 * <p>Exits with 1 when a reachable document references a missing target, a root is missing, or
 * the closure did not converge, so it can gate a build.
 */
@Command(
    name = "validate",
    description = "Report missing reference targets; exit code 1 if any",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends CommandSupport {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Override
    protected String commandName() {
        return "validate";
    }

    @Override
    protected int execute(ProjectContext context) {
        ClosureResult result = context.closure();
        boolean missingRoot = result.diagnostics().stream().anyMatch(d -> d.kind() == DiagnosticKind.MISSING_ROOT);

        System.out.println();
        if (result.missingReferences().isEmpty() && !missingRoot && result.converged()) {
            System.out.println("✓ All " + result.reachable().size() + " reachable documents resolve");
            return 0;
        }

        if (!result.missingReferences().isEmpty()) {
            System.out.print(ReportFormatter.formatMissing(result));
        }
        if (missingRoot) {
            System.out.println("✗ Missing roots: " + result.missing().stream()
                .filter(result.roots()::contains).toList());
        }
        if (!result.converged()) {
            System.out.println("✗ Closure did not converge after " + result.iterations() + " round(s)");
        }
        log.info("Validation failed: {} missing target(s)", result.missingReferences().size());
        return 1;
    }
}
