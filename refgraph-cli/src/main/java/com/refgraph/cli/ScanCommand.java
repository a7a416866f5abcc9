package com.refgraph.cli;

import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.report.JsonReportWriter;
import com.refgraph.core.report.ReportFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Command to classify every document of a project.
 *
 * <p>Runs the closure from the configured roots and prints reachable, orphan and missing
 * counts, the orphans split into comment and pure orphans, and missing targets with their
 * sources.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Scan current directory
 * refgraph scan
 *
 * # Scan one cabinet and keep a JSON report
 * refgraph scan ventcontent -D cabinet=SHD_03_1 --json reports/SHD_03_1.json
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Classify documents as reachable, orphan or missing",
    mixinStandardHelpOptions = true
)
public class ScanCommand extends CommandSupport {

    @Option(
        names = {"--json"},
        paramLabel = "FILE",
        description = "Also write the report as JSON"
    )
    private Path jsonOutput;

    @Option(
        names = {"--details"},
        description = "List inactive comment groups"
    )
    private boolean details;

    @Override
    protected String commandName() {
        return "scan";
    }

    @Override
    protected int execute(ProjectContext context) throws Exception {
        ClosureResult result = context.closure();
        System.out.println();
        System.out.print(ReportFormatter.formatClosure(result, details));

        if (jsonOutput != null) {
            JsonReportWriter.write(result, jsonOutput);
            System.out.println();
            System.out.println("✓ JSON report: " + jsonOutput.toAbsolutePath());
        }
        return 0;
    }
}
