package com.refgraph;

import com.refgraph.cli.GuardsCommand;
import com.refgraph.cli.PruneCommand;
import com.refgraph.cli.ScanCommand;
import com.refgraph.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for RefGraph.
 *
 * <p>RefGraph finds which panel and script documents of a project are reachable from a set of
 * root panels, reports missing and orphaned artifacts, and prunes dead material.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code scan} - Classify every document and print the reachability report</li>
 *   <li>{@code validate} - Report missing targets; fails when there are any</li>
 *   <li>{@code prune} - Delete orphans, dead comment blocks and duplicate declarations</li>
 *   <li>{@code guards} - Remove conditional blocks guarding undefined classes</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Report for one cabinet
 * refgraph scan ventcontent -D cabinet=SHD_03_1
 *
 * # Preview pruning, then apply it
 * refgraph prune ventcontent -D cabinet=SHD_03_1
 * refgraph prune ventcontent -D cabinet=SHD_03_1 --apply
 * }</pre>
 */
@Command(
    name = "refgraph",
    mixinStandardHelpOptions = true,
    version = "RefGraph 1.0.0-SNAPSHOT",
    description = "Artifact reachability and pruning for panel projects",
    subcommands = {
        ScanCommand.class,
        ValidateCommand.class,
        PruneCommand.class,
        GuardsCommand.class
    }
)
public class RefGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RefGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors", scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("RefGraph - Artifact reachability and pruning");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'refgraph --help' to see available commands");
        System.out.println("Use 'refgraph <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Creates the configured command line.
     *
     * @return command line with all subcommands
     */
    public static CommandLine commandLine() {
        RefGraphCLI cli = new RefGraphCLI();
        return new CommandLine(cli)
            .setExecutionStrategy(parseResult -> {
                cli.configureLogging();
                return new CommandLine.RunLast().execute(parseResult);
            });
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
