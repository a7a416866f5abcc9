package com.refgraph.cli;

import com.refgraph.core.analysis.DocumentAnalyzer;
import com.refgraph.core.config.ConfigLoader;
import com.refgraph.core.config.ProjectConfig;
import com.refgraph.core.document.FileSystemDocumentStore;
import com.refgraph.core.graph.ClosureEngine;
import com.refgraph.core.graph.ClosureResult;
import com.refgraph.core.reference.ReferenceExtractor;
import com.refgraph.core.scanner.LexicalScanner;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.concurrent.Callable;

/**
 * Options and pipeline steps shared by the project commands.
 *
 * <p>Each command loads {@code refgraph.yaml}, opens the document store, and usually runs the
 * closure before doing its own work. Unexpected failures are logged and turned into exit code 1.
 */
public abstract class CommandSupport implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: refgraph.yaml)"
    )
    Path configPath = Paths.get("refgraph.yaml");

    @Option(
        names = "-D",
        paramLabel = "NAME=VALUE",
        description = "Set a configuration variable, e.g. -D cabinet=SHD_03_1"
    )
    Map<String, String> variables = new LinkedHashMap<>();

    @Option(
        names = {"-r", "--root"},
        paramLabel = "GLOB",
        description = "Root document pattern (overrides config; repeatable)"
    )
    List<String> roots;

    @Option(
        names = "--max-iterations",
        paramLabel = "N",
        description = "Closure round cap (overrides config; 0 = one round per document)"
    )
    Integer maxIterations;

    /**
     * Runs the command body.
     *
     * @param context loaded project
     * @return exit code
     * @throws Exception on unexpected failure
     */
    protected abstract int execute(ProjectContext context) throws Exception;

    /**
     * Name used in failure messages.
     *
     * @return command name
     */
    protected abstract String commandName();

    @Override
    public Integer call() {
        try {
            log.info("Starting {} of: {}", commandName(), projectPath.toAbsolutePath());
            return execute(openProject());
        } catch (Exception e) {
            log.error("{} failed", commandName(), e);
            System.err.println("✗ " + capitalize(commandName()) + " failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads the configuration and opens the document store.
     *
     * @return project context
     */
    ProjectContext openProject() {
        Path absoluteConfigPath = configPath.isAbsolute()
            ? configPath
            : projectPath.resolve(configPath);

        log.debug("Loading configuration from: {}", absoluteConfigPath);
        ProjectConfig loaded = ConfigLoader.load(absoluteConfigPath, variables);
        ProjectConfig rooted = roots == null || roots.isEmpty()
            ? loaded
            : loaded.withRoots(roots.stream().map(r -> ConfigLoader.substitute(r, loaded.variables())).toList());
        ProjectConfig config = maxIterations == null ? rooted : rooted.withMaxIterations(maxIterations);

        Path documentRoot = projectPath.resolve(config.documents().root()).normalize();
        FileSystemDocumentStore store = new FileSystemDocumentStore(
            documentRoot, config.documents().include(), config.documents().exclude());

        LexicalScanner scanner = LexicalScanner.forMarkup(config.patterns().singleQuotes());
        DocumentAnalyzer analyzer = new DocumentAnalyzer(scanner, new ReferenceExtractor(config.patterns().toPatterns()));
        return new ProjectContext(config, store, analyzer);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    /**
     * A loaded project.
     *
     * @param config resolved configuration
     * @param store document store
     * @param analyzer per-document analyzer
     */
    protected record ProjectContext(ProjectConfig config, FileSystemDocumentStore store, DocumentAnalyzer analyzer) {

        /**
         * Root keys selected by the configured patterns.
         *
         * @return root keys
         */
        SortedSet<String> rootKeys() {
            return ClosureEngine.keysMatching(config.roots(), store);
        }

        /**
         * Runs the closure from the configured roots.
         *
         * @return closure result
         * @throws IllegalStateException if no document matches the root patterns
         */
        ClosureResult closure() {
            SortedSet<String> rootKeys = rootKeys();
            if (rootKeys.isEmpty()) {
                throw new IllegalStateException("No root documents match " + config.roots()
                    + " under " + store.root());
            }
            System.out.println("Documents: " + store.keys().size() + ", roots: " + rootKeys.size());
            return new ClosureEngine(analyzer, config.closure().toOptions()).run(rootKeys, store);
        }
    }
}
