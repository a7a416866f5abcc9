package com.refgraph.cli;

import ch.qos.logback.classic.Level;
import com.refgraph.RefGraphCLI;
import com.refgraph.core.config.ProjectConfig;
import com.refgraph.core.prune.PruneOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests running the subcommands against a project on disk.
 */
class RefGraphCommandsTest {

    private static final String CONFIG = """
        variables:
          cabinet: A
        roots: ["panels/vision/**"]
        candidates: ["panels/objects/objects_${cabinet}/**"]
        guards:
          script: "scripts/libs/struct_${cabinet}.ctl"
        """;

    @TempDir
    Path project;

    @BeforeEach
    void setUp() throws IOException {
        write("refgraph.yaml", CONFIG);
        write("panels/vision/main.xml", """
            open("objects/objects_A/used.xml");
            // open("objects/objects_A/dead.xml");
            """);
        write("panels/objects/objects_A/used.xml", "<panel/>");
        write("panels/objects/objects_A/dead.xml", "<panel/>");
        write("panels/objects/objects_A/lost.xml", "<panel/>");
        write("panels/objects/objects_B/other.xml", "<panel/>");
    }

    @AfterEach
    void resetLogging() {
        rootLogger().setLevel(Level.INFO);
    }

    @Test
    void quietFlag_beforeSubcommand_raisesRootLevelToError() {
        int exitCode = run("-q", "validate", project.toString());

        assertThat(exitCode).isZero();
        assertThat(rootLogger().getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void verboseFlag_beforeSubcommand_lowersRootLevelToDebug() {
        run("--verbose", "validate", project.toString());

        assertThat(rootLogger().getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void scan_writesJsonReport() {
        Path json = project.resolve("out/report.json");

        int exitCode = run("scan", project.toString(), "--json", json.toString());

        assertThat(exitCode).isZero();
        assertThat(json).exists();
        assertThat(contentOf(json)).contains("panels/objects/objects_A/lost.xml");
    }

    @Test
    void validate_allResolved_succeeds() {
        assertThat(run("validate", project.toString())).isZero();
    }

    @Test
    void validate_missingTarget_fails() throws IOException {
        write("panels/vision/broken.xml", "open(\"objects/objects_A/nowhere.xml\");");

        assertThat(run("validate", project.toString())).isEqualTo(1);
    }

    @Test
    void validate_noMatchingRoot_fails() {
        assertThat(run("validate", project.toString(), "--root", "panels/none/**")).isEqualTo(1);
    }

    @Test
    @DisplayName("prune without --apply leaves every file in place")
    void prune_dryRun_changesNothing() {
        int exitCode = run("prune", project.toString());

        assertThat(exitCode).isZero();
        assertThat(project.resolve("panels/objects/objects_A/dead.xml")).exists();
        assertThat(project.resolve("panels/objects/objects_A/lost.xml")).exists();
        assertThat(contentOf(project.resolve("panels/vision/main.xml"))).contains("dead.xml");
    }

    @Test
    void prune_apply_deletesCandidateOrphansAndDeadBlocks() {
        int exitCode = run("prune", project.toString(), "--apply");

        assertThat(exitCode).isZero();
        assertThat(project.resolve("panels/objects/objects_A/dead.xml")).doesNotExist();
        assertThat(project.resolve("panels/objects/objects_A/lost.xml")).doesNotExist();
        assertThat(project.resolve("panels/objects/objects_A/used.xml")).exists();
        // outside the candidate scope
        assertThat(project.resolve("panels/objects/objects_B/other.xml")).exists();
        assertThat(contentOf(project.resolve("panels/vision/main.xml")))
            .contains("used.xml")
            .doesNotContain("dead.xml");
    }

    @Test
    void prune_variableOverride_changesCandidateScope() {
        int exitCode = run("prune", project.toString(), "-D", "cabinet=B", "--apply");

        assertThat(exitCode).isZero();
        assertThat(project.resolve("panels/objects/objects_B/other.xml")).doesNotExist();
        assertThat(project.resolve("panels/objects/objects_A/lost.xml")).exists();
    }

    @Test
    void prune_negatedFlags_overrideConfig() {
        PruneCommand command = new PruneCommand();
        new CommandLine(command).parseArgs(".", "--no-orphans", "--no-dedup", "--candidates", "panels/x_${cabinet}/**");

        PruneOptions options = command.options(new ProjectConfig(null, null, null,
            Map.of("cabinet", "A"), null, null, null, null));

        assertThat(options.deleteOrphans()).isFalse();
        assertThat(options.removeDeadBlocks()).isTrue();
        assertThat(options.deduplicateDeclarations()).isFalse();
        assertThat(options.apply()).isFalse();
        assertThat(options.candidates()).containsExactly("panels/x_A/**");
    }

    @Test
    void guards_apply_removesBlocksForUndefinedClasses() throws IOException {
        write("scripts/libs/struct_A.ctl", "class PUMP { };\n");
        write("panels/objects/objects_A/used.xml", """
            if (settings["struct"] == "PUMP") { drawPump(); }
            if (settings["struct"] == "FAN") { drawFan(); }
            """);

        int exitCode = run("guards", project.toString(), "--apply");

        assertThat(exitCode).isZero();
        assertThat(contentOf(project.resolve("panels/objects/objects_A/used.xml")))
            .contains("drawPump")
            .doesNotContain("drawFan");
    }

    @Test
    void guards_missingScript_fails() {
        assertThat(run("guards", project.toString(), "--script", "scripts/libs/none.ctl")).isEqualTo(1);
    }

    private static ch.qos.logback.classic.Logger rootLogger() {
        return (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private int run(String... args) {
        return RefGraphCLI.commandLine().execute(args);
    }

    private void write(String key, String text) throws IOException {
        Path file = project.resolve(key);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }

    private static String contentOf(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
