package com.refgraph.core.config;

import com.refgraph.core.graph.ClosureOptions;
import com.refgraph.core.model.TargetEncoding;
import com.refgraph.core.reference.DefaultPatterns;
import com.refgraph.core.reference.ReferencePattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_fullYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("refgraph.yaml");
        Files.writeString(configFile, """
            documents:
              root: "ventcontent"
              include: ["panels/**", "scripts/**"]
              exclude: ["**/*.bak"]

            variables:
              cabinet: SHD_03_1

            roots:
              - "panels/vision/LCSMnemo/${cabinet}/**/*.xml"
            candidates:
              - "panels/objects/objects_${cabinet}/**"

            patterns:
              singleQuotes: true
              custom:
                - kind: panel
                  regex: "loadPanel\\\\((?<target>[^)]+)\\\\)"
                  suffix: ".xml"

            closure:
              maxIterations: 50
              parallelism: 4
              ignore: ["panels/objects/shared/**"]

            prune:
              removeDeadBlocks: false

            guards:
              script: "scripts/libs/objLogic/Ventcontent_${cabinet}.ctl"
              protectedNames: [BASE]
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.documents().root()).isEqualTo("ventcontent");
        assertThat(config.documents().exclude()).containsExactly("**/*.bak");
        assertThat(config.roots()).containsExactly("panels/vision/LCSMnemo/SHD_03_1/**/*.xml");
        assertThat(config.candidates()).containsExactly("panels/objects/objects_SHD_03_1/**");
        assertThat(config.patterns().singleQuotes()).isTrue();
        assertThat(config.closure().toOptions().maxIterations()).isEqualTo(50);
        assertThat(config.closure().toOptions().parallelism()).isEqualTo(4);
        assertThat(config.closure().ignore()).containsExactly("panels/objects/shared/**");
        assertThat(config.prune().removeDeadBlocks()).isFalse();
        assertThat(config.prune().deleteOrphans()).isTrue();
        assertThat(config.guards().script()).isEqualTo("scripts/libs/objLogic/Ventcontent_SHD_03_1.ctl");
        assertThat(config.guards().protectedNames()).containsExactly("BASE");

        List<ReferencePattern> patterns = config.patterns().toPatterns();
        ReferencePattern custom = patterns.get(patterns.size() - 1);
        assertThat(patterns).hasSize(DefaultPatterns.defaults().size() + 1);
        assertThat(custom.encoding()).isEqualTo(TargetEncoding.BARE);
        assertThat(custom.suffix()).isEqualTo(".xml");
        assertThat(custom.regex().matcher("loadPanel(objects/a)").find()).isTrue();
    }

    @Test
    void load_overrides_winOverFileVariables() throws IOException {
        Path configFile = tempDir.resolve("refgraph.yaml");
        Files.writeString(configFile, """
            variables:
              cabinet: SHD_03_1
            roots: ["panels/vision/LCSMnemo/${cabinet}/main.xml"]
            """);

        ProjectConfig config = ConfigLoader.load(configFile, Map.of("cabinet", "SHD_04"));

        assertThat(config.roots()).containsExactly("panels/vision/LCSMnemo/SHD_04/main.xml");
        assertThat(config.variables()).containsEntry("cabinet", "SHD_04");
    }

    @Test
    void load_unknownPlaceholder_isKeptVerbatim() throws IOException {
        Path configFile = tempDir.resolve("refgraph.yaml");
        Files.writeString(configFile, "roots: [\"panels/${nowhere}/main.xml\"]\n");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.roots()).containsExactly("panels/${nowhere}/main.xml");
    }

    @Test
    void load_fileDoesNotExist_returnsDefaultsWithOverrides() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"), Map.of("cabinet", "X"));

        assertThat(config.roots()).isEmpty();
        assertThat(config.documents().include()).containsExactly("**/*.xml", "**/*.ctl");
        assertThat(config.variables()).containsEntry("cabinet", "X");
        assertThat(config.closure().maxIterations()).isEqualTo(ClosureOptions.AUTO_MAX_ITERATIONS);
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("refgraph.yaml");
        Files.writeString(configFile, "roots: [unclosed");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void substitute_knownAndUnknown_replacesOnlyKnown() {
        String result = ConfigLoader.substitute("${a}/${b}/${a}", Map.of("a", "x"));

        assertThat(result).isEqualTo("x/${b}/x");
    }
}
