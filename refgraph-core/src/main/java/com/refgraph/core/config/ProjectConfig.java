package com.refgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.refgraph.core.graph.ClosureOptions;
import com.refgraph.core.model.TargetEncoding;
import com.refgraph.core.prune.PruneOptions;
import com.refgraph.core.reference.DefaultPatterns;
import com.refgraph.core.reference.ReferencePattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Root configuration for a refgraph run.
 *
 * <p>Loaded from {@code refgraph.yaml}. String values may contain {@code ${name}} placeholders,
 * resolved from {@link #variables()} by {@link ConfigLoader}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * documents:
 *   root: "."
 *   include: ["panels/**", "scripts/**"]
 *
 * variables:
 *   cabinet: SHD_03_1
 *
 * roots: ["panels/vision/LCSMnemo/${cabinet}/**"]
 * candidates: ["panels/objects/objects_${cabinet}/**"]
 *
 * closure:
 *   maxIterations: 5000
 *
 * guards:
 *   script: "scripts/libs/objLogic/Ventcontent_${cabinet}.ctl"
 * }</pre>
 *
 * @param documents document set location and filters
 * @param roots glob patterns selecting root documents
 * @param candidates glob patterns limiting which orphans may be pruned; empty allows all
 * @param variables placeholder values
 * @param patterns reference pattern settings
 * @param closure closure settings
 * @param prune pruning toggles
 * @param guards guarded-block pruning settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("documents") DocumentsConfig documents,
    @JsonProperty("roots") List<String> roots,
    @JsonProperty("candidates") List<String> candidates,
    @JsonProperty("variables") Map<String, String> variables,
    @JsonProperty("patterns") PatternsConfig patterns,
    @JsonProperty("closure") ClosureConfig closure,
    @JsonProperty("prune") PruneConfig prune,
    @JsonProperty("guards") GuardsConfig guards
) {
    /**
     * Compact constructor filling omitted sections with defaults.
     */
    public ProjectConfig {
        documents = documents == null ? DocumentsConfig.defaults() : documents;
        roots = roots == null ? List.of() : List.copyOf(roots);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        variables = variables == null ? Map.of() : Map.copyOf(variables);
        patterns = patterns == null ? PatternsConfig.defaults() : patterns;
        closure = closure == null ? ClosureConfig.defaults() : closure;
        prune = prune == null ? PruneConfig.defaults() : prune;
        guards = guards == null ? GuardsConfig.defaults() : guards;
    }

    /**
     * Creates a default configuration: every {@code .xml} and {@code .ctl} file under the
     * current directory, no roots, the built-in patterns.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null, null, null, null);
    }

    public ProjectConfig withRoots(List<String> newRoots) {
        return new ProjectConfig(documents, newRoots, candidates, variables, patterns, closure, prune, guards);
    }

    public ProjectConfig withCandidates(List<String> newCandidates) {
        return new ProjectConfig(documents, roots, newCandidates, variables, patterns, closure, prune, guards);
    }

    public ProjectConfig withMaxIterations(int maxIterations) {
        ClosureConfig capped = new ClosureConfig(maxIterations, closure.parallelism(), closure.ignore());
        return new ProjectConfig(documents, roots, candidates, variables, patterns, capped, prune, guards);
    }

    /**
     * Document set location.
     *
     * @param root directory the document keys are relative to
     * @param include key patterns to include
     * @param exclude key patterns to exclude
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentsConfig(
        @JsonProperty("root") String root,
        @JsonProperty("include") List<String> include,
        @JsonProperty("exclude") List<String> exclude
    ) {
        public DocumentsConfig {
            root = root == null || root.isBlank() ? "." : root;
            include = include == null ? List.of("**/*.xml", "**/*.ctl") : List.copyOf(include);
            exclude = exclude == null ? List.of() : List.copyOf(exclude);
        }

        public static DocumentsConfig defaults() {
            return new DocumentsConfig(null, null, null);
        }
    }

    /**
     * Reference pattern settings.
     *
     * @param includeDefaults whether the built-in patterns are used
     * @param panelPrefix key prefix panel paths are relative to
     * @param scriptPrefix key prefix script libraries are relative to
     * @param legacyPrefix key prefix legacy panel references resolve into
     * @param singleQuotes whether single-quoted strings are string literals
     * @param custom additional patterns, tried after the built-in ones of the same kind
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatternsConfig(
        @JsonProperty("includeDefaults") Boolean includeDefaults,
        @JsonProperty("panelPrefix") String panelPrefix,
        @JsonProperty("scriptPrefix") String scriptPrefix,
        @JsonProperty("legacyPrefix") String legacyPrefix,
        @JsonProperty("singleQuotes") Boolean singleQuotes,
        @JsonProperty("custom") List<PatternConfig> custom
    ) {
        public PatternsConfig {
            includeDefaults = includeDefaults == null ? Boolean.TRUE : includeDefaults;
            panelPrefix = panelPrefix == null ? DefaultPatterns.DEFAULT_PANEL_PREFIX : panelPrefix;
            scriptPrefix = scriptPrefix == null ? DefaultPatterns.DEFAULT_SCRIPT_PREFIX : scriptPrefix;
            legacyPrefix = legacyPrefix == null ? panelPrefix + "objects/" : legacyPrefix;
            singleQuotes = singleQuotes == null ? Boolean.FALSE : singleQuotes;
            custom = custom == null ? List.of() : List.copyOf(custom);
        }

        public static PatternsConfig defaults() {
            return new PatternsConfig(null, null, null, null, null, null);
        }

        /**
         * Builds the ordered pattern list.
         *
         * @return patterns
         * @throws IllegalArgumentException if a custom pattern is invalid
         */
        public List<ReferencePattern> toPatterns() {
            List<ReferencePattern> result = new ArrayList<>();
            if (includeDefaults) {
                result.addAll(DefaultPatterns.forLayout(panelPrefix, scriptPrefix, legacyPrefix));
            }
            custom.forEach(c -> result.add(c.toPattern()));
            return result;
        }
    }

    /**
     * One custom reference pattern.
     *
     * @param kind reference kind
     * @param regex regex with a {@code (?<target>...)} group
     * @param encoding quoting implied by the shape
     * @param prefix key prefix
     * @param suffix inferred suffix
     * @param declaration whether repeated matches are redundant declarations
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatternConfig(
        @JsonProperty("kind") String kind,
        @JsonProperty("regex") String regex,
        @JsonProperty("encoding") TargetEncoding encoding,
        @JsonProperty("prefix") String prefix,
        @JsonProperty("suffix") String suffix,
        @JsonProperty("declaration") boolean declaration
    ) {
        public ReferencePattern toPattern() {
            if (regex == null || kind == null) {
                throw new IllegalArgumentException("custom pattern needs both 'kind' and 'regex'");
            }
            return new ReferencePattern(kind, Pattern.compile(regex),
                encoding == null ? TargetEncoding.BARE : encoding, prefix, suffix, declaration);
        }
    }

    /**
     * Closure settings.
     *
     * @param maxIterations round cap; 0 or omitted allows one round per document
     * @param parallelism analysis threads
     * @param ignore target patterns never expanded nor reported missing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClosureConfig(
        @JsonProperty("maxIterations") Integer maxIterations,
        @JsonProperty("parallelism") Integer parallelism,
        @JsonProperty("ignore") List<String> ignore
    ) {
        public ClosureConfig {
            maxIterations = maxIterations == null ? ClosureOptions.AUTO_MAX_ITERATIONS : maxIterations;
            parallelism = parallelism == null ? 1 : parallelism;
            ignore = ignore == null ? List.of() : List.copyOf(ignore);
        }

        public static ClosureConfig defaults() {
            return new ClosureConfig(null, null, null);
        }

        public ClosureOptions toOptions() {
            return new ClosureOptions(maxIterations, parallelism, ignore);
        }
    }

    /**
     * Pruning toggles.
     *
     * @param deleteOrphans delete orphan documents
     * @param removeDeadBlocks remove commented-out groups mentioning only orphans
     * @param deduplicateDeclarations remove repeated declarations
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PruneConfig(
        @JsonProperty("deleteOrphans") Boolean deleteOrphans,
        @JsonProperty("removeDeadBlocks") Boolean removeDeadBlocks,
        @JsonProperty("deduplicateDeclarations") Boolean deduplicateDeclarations
    ) {
        public PruneConfig {
            deleteOrphans = deleteOrphans == null ? Boolean.TRUE : deleteOrphans;
            removeDeadBlocks = removeDeadBlocks == null ? Boolean.TRUE : removeDeadBlocks;
            deduplicateDeclarations = deduplicateDeclarations == null ? Boolean.TRUE : deduplicateDeclarations;
        }

        public static PruneConfig defaults() {
            return new PruneConfig(null, null, null);
        }

        /**
         * Converts to executor options.
         *
         * @param candidates orphan scope
         * @param apply whether to apply
         * @return options
         */
        public PruneOptions toOptions(List<String> candidates, boolean apply) {
            return new PruneOptions(deleteOrphans, removeDeadBlocks, deduplicateDeclarations, apply, candidates);
        }
    }

    /**
     * Guarded-block pruning settings.
     *
     * @param script key of the script whose class definitions are the known names
     * @param protectedNames names always treated as defined
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GuardsConfig(
        @JsonProperty("script") String script,
        @JsonProperty("protectedNames") List<String> protectedNames
    ) {
        public GuardsConfig {
            protectedNames = protectedNames == null ? List.of() : List.copyOf(protectedNames);
        }

        public static GuardsConfig defaults() {
            return new GuardsConfig(null, null);
        }
    }
}
