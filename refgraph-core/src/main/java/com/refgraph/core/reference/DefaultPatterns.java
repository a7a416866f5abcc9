package com.refgraph.core.reference;

import com.refgraph.core.model.TargetEncoding;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in reference patterns for panel projects.
 *
 * <p>Two reference kinds are recognized, each in every quoting the documents use:
 * <ul>
 *   <li><b>panel</b> - {@code objects/objects_<CABINET>/<path>.xml} (cabinet-qualified), tried
 *       before the legacy shape {@code objects/<path>.xml}, which never starts with
 *       {@code objects_}</li>
 *   <li><b>script</b> - {@code #uses "<lib>/<name>[.ctl]"}; the {@code .ctl} suffix is inferred
 *       when missing and repeated active uses of one library are redundant declarations</li>
 * </ul>
 *
 * <p>Quoted shapes include their delimiters. The bare shapes exist for element text such as
 * {@code <prop name="FileName">objects/...xml</prop>}; a bare match starting inside a string
 * literal is discarded by the extractor, so bare and quoted shapes never double count.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<ReferencePattern> patterns = DefaultPatterns.forLayout("panels/", "scripts/libs/",
 *     "panels/objects/objects_SHD_03_1/");
 * ReferenceExtractor extractor = new ReferenceExtractor(patterns);
 * }</pre>
 */
public final class DefaultPatterns {

    public static final String PANEL_KIND = "panel";
    public static final String SCRIPT_KIND = "script";

    public static final String DEFAULT_PANEL_PREFIX = "panels/";
    public static final String DEFAULT_SCRIPT_PREFIX = "scripts/libs/";

    // Path characters: anything that cannot end a quoted literal, an entity, or an XML tag
    private static final String PATH_CHARS = "[^\\s\"'<>&\\\\]";

    private static final String QUALIFIED_PANEL = "objects/objects_[A-Za-z0-9_]+/" + PATH_CHARS + "*?\\.xml";
    private static final String LEGACY_PANEL = PATH_CHARS + "*?\\.xml";
    private static final String SCRIPT_NAME = PATH_CHARS + "+?";

    private static final String BARE_BEFORE = "(?<![\\w/.])";
    private static final String BARE_AFTER = "(?![\\w.])";

    private DefaultPatterns() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Default patterns with the default layout; legacy references resolve to the shared
     * {@code objects/} folder.
     *
     * @return ordered pattern list
     */
    public static List<ReferencePattern> defaults() {
        return forLayout(DEFAULT_PANEL_PREFIX, DEFAULT_SCRIPT_PREFIX, DEFAULT_PANEL_PREFIX + "objects/");
    }

    /**
     * Default patterns for a custom layout.
     *
     * @param panelPrefix key prefix of the folder panel paths are relative to
     * @param scriptPrefix key prefix of the folder script libraries are relative to
     * @param legacyPrefix key prefix legacy {@code objects/<path>} references resolve into
     * @return ordered pattern list: qualified panels, legacy panels, scripts
     */
    public static List<ReferencePattern> forLayout(String panelPrefix, String scriptPrefix, String legacyPrefix) {
        List<ReferencePattern> patterns = new ArrayList<>();
        patterns.addAll(qualifiedPanelPatterns(panelPrefix));
        patterns.addAll(legacyPanelPatterns(legacyPrefix));
        patterns.addAll(scriptUsePatterns(scriptPrefix));
        return List.copyOf(patterns);
    }

    /**
     * Cabinet-qualified panel references in all encodings.
     *
     * @param panelPrefix key prefix for the panel folder
     * @return patterns, quoted shapes first
     */
    public static List<ReferencePattern> qualifiedPanelPatterns(String panelPrefix) {
        String target = "(?<target>" + QUALIFIED_PANEL + ")";
        return List.of(
            ReferencePattern.of(PANEL_KIND, "&quot;" + target + "&quot;", TargetEncoding.MARKUP_ENTITY).withPrefix(panelPrefix),
            ReferencePattern.of(PANEL_KIND, "\\\\\"" + target + "\\\\\"", TargetEncoding.BACKSLASH_ESCAPED).withPrefix(panelPrefix),
            ReferencePattern.of(PANEL_KIND, "\"" + target + "\"", TargetEncoding.PLAIN).withPrefix(panelPrefix),
            ReferencePattern.of(PANEL_KIND, BARE_BEFORE + target + BARE_AFTER, TargetEncoding.BARE).withPrefix(panelPrefix)
        );
    }

    /**
     * Legacy panel references ({@code objects/<path>.xml} without a cabinet folder).
     *
     * @param legacyPrefix key prefix the path after {@code objects/} is resolved into
     * @return patterns, quoted shapes first
     */
    public static List<ReferencePattern> legacyPanelPatterns(String legacyPrefix) {
        String target = "objects/(?!objects_)(?<target>" + LEGACY_PANEL + ")";
        return List.of(
            ReferencePattern.of(PANEL_KIND, "&quot;" + target + "&quot;", TargetEncoding.MARKUP_ENTITY).withPrefix(legacyPrefix),
            ReferencePattern.of(PANEL_KIND, "\\\\\"" + target + "\\\\\"", TargetEncoding.BACKSLASH_ESCAPED).withPrefix(legacyPrefix),
            ReferencePattern.of(PANEL_KIND, "\"" + target + "\"", TargetEncoding.PLAIN).withPrefix(legacyPrefix),
            ReferencePattern.of(PANEL_KIND, BARE_BEFORE + target + BARE_AFTER, TargetEncoding.BARE).withPrefix(legacyPrefix)
        );
    }

    /**
     * {@code #uses} declarations in all quoted encodings.
     *
     * @param scriptPrefix key prefix for the script library folder
     * @return declaration patterns
     */
    public static List<ReferencePattern> scriptUsePatterns(String scriptPrefix) {
        String target = "(?<target>" + SCRIPT_NAME + ")";
        return List.of(
            ReferencePattern.of(SCRIPT_KIND, "#uses\\s+&quot;" + target + "&quot;", TargetEncoding.MARKUP_ENTITY)
                .withPrefix(scriptPrefix).withSuffix(".ctl").asDeclaration(),
            ReferencePattern.of(SCRIPT_KIND, "#uses\\s+\\\\\"" + target + "\\\\\"", TargetEncoding.BACKSLASH_ESCAPED)
                .withPrefix(scriptPrefix).withSuffix(".ctl").asDeclaration(),
            ReferencePattern.of(SCRIPT_KIND, "#uses\\s+\"" + target + "\"", TargetEncoding.PLAIN)
                .withPrefix(scriptPrefix).withSuffix(".ctl").asDeclaration()
        );
    }
}
