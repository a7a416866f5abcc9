package com.refgraph.core.prune;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shape of a conditional guard whose body only matters when a named definition exists.
 *
 * <p>The pattern must capture the guarded name in a group called {@value #NAME_GROUP} and end
 * just before the body's opening brace (whitespace and comments may follow).
 *
 * @param description short label for logs
 * @param pattern guard pattern
 */
public record GuardRule(String description, Pattern pattern) {

    public static final String NAME_GROUP = "name";

    /**
     * Compact constructor with validation.
     */
    public GuardRule {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (!pattern.pattern().contains("(?<" + NAME_GROUP + ">")) {
            throw new IllegalArgumentException("guard pattern needs a (?<" + NAME_GROUP + ">...) group: " + pattern);
        }
    }

    /**
     * Guards of the form {@code if (settings["struct"] == "Name")}, in the three quoting
     * dialects.
     *
     * @return guard rules
     */
    public static List<GuardRule> structGuards() {
        return List.of(
            structGuard("markup-entity", "&quot;"),
            structGuard("backslash-escaped", "\\\\\""),
            structGuard("plain", "\""));
    }

    private static GuardRule structGuard(String description, String quote) {
        String regex = "\\bif\\s*\\(\\s*settings\\s*\\[\\s*" + quote + "struct" + quote
            + "\\s*\\]\\s*==\\s*" + quote + "(?<" + NAME_GROUP + ">\\w+)" + quote + "\\s*\\)";
        return new GuardRule("struct guard (" + description + ")", Pattern.compile(regex));
    }
}
