package io.github.cyfko.hoaql.core.config;

import java.util.regex.Pattern;

/**
 * Lexical patterns of the HOA tokens that are validated outside the grammar.
 * <p>
 * The grammar already guarantees these shapes for parsed documents; the patterns protect the
 * newtypes ({@link io.github.cyfko.hoaql.core.model.Identifier},
 * {@link io.github.cyfko.hoaql.core.model.AliasName}) when documents are built programmatically.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    private static final String IDENTIFIER_FORM = "[a-zA-Z_][0-9a-zA-Z_-]*";

    /**
     * {@code IDENTIFIER}: format version, acceptance name, property names, custom header names.
     * Example valid: "v1", "generalized-Buchi", "_x"
     */
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^" + IDENTIFIER_FORM + "$");

    /**
     * {@code ANAME}: alias names, an {@code @} followed by at least one identifier character.
     * Example valid: "@a", "@0", "@no-go"
     */
    public static final Pattern ALIAS_PATTERN = Pattern.compile("^@[0-9a-zA-Z_-]+$");

    /**
     * Body of a {@code STRING} token once its surrounding quotes are removed: any character
     * except an unescaped double quote or a dangling backslash.
     */
    public static final Pattern STRING_CONTENT_PATTERN = Pattern.compile("^(\\\\.|[^\\\\\"])*$", Pattern.DOTALL);
}
