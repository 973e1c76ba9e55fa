package com.cstkit;

import java.util.Objects;

/**
 * Options for {@link ModuleParser}.
 *
 * @param fallbackIndent  indent used when the source has no indented block
 * @param fallbackNewline newline used when the source has no line break
 */
public record ParserConfig(String fallbackIndent, String fallbackNewline) {

    public static final ParserConfig DEFAULT = new ParserConfig("    ", "\n");

    public ParserConfig {
        Objects.requireNonNull(fallbackIndent, "fallbackIndent");
        Objects.requireNonNull(fallbackNewline, "fallbackNewline");
        if (fallbackIndent.isEmpty() || !fallbackIndent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("fallbackIndent must be non-empty spaces or tabs");
        }
        if (!fallbackNewline.equals("\n") && !fallbackNewline.equals("\r\n") && !fallbackNewline.equals("\r")) {
            throw new IllegalArgumentException("fallbackNewline must be a newline sequence");
        }
    }

    public ParserConfig withFallbackIndent(String indent) {
        return new ParserConfig(indent, fallbackNewline);
    }

    public ParserConfig withFallbackNewline(String newline) {
        return new ParserConfig(fallbackIndent, newline);
    }
}
