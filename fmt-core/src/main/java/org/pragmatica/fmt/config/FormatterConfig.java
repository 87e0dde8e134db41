package org.pragmatica.fmt.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration consulted while rendering. Immutable; the {@code with...} methods return modified copies.
 *
 * @param reformatDocstrings               re-indent the leading asterisks of block comments
 * @param scalaDocIndentStyle              indent doc comment asterisks by two instead of one
 * @param marginStripEnabled               re-indent continuation lines of margin strings
 * @param trailingCommas                   trailing comma policy
 * @param alignTokens                      tokens to align, keyed by token text ({@code //} for line comments)
 * @param alignTreeCategory                tree kinds treated as equal when aligning
 * @param alignTokenCategory               token kinds treated as equal when aligning
 * @param tokenRewrites                    exact-text token substitutions
 * @param longLiteralCase                  case of long literals
 * @param floatLiteralCase                 case of float literals
 * @param doubleLiteralCase                case of double literals
 * @param blankLineBeforeTopLevelStatements put a blank line before a top-level statement following a multi-line one
 * @param legacyPackageBlankLineRule       decide blank lines after package clauses from the package alone
 * @param allowTrailingCommas              the dialect accepts trailing commas
 */
public record FormatterConfig(
        boolean reformatDocstrings,
        boolean scalaDocIndentStyle,
        boolean marginStripEnabled,
        TrailingCommas trailingCommas,
        Map<String, AlignToken> alignTokens,
        Map<String, String> alignTreeCategory,
        Map<String, String> alignTokenCategory,
        Map<String, String> tokenRewrites,
        LiteralCase longLiteralCase,
        LiteralCase floatLiteralCase,
        LiteralCase doubleLiteralCase,
        boolean blankLineBeforeTopLevelStatements,
        boolean legacyPackageBlankLineRule,
        boolean allowTrailingCommas
) {

    public FormatterConfig {
        alignTokens = Map.copyOf(alignTokens);
        alignTreeCategory = Map.copyOf(alignTreeCategory);
        alignTokenCategory = Map.copyOf(alignTokenCategory);
        tokenRewrites = Map.copyOf(tokenRewrites);
    }

    /**
     * Default configuration.
     */
    public static final FormatterConfig DEFAULT = new FormatterConfig(
            true,
            true,
            false,
            TrailingCommas.NEVER,
            Map.of("=>", AlignToken.alignToken("=>", "Case")),
            Map.of(
                    "Defn.Val", "val/var/def",
                    "Defn.Var", "val/var/def",
                    "Defn.Def", "val/var/def"
            ),
            Map.of(
                    "Equals", "Assign",
                    "LeftArrow", "Assign"
            ),
            Map.of(),
            LiteralCase.UPPER,
            LiteralCase.LOWER,
            LiteralCase.LOWER,
            false,
            false,
            true
    );

    /**
     * Factory method for default config.
     */
    public static FormatterConfig defaultConfig() {
        return DEFAULT;
    }

    public FormatterConfig withReformatDocstrings(boolean reformatDocstrings) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withScalaDocIndentStyle(boolean scalaDocIndentStyle) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withMarginStripEnabled(boolean marginStripEnabled) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withTrailingCommas(TrailingCommas trailingCommas) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    /**
     * Replace the whole set of aligned tokens.
     */
    public FormatterConfig withAlignTokens(AlignToken... tokens) {
        var newTokens = new HashMap<String, AlignToken>();
        for (var token : tokens) {
            newTokens.put(token.code(), token);
        }
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   newTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withAlignTreeCategory(Map<String, String> alignTreeCategory) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withAlignTokenCategory(Map<String, String> alignTokenCategory) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    /**
     * Builder-style method to add a token rewrite.
     */
    public FormatterConfig withTokenRewrite(String from, String to) {
        var newRewrites = new HashMap<>(tokenRewrites);
        newRewrites.put(from, to);
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, newRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withLiteralCases(LiteralCase longCase, LiteralCase floatCase, LiteralCase doubleCase) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longCase, floatCase, doubleCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withBlankLineBeforeTopLevelStatements(boolean enabled) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   enabled, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public FormatterConfig withLegacyPackageBlankLineRule(boolean enabled) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, enabled, allowTrailingCommas);
    }

    public FormatterConfig withAllowTrailingCommas(boolean allowTrailingCommas) {
        return new FormatterConfig(reformatDocstrings, scalaDocIndentStyle, marginStripEnabled, trailingCommas,
                                   alignTokens, alignTreeCategory, alignTokenCategory, tokenRewrites,
                                   longLiteralCase, floatLiteralCase, doubleLiteralCase,
                                   blankLineBeforeTopLevelStatements, legacyPackageBlankLineRule, allowTrailingCommas);
    }

    public String treeCategory(String treeKind) {
        return alignTreeCategory.getOrDefault(treeKind, treeKind);
    }

    public String tokenCategory(String tokenType) {
        return alignTokenCategory.getOrDefault(tokenType, tokenType);
    }

    public String rewrite(String tokenText) {
        return tokenRewrites.getOrDefault(tokenText, tokenText);
    }
}
