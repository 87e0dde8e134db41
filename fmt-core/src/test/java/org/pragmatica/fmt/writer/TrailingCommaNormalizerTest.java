package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.config.AlignToken;
import org.pragmatica.fmt.config.FormatterConfig;
import org.pragmatica.fmt.config.TrailingCommas;
import org.pragmatica.fmt.tree.NodeRole;
import org.pragmatica.fmt.tree.SyntaxTree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.fmt.writer.Scenario.scenario;

class TrailingCommaNormalizerTest {
    private static final FormatterConfig ALWAYS = FormatterConfig.defaultConfig()
                                                                 .withTrailingCommas(TrailingCommas.ALWAYS);
    private static final FormatterConfig NEVER = FormatterConfig.defaultConfig()
                                                                .withTrailingCommas(TrailingCommas.NEVER);

    @Test
    void always_insertsComma_afterLastArgumentOnItsOwnLine() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "a")
                                       .noSplit(",")
                                       .newline(2, "b")
                                       .newline(0, ")")
                                       .end();

        assertThat(scenario.render(ALWAYS, callTree(scenario)))
                  .isEqualTo("call(\n  a,\n  b,\n)");
    }

    @Test
    void always_keepsEmptyArgumentListWithoutComma() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(0, ")")
                                       .end();

        assertThat(scenario.render(ALWAYS, callTree(scenario)))
                  .isEqualTo("call(\n)");
    }

    @Test
    void always_doesNotDuplicateExistingComma() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "a")
                                       .noSplit(",")
                                       .newline(0, ")")
                                       .end();

        assertThat(scenario.render(ALWAYS, callTree(scenario)))
                  .isEqualTo("call(\n  a,\n)");
    }

    @Test
    void always_insertsCommaBeforeTrailingComment() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "a")
                                       .noSplit(",")
                                       .newline(2, "b")
                                       .space("// c")
                                       .newline(0, ")")
                                       .end();

        assertThat(scenario.render(ALWAYS, callTree(scenario)))
                  .isEqualTo("call(\n  a,\n  b, // c\n)");
    }

    @Test
    void always_insertsCommaInPlace_whenCommentIsAligned() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "aaa")
                                       .noSplit(",")
                                       .space("// x")
                                       .newline(2, "b")
                                       .space("// y")
                                       .newline(0, ")")
                                       .end();
        var config = ALWAYS.withAlignTokens(AlignToken.alignToken("//", ".*"));

        assertThat(scenario.render(config, callTree(scenario)))
                  .isEqualTo("call(\n  aaa, // x\n  b,   // y\n)");
    }

    @Test
    void always_insertsCommaBeforeImportClosingBrace() {
        var scenario = scenario("import").space("a")
                                         .noSplit(".")
                                         .noSplit("{")
                                         .newline(2, "b")
                                         .noSplit(",")
                                         .newline(2, "c")
                                         .newline(0, "}")
                                         .end();
        var builder = scenario.tree();
        builder.node(builder.root(), "Importer", 1, scenario.index("}"), NodeRole.IMPORTER);

        assertThat(scenario.render(ALWAYS, builder.build()))
                  .isEqualTo("import a.{\n  b,\n  c,\n}");
    }

    @Test
    void always_ignoresClosingBraceOutsideImports() {
        var scenario = scenario("foo").space("{")
                                      .newline(2, "a")
                                      .newline(0, "}")
                                      .end();
        var builder = scenario.tree();
        builder.node(builder.root(), "Term.Apply", 0, scenario.index("}"), NodeRole.CALL_SITE);

        assertThat(scenario.render(ALWAYS, builder.build()))
                  .isEqualTo("foo {\n  a\n}");
    }

    @Test
    void never_removesCommaAfterLastArgument() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "a")
                                       .noSplit(",")
                                       .newline(2, "b")
                                       .noSplit(",")
                                       .newline(0, ")")
                                       .end();

        assertThat(scenario.render(NEVER, callTree(scenario)))
                  .isEqualTo("call(\n  a,\n  b\n)");
    }

    @Test
    void never_removesCommaBeforeTrailingComment() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "a")
                                       .noSplit(",")
                                       .newline(2, "b")
                                       .noSplit(",")
                                       .space("// c")
                                       .newline(0, ")")
                                       .end();

        assertThat(scenario.render(NEVER, callTree(scenario)))
                  .isEqualTo("call(\n  a,\n  b // c\n)");
    }

    @Test
    void never_blanksCommaInPlace_whenCommentIsAligned() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "a")
                                       .noSplit(",")
                                       .space("// x")
                                       .newline(2, "bb")
                                       .noSplit(",")
                                       .space("// y")
                                       .newline(0, ")")
                                       .end();
        var config = NEVER.withAlignTokens(AlignToken.alignToken("//", ".*"));

        assertThat(scenario.render(config, callTree(scenario)))
                  .isEqualTo("call(\n  a,  // x\n  bb  // y\n)");
    }

    @ParameterizedTest
    @EnumSource(TrailingCommas.class)
    void anyPolicy_removesCommaBeforeCloseParenOnSameLine(TrailingCommas policy) {
        var scenario = scenario("call").noSplit("(")
                                       .noSplit("a")
                                       .noSplit(",")
                                       .space("b")
                                       .noSplit(",")
                                       .noSplit(")")
                                       .end();
        var config = FormatterConfig.defaultConfig()
                                    .withTrailingCommas(policy);

        assertThat(scenario.render(config, callTree(scenario)))
                  .isEqualTo("call(a, b)");
    }

    @Test
    void preserve_keepsMultilineTrailingComma() {
        var scenario = scenario("call").noSplit("(")
                                       .newline(2, "a")
                                       .noSplit(",")
                                       .newline(0, ")")
                                       .end();
        var config = FormatterConfig.defaultConfig()
                                    .withTrailingCommas(TrailingCommas.PRESERVE);

        assertThat(scenario.render(config, callTree(scenario)))
                  .isEqualTo("call(\n  a,\n)");
    }

    @Test
    void dialectWithoutTrailingCommas_leavesCommasUntouched() {
        var scenario = scenario("call").noSplit("(")
                                       .noSplit("a")
                                       .noSplit(",")
                                       .noSplit(")")
                                       .end();
        var config = NEVER.withAllowTrailingCommas(false);

        assertThat(scenario.render(config, callTree(scenario)))
                  .isEqualTo("call(a,)");
    }

    @Test
    void unrecognizedOwner_leavesCommasUntouched() {
        var scenario = scenario("{").newline(2, "this")
                                    .noSplit("(")
                                    .noSplit("1")
                                    .noSplit(")")
                                    .noSplit(",")
                                    .newline(0, "}")
                                    .end();
        var builder = scenario.tree();
        var block = builder.node(builder.root(), "Term.Block", 0, scenario.index("}"), NodeRole.BLOCK);
        builder.node(block, "Term.Apply", 1, scenario.index(")"), NodeRole.CALL_SITE);

        assertThat(scenario.render(NEVER, builder.build()))
                  .isEqualTo("{\n  this(1),\n}");
    }

    private static SyntaxTree callTree(Scenario scenario) {
        var builder = scenario.tree();
        builder.node(builder.root(), "Term.Apply", 0, scenario.index(")"), NodeRole.CALL_SITE);
        return builder.build();
    }
}
