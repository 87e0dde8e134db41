package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.config.AlignToken;
import org.pragmatica.fmt.config.FormatterConfig;
import org.pragmatica.fmt.split.Modification;
import org.pragmatica.fmt.tree.NodeRole;
import org.pragmatica.fmt.tree.SyntaxNode;
import org.pragmatica.fmt.tree.SyntaxTree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.fmt.writer.Scenario.scenario;

class AlignmentEngineTest {
    private static final FormatterConfig CONFIG = FormatterConfig.defaultConfig();
    private static final FormatterConfig ASSIGN_AND_COMMENTS = CONFIG.withAlignTokens(AlignToken.alignToken("=", ".*"),
                                                                                      AlignToken.alignToken("//", ".*"));

    @Test
    void alignmentTokens_alignsCaseArrows_acrossConsecutiveLines() {
        var scenario = matchScenario(Modification.newline());

        assertThat(scenario.render(CONFIG, matchTree(scenario, false)))
                  .isEqualTo("x match {\n  case a      => 1\n  case bbbbbb => 2\n}");
    }

    @Test
    void alignmentTokens_padsOnlyShorterRows() {
        var scenario = matchScenario(Modification.newline());
        var tree = matchTree(scenario, false);
        var writer = FormatWriter.formatWriter(CONFIG, tree);
        var locations = FormatLocations.formatLocations(writer.formatTokens(), scenario.splits(), scenario.states());

        var aligns = AlignmentEngine.alignmentEngine(CONFIG, tree)
                                    .alignmentTokens(locations);

        assertThat(aligns).hasSize(2);
        assertThat(aligns.get(writer.formatTokens().get(scenario.index("a")))).isEqualTo(5);
        assertThat(aligns.get(writer.formatTokens().get(scenario.index("bbbbbb")))).isZero();
    }

    @Test
    void alignmentTokens_blankLineEndsTheBlock() {
        var scenario = matchScenario(Modification.doubleNewline());

        assertThat(scenario.render(CONFIG, matchTree(scenario, false)))
                  .isEqualTo("x match {\n  case a => 1\n\n  case bbbbbb => 2\n}");
    }

    @Test
    void alignmentTokens_skipsTokens_whoseOwnerDoesNotMatchThePattern() {
        var scenario = matchScenario(Modification.newline());
        var config = CONFIG.withAlignTokens(AlignToken.alignToken("=>", "Function"));

        assertThat(scenario.render(config, matchTree(scenario, false)))
                  .isEqualTo("x match {\n  case a => 1\n  case bbbbbb => 2\n}");
    }

    @Test
    void alignmentTokens_doesNotAlignRows_atDifferentDepth() {
        var scenario = matchScenario(Modification.newline());

        assertThat(scenario.render(CONFIG, matchTree(scenario, true)))
                  .isEqualTo("x match {\n  case a => 1\n  case bbbbbb => 2\n}");
    }

    @Test
    void alignmentTokens_alwaysAlignsTrailingLineComments() {
        var scenario = scenario("a").space("// x")
                                    .newline(0, "bbb")
                                    .space("// y")
                                    .end();
        var config = CONFIG.withAlignTokens(AlignToken.alignToken("//", ".*"));

        assertThat(scenario.render(config)).isEqualTo("a   // x\nbbb // y");
    }

    @Test
    void alignmentTokens_isEmpty_whenDecisionSequenceIsPartial() {
        var scenario = matchScenario(Modification.newline());
        var tree = matchTree(scenario, false);
        var formatTokens = FormatWriter.formatWriter(CONFIG, tree)
                                       .formatTokens();
        int partial = scenario.splits().size() - 1;
        var locations = FormatLocations.formatLocations(formatTokens,
                                                        scenario.splits().subList(0, partial),
                                                        scenario.states().subList(0, partial));

        assertThat(AlignmentEngine.alignmentEngine(CONFIG, tree)
                                  .alignmentTokens(locations)).isEmpty();
    }

    @Test
    void alignOwner_promotesNameToEnclosingInfixApplication() {
        var scenario = scenario("a").space("+")
                                    .space("b")
                                    .end();
        var builder = scenario.tree();
        var infix = builder.node(builder.root(), "Term.ApplyInfix", 0, 2, NodeRole.INFIX_APPLY);
        builder.node(infix, "Term.Name", 1, 1, NodeRole.NAME);
        var tree = builder.build();
        var formatTokens = FormatWriter.formatWriter(CONFIG, tree)
                                       .formatTokens();

        SyntaxNode owner = AlignmentEngine.alignmentEngine(CONFIG, tree)
                                          .alignOwner(formatTokens.get(0));

        assertThat(owner).isSameAs(infix);
    }

    @Test
    void alignmentTokens_alignsEveryColumn_ofMultiLineBlock() {
        var scenario = assignmentsWithComments();
        var builder = scenario.tree();
        builder.node(builder.root(), "Term.Block", 0, scenario.index("// z"), NodeRole.BLOCK);

        assertThat(scenario.render(ASSIGN_AND_COMMENTS, builder.build()))
                  .isEqualTo("a   = 1     // x\nbbb = 22222 // y\ncc  = 3     // z");
    }

    @Test
    void alignmentTokens_alignsEveryColumn_whenEachLineIsOwnDefinition() {
        var scenario = assignmentsWithComments();
        var builder = scenario.tree();
        builder.node(builder.root(), "Defn.Val", 0, 3);
        builder.node(builder.root(), "Defn.Val", 4, 7);
        builder.node(builder.root(), "Defn.Val", 8, 11);

        assertThat(scenario.render(ASSIGN_AND_COMMENTS, builder.build()))
                  .isEqualTo("a   = 1     // x\nbbb = 22222 // y\ncc  = 3     // z");
    }

    @Test
    void alignmentTokens_shrinksBlockToColumnsSharedByAllLines() {
        var scenario = scenario("a").space("=")
                                    .space("1")
                                    .space("// x")
                                    .newline(0, "bbb")
                                    .space("=")
                                    .space("22222")
                                    .newline(0, "cc")
                                    .space("=")
                                    .space("3")
                                    .space("// z")
                                    .end();
        var builder = scenario.tree();
        builder.node(builder.root(), "Term.Block", 0, scenario.index("// z"), NodeRole.BLOCK);

        assertThat(scenario.render(ASSIGN_AND_COMMENTS, builder.build()))
                  .isEqualTo("a   = 1 // x\nbbb = 22222\ncc  = 3 // z");
    }

    private static Scenario assignmentsWithComments() {
        return scenario("a").space("=")
                            .space("1")
                            .space("// x")
                            .newline(0, "bbb")
                            .space("=")
                            .space("22222")
                            .space("// y")
                            .newline(0, "cc")
                            .space("=")
                            .space("3")
                            .space("// z")
                            .end();
    }

    private static Scenario matchScenario(Modification.Newline betweenCases) {
        return scenario("x").space("match")
                            .space("{")
                            .newline(2, "case")
                            .space("a")
                            .space("=>")
                            .space("1")
                            .newline(betweenCases, 2, "case")
                            .space("bbbbbb")
                            .space("=>")
                            .space("2")
                            .newline(0, "}")
                            .end();
    }

    private static SyntaxTree matchTree(Scenario scenario, boolean nestSecondCase) {
        var builder = scenario.tree();
        int second = scenario.index("case", 1);
        var match = builder.node(builder.root(), "Term.Match", 0, scenario.index("}"));
        builder.node(match, "Case", scenario.index("case"), second - 1);
        var secondParent = nestSecondCase
                           ? builder.node(match, "Term.Block", second, second + 3)
                           : match;
        builder.node(secondParent, "Case", second, second + 3);
        return builder.build();
    }
}
