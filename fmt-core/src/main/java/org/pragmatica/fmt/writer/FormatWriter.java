package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.config.FormatterConfig;
import org.pragmatica.fmt.split.Split;
import org.pragmatica.fmt.split.State;
import org.pragmatica.fmt.token.FormatToken;
import org.pragmatica.fmt.tree.TreeOracle;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces formatted output from a sequence of splits.
 *
 * One writer serves one parsed file: facts derived from the syntax tree are computed once and reused
 * by every {@link #mkString} call. Rendering itself keeps no state between calls.
 * <p>
 * Each location emits its left token, so the last token of the stream is never written. Token streams
 * end with an empty {@link org.pragmatica.fmt.token.TokenKind#EOF} token.
 */
public final class FormatWriter {
    private static final Logger log = LoggerFactory.getLogger(FormatWriter.class);

    private final FormatterConfig config;
    private final TreeOracle tree;
    private final List<FormatToken> formatTokens;
    private final LiteralFormatter literalFormatter;
    private final AlignmentEngine alignmentEngine;
    private final TopLevelStatements topLevelStatements;

    private FormatWriter(FormatterConfig config, TreeOracle tree) {
        this.config = config;
        this.tree = tree;
        this.formatTokens = FormatToken.formatTokens(tree.tokens());
        this.literalFormatter = LiteralFormatter.literalFormatter(config, tree);
        this.alignmentEngine = AlignmentEngine.alignmentEngine(config, tree);
        this.topLevelStatements = TopLevelStatements.topLevelStatements(config, tree);
    }

    /**
     * Factory method.
     */
    public static FormatWriter formatWriter(FormatterConfig config, TreeOracle tree) {
        return new FormatWriter(config, tree);
    }

    /**
     * Boundaries of the token stream, in order.
     */
    public List<FormatToken> formatTokens() {
        return formatTokens;
    }

    /**
     * Render the output for the given splits and the layout states they produced.
     *
     * @throws FormatWriterError.PreconditionViolation if the decision sequence does not fit the token stream
     */
    public String mkString(List<Split> splits, List<State> states) {
        return render(FormatLocations.formatLocations(formatTokens, splits, states));
    }

    /**
     * Render prepared locations in a single forward pass.
     *
     * @throws FormatWriterError.PreconditionViolation if the locations were built for another token stream
     */
    public String render(FormatLocations locations) {
        if (locations.formatTokens().size() != formatTokens.size()) {
            throw FormatWriterError.treeMismatch(tree.tokens().size(), locations.formatTokens().size());
        }

        var tokenAligns = alignmentEngine.alignmentTokens(locations);
        var whitespacePolicy = WhitespacePolicy.whitespacePolicy(tokenAligns, topLevelStatements);
        var commaNormalizer = TrailingCommaNormalizer.trailingCommaNormalizer(config, tree, whitespacePolicy);
        var sb = new OutputBuffer(locations.size());

        for (int i = 0; i < locations.size(); i++) {
            var location = locations.get(i);
            var text = literalFormatter.format(location.formatToken().left(),
                                               location.state().indentation(),
                                               sb::currentColumn);
            sb.appendToken(i, text);
            commaNormalizer.formatWhitespace(locations, i, sb);
        }

        log.debug("Rendered {} locations, {} aligned", locations.size(), tokenAligns.size());
        return sb.toString();
    }
}
