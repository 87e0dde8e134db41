package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.config.FormatterConfig;
import org.pragmatica.fmt.token.FormatToken;
import org.pragmatica.fmt.token.Token;
import org.pragmatica.fmt.tree.NodeRole;
import org.pragmatica.fmt.tree.SyntaxNode;
import org.pragmatica.fmt.tree.TreeOracle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes how many extra spaces to put before tokens so that configured tokens line up vertically.
 *
 * Consecutive lines with matching candidate columns form a block. When the block ends, every shared
 * column is padded up to the widest line of the block:
 *
 * <pre>
 * case a      => 1
 * case bbbbbb => 2
 * </pre>
 */
final class AlignmentEngine {
    private static final Logger log = LoggerFactory.getLogger(AlignmentEngine.class);
    private static final String LINE_COMMENT = "//";

    private final FormatterConfig config;
    private final TreeOracle tree;

    private AlignmentEngine(FormatterConfig config, TreeOracle tree) {
        this.config = config;
        this.tree = tree;
    }

    static AlignmentEngine alignmentEngine(FormatterConfig config, TreeOracle tree) {
        return new AlignmentEngine(config, tree);
    }

    /**
     * Extra padding per boundary. Boundaries absent from the result need none.
     */
    Map<FormatToken, Integer> alignmentTokens(FormatLocations locations) {
        if (config.alignTokens().isEmpty() || !locations.isComplete()) {
            return Map.of();
        }

        var result = new HashMap<FormatToken, Integer>();
        var block = new ArrayList<List<FormatLocation>>();
        int minMatches = Integer.MAX_VALUE;
        int size = locations.size();
        int i = 0;

        while (i < size) {
            var candidates = new ArrayList<FormatLocation>();
            while (i < size && !locations.get(i).isNewline()) {
                if (isCandidate(locations.get(i))) {
                    candidates.add(locations.get(i));
                }
                i++;
            }

            // input ended without a line break: the last boundary closes the line
            boolean lastLine = i >= size - 1;
            var endOfLine = locations.get(Math.min(i, size - 1));
            int newlines = i < size ? endOfLine.newlines() : 0;

            if (block.isEmpty()) {
                if (!candidates.isEmpty() && newlines == 1) {
                    block.add(candidates);
                }
            } else {
                int matches = columnsMatch(block.get(block.size() - 1), candidates, endOfLine.formatToken());
                minMatches = Math.min(minMatches, matches > 0 ? matches : block.get(0).size());

                if (matches > 0) {
                    block.add(candidates);
                }
                if (matches == 0 || newlines > 1 || lastLine) {
                    flush(block, minMatches, result);
                    block = new ArrayList<>();
                    if (!candidates.isEmpty() && newlines <= 1) {
                        block.add(candidates);
                    }
                    minMatches = Integer.MAX_VALUE;
                }
            }
            i++;
        }
        return Map.copyOf(result);
    }

    private void flush(List<List<FormatLocation>> block, int columns, Map<FormatToken, Integer> result) {
        log.debug("Aligning {} columns over {} lines", columns, block.size());

        for (int column = 0; column < columns; column++) {
            var widths = new int[block.size()];
            int maxWidth = Integer.MIN_VALUE;

            for (int row = 0; row < block.size(); row++) {
                var line = block.get(row);
                var location = line.get(column);
                int columnWidth;

                if (column == 0) {
                    columnWidth = location.state().column();
                } else {
                    var previous = line.get(column - 1);
                    int previousColumn = previous.state().column() - previous.formatToken().right().length();
                    columnWidth = location.state().column() - previousColumn;
                }
                widths[row] = columnWidth - location.formatToken().right().length();
                maxWidth = Math.max(maxWidth, widths[row]);
            }
            for (int row = 0; row < block.size(); row++) {
                result.put(block.get(row).get(column).formatToken(), maxWidth - widths[row]);
            }
        }
    }

    boolean isCandidate(FormatLocation location) {
        var token = location.formatToken().right();
        var code = token.isSingleLineComment() ? LINE_COMMENT : token.text();
        var rule = config.alignTokens().get(code);

        return rule != null && rule.matchesOwner(alignOwner(location.formatToken()).className());
    }

    /**
     * Key of the column a token belongs to, after merging configured equivalent kinds.
     */
    AlignKey key(Token token) {
        return new AlignKey(config.tokenCategory(token.typeName()),
                            config.treeCategory(tree.owner(token).kind()));
    }

    SyntaxNode alignOwner(FormatToken formatToken) {
        // a line ending in a comment belongs to whatever precedes the comment
        if (formatToken.right().isSingleLineComment()) {
            return tree.owner(formatToken.left());
        }
        var owner = tree.owner(formatToken.right());
        if (owner.is(NodeRole.NAME)) {
            var parent = tree.parent(owner);
            if (parent.isPresent() && parent.get().is(NodeRole.INFIX_APPLY)) {
                return parent.get();
            }
        }
        return owner;
    }

    private int columnsMatch(List<FormatLocation> a, List<FormatLocation> b, FormatToken endOfLine) {
        int count = Math.min(a.size(), b.size());
        int matches = 0;

        while (matches < count && rowsMatch(a.get(matches), b.get(matches), endOfLine)) {
            matches++;
        }
        return matches;
    }

    private boolean rowsMatch(FormatLocation row1, FormatLocation row2, FormatToken endOfLine) {
        // adjacent line comments always align
        if (row1.formatToken().right().isSingleLineComment() && row2.formatToken().right().isSingleLineComment()) {
            return true;
        }
        var row1Owner = alignOwner(row1.formatToken());
        var row2Owner = alignOwner(row2.formatToken());

        if (!key(row1.formatToken().right()).equals(key(row2.formatToken().right()))) {
            return false;
        }
        if (row1Owner.depth() != row2Owner.depth()) {
            return false;
        }
        var endOfLineParents = tree.ancestors(tree.owner(endOfLine.right()));

        return !endOfLineParents.contains(row1Owner) && !endOfLineParents.contains(row2Owner);
    }

    record AlignKey(String tokenCategory, String treeCategory) {}
}
