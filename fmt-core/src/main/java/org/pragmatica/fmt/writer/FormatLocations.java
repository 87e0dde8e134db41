package org.pragmatica.fmt.writer;

import org.pragmatica.fmt.split.Split;
import org.pragmatica.fmt.split.State;
import org.pragmatica.fmt.token.FormatToken;
import org.pragmatica.fmt.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, immutable sequence of format locations, one per decided boundary.
 *
 * Also gives access to the full boundary sequence, which may be longer when the decision sequence is partial.
 */
public final class FormatLocations {
    private static final Logger log = LoggerFactory.getLogger(FormatLocations.class);
    private static final int TRACE_LIMIT = 1000;

    private final List<FormatToken> formatTokens;
    private final List<FormatLocation> locations;

    private FormatLocations(List<FormatToken> formatTokens, List<FormatLocation> locations) {
        this.formatTokens = formatTokens;
        this.locations = locations;
    }

    /**
     * Pair every split with its boundary and layout state.
     *
     * @throws FormatWriterError.PreconditionViolation if there are more splits than boundaries,
     *                                                 or the state count differs from the split count
     */
    public static FormatLocations formatLocations(List<FormatToken> formatTokens, List<Split> splits, List<State> states) {
        if (formatTokens.size() < splits.size()) {
            throw FormatWriterError.tooManySplits(splits.size(), formatTokens.size());
        }
        if (states.size() != splits.size()) {
            throw FormatWriterError.stateCountMismatch(splits.size(), states.size());
        }

        var locations = new ArrayList<FormatLocation>(splits.size());
        boolean trace = log.isDebugEnabled() && formatTokens.size() < TRACE_LIMIT;

        for (int i = 0; i < splits.size(); i++) {
            var location = FormatLocation.formatLocation(formatTokens.get(i), splits.get(i), states.get(i));
            locations.add(location);

            if (trace) {
                log.debug(String.format("%-15s %s %d %d",
                                        cleanup(location.formatToken().left()),
                                        location.split(),
                                        location.state().indentation(),
                                        location.state().column()));
            }
        }
        return new FormatLocations(List.copyOf(formatTokens), List.copyOf(locations));
    }

    private static String cleanup(Token token) {
        var text = token.text()
                        .replace("\n", "\\n");
        return text.length() > 15 ? text.substring(0, 15) : text;
    }

    public int size() {
        return locations.size();
    }

    public FormatLocation get(int index) {
        return locations.get(index);
    }

    public List<FormatToken> formatTokens() {
        return formatTokens;
    }

    /**
     * Every boundary of the token stream has a decision.
     */
    public boolean isComplete() {
        return locations.size() == formatTokens.size();
    }

    /**
     * Index of the first location at or after {@code from} matching the predicate, or -1.
     */
    public int indexWhere(Predicate<FormatLocation> predicate, int from) {
        for (int i = Math.max(from, 0); i < locations.size(); i++) {
            if (predicate.test(locations.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the last location at or before {@code from} matching the predicate, or -1.
     */
    public int lastIndexWhere(Predicate<FormatLocation> predicate, int from) {
        for (int i = Math.min(from, locations.size() - 1); i >= 0; i--) {
            if (predicate.test(locations.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * First boundary at or after the given one whose right token is not a comment; the last boundary if none.
     */
    public FormatToken nextNonComment(FormatToken formatToken) {
        int index = formatToken.index();
        while (formatToken.right().isComment() && index + 1 < formatTokens.size()) {
            formatToken = formatTokens.get(++index);
        }
        return formatToken;
    }

    /**
     * Number of boundaries skipped by {@link #nextNonComment(FormatToken)}.
     */
    public int distanceToNextNonComment(FormatToken formatToken) {
        return nextNonComment(formatToken).index() - formatToken.index();
    }

    /**
     * Last boundary at or before the given one whose left token is not a comment; the first boundary if none.
     */
    public FormatToken prevNonComment(FormatToken formatToken) {
        int index = formatToken.index();
        while (formatToken.left().isComment() && index > 0) {
            formatToken = formatTokens.get(--index);
        }
        return formatToken;
    }

    /**
     * Boundary whose left token is the given token, if the token is not the last one.
     */
    public Optional<FormatToken> after(Token token) {
        return token.index() < formatTokens.size()
               ? Optional.of(formatTokens.get(token.index()))
               : Optional.empty();
    }

    /**
     * Boundary whose right token is the given token, if the token is not the first one.
     */
    public Optional<FormatToken> before(Token token) {
        return token.index() > 0
               ? Optional.of(formatTokens.get(token.index() - 1))
               : Optional.empty();
    }
}
