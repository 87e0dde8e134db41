package org.pragmatica.fmt.split;

import java.util.Objects;

/**
 * Decision chosen for one boundary by the split search.
 *
 * @param modification separator decision
 * @param cost         penalty the search attached to this split; informational only
 */
public record Split(Modification modification, int cost) {

    public Split {
        Objects.requireNonNull(modification, "modification");
    }

    public static Split split(Modification modification) {
        return new Split(modification, 0);
    }

    public boolean isNewline() {
        return modification.isNewline();
    }

    @Override
    public String toString() {
        return cost == 0 ? modification.toString() : modification + ":" + cost;
    }
}
