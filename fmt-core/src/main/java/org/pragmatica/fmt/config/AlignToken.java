package org.pragmatica.fmt.config;

import java.util.regex.Pattern;

/**
 * Token to align vertically, restricted to owners whose class name matches {@code owner}.
 *
 * @param code  token text, or {@code //} for single-line comments
 * @param owner pattern searched for in the owner's class name
 */
public record AlignToken(String code, Pattern owner) {

    public static AlignToken alignToken(String code, String ownerRegex) {
        return new AlignToken(code, Pattern.compile(ownerRegex));
    }

    public boolean matchesOwner(String className) {
        return owner.matcher(className).find();
    }
}
