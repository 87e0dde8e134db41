package org.pragmatica.fmt.config;

import java.util.Locale;

/**
 * Case normalization applied to numeric literals.
 */
public enum LiteralCase {
    UPPER {
        @Override
        public String process(String text) {
            return text.toUpperCase(Locale.ROOT);
        }
    },
    LOWER {
        @Override
        public String process(String text) {
            return text.toLowerCase(Locale.ROOT);
        }
    },
    UNCHANGED {
        @Override
        public String process(String text) {
            return text;
        }
    };

    public abstract String process(String text);
}
