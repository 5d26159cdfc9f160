package com.tandemsystems.contract;

import javax.lang.model.SourceVersion;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives operation names from variant identifiers.
 */
public final class OperationNames {

    public static final String NO_WAIT_SUFFIX = "_no_wait";

    private OperationNames() {
    }

    /**
     * Converts a PascalCase identifier to snake_case.
     * A word starts at an uppercase letter that follows a lowercase letter or a digit, and at the
     * last uppercase letter of an uppercase run followed by a lowercase letter, so
     * {@code MsgOne -> msg_one} and {@code HTTPServer -> http_server}. Existing underscores
     * separate words too.
     *
     * @param identifier a variant identifier
     * @return the snake_case form, never empty
     * @throws IllegalArgumentException if the identifier contains no letter or digit
     */
    public static String snakeCase(String identifier) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        int length = identifier.length();

        for (int i = 0; i < length; i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                flush(word, words);
                continue;
            }
            if (Character.isUpperCase(c) && word.length() > 0) {
                char previous = identifier.charAt(i - 1);
                char next = i + 1 < length ? identifier.charAt(i + 1) : '\0';
                boolean startsWord = Character.isLowerCase(previous)
                        || Character.isDigit(previous)
                        || (Character.isUpperCase(previous) && Character.isLowerCase(next));
                if (startsWord) {
                    flush(word, words);
                }
            }
            word.append(Character.toLowerCase(c));
        }
        flush(word, words);

        if (words.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive an operation name from '" + identifier + "'");
        }
        return String.join("_", words);
    }

    /**
     * Returns the wait-form operation name of a variant. The result is always a valid Java
     * identifier: a keyword or literal gets a trailing underscore, a leading digit a leading one.
     *
     * @param variantName the variant identifier
     * @return the operation name
     */
    public static String waitName(String variantName) {
        return escape(snakeCase(variantName));
    }

    /**
     * Returns the no-wait operation name of a variant.
     *
     * @param variantName the variant identifier
     * @return the wait-form base name followed by {@value #NO_WAIT_SUFFIX}
     */
    public static String noWaitName(String variantName) {
        return escape(snakeCase(variantName) + NO_WAIT_SUFFIX);
    }

    private static String escape(String name) {
        String escaped = Character.isDigit(name.charAt(0)) ? "_" + name : name;
        return SourceVersion.isKeyword(escaped) ? escaped + "_" : escaped;
    }

    private static void flush(StringBuilder word, List<String> words) {
        if (word.length() > 0) {
            words.add(word.toString());
            word.setLength(0);
        }
    }
}
