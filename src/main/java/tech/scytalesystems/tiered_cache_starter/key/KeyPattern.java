package tech.scytalesystems.tiered_cache_starter.key;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1150h
 * <p>Shell-style wildcard matching with the same rules Redis applies to {@code SCAN MATCH},
 * so the L1 tier removes the same keys the remote tiers do.
 * <p>- {@code *} any sequence, including empty
 * <p>- {@code ?} exactly one character
 * <p>- {@code [abc]}, {@code [a-z]}, {@code [^a]} character classes; {@code [z-a]} is read as {@code [a-z]}
 * <p>- {@code \x} the literal character x
 */
public final class KeyPattern implements Predicate<String> {
    private final String glob;
    private final Pattern regex;

    private KeyPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static KeyPattern compile(String glob) {
        if (glob == null) throw new IllegalArgumentException("Pattern cannot be null");

        return new KeyPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
    }

    @Override
    public boolean test(String key) {
        return key != null && regex.matcher(key).matches();
    }

    public String glob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;

        while (i < glob.length()) {
            char c = glob.charAt(i);

            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        i++;
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        regex.append("\\\\");
                    }
                }
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);

                    if (close < 0) {
                        // Unterminated class is a literal '['
                        regex.append("\\[");
                    } else {
                        regex.append(characterClass(glob.substring(i + 1, close)));
                        i = close;
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }

            i++;
        }

        return regex.toString();
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int start = 0;

        if (body.startsWith("^")) {
            cls.append('^');
            start = 1;
        }

        // "[]" matches nothing, "[^]" any one character
        if (start == body.length()) return start == 0 ? "(?!)" : ".";

        for (int j = start; j < body.length(); j++) {
            char c = body.charAt(j);

            if (j + 2 < body.length() && body.charAt(j + 1) == '-') {
                char end = body.charAt(j + 2);
                // Redis swaps the ends of a reversed range
                appendClassChar(cls, (char) Math.min(c, end));
                cls.append('-');
                appendClassChar(cls, (char) Math.max(c, end));
                j += 2;
            } else {
                appendClassChar(cls, c);
            }
        }

        return cls.append(']').toString();
    }

    private static void appendClassChar(StringBuilder cls, char c) {
        if (Character.isLetterOrDigit(c)) {
            cls.append(c);
        } else {
            cls.append('\\').append(c);
        }
    }

    @Override
    public String toString() {
        return glob;
    }
}
