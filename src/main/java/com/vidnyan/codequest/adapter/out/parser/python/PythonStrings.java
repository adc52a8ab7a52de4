package com.vidnyan.codequest.adapter.out.parser.python;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * String literal decoding and docstring cleanup.
 */
final class PythonStrings {

    private static final int TAB_SIZE = 8;

    private PythonStrings() {
    }

    /**
     * Value of a string literal token: prefix and quotes removed, escapes decoded unless raw.
     */
    static String literalValue(String literal) {
        int quote = 0;
        while (literal.charAt(quote) != '\'' && literal.charAt(quote) != '"') {
            quote++;
        }
        boolean raw = literal.substring(0, quote).toLowerCase(Locale.ROOT).contains("r");
        char q = literal.charAt(quote);
        int width = literal.startsWith(String.valueOf(q).repeat(3), quote) && literal.length() - quote >= 6 ? 3 : 1;
        String body = literal.substring(quote + width, literal.length() - width);
        return raw ? body : unescape(body);
    }

    private static String unescape(String body) {
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case '\n' -> {
                }
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case '0' -> out.append('\0');
                case '\\', '\'', '"' -> out.append(next);
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }

    /**
     * Clean up docstring indentation the way {@code inspect.cleandoc} does: tabs expanded,
     * first line stripped, common indentation of the remaining lines removed, leading
     * and trailing blank lines dropped.
     */
    static String cleandoc(String doc) {
        List<String> lines = new ArrayList<>(Arrays.asList(expandTabs(doc).split("\n", -1)));

        int margin = Integer.MAX_VALUE;
        for (String line : lines.subList(1, lines.size())) {
            String content = line.stripLeading();
            if (!content.isEmpty()) {
                margin = Math.min(margin, line.length() - content.length());
            }
        }

        lines.set(0, lines.get(0).stripLeading());
        if (margin != Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                lines.set(i, line.length() > margin ? line.substring(margin) : line.stripLeading());
            }
        }

        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }

    private static String expandTabs(String text) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        int column = 0;
        for (char c : text.toCharArray()) {
            if (c == '\t') {
                int spaces = TAB_SIZE - column % TAB_SIZE;
                out.append(" ".repeat(spaces));
                column += spaces;
            } else {
                out.append(c);
                column = c == '\n' ? 0 : column + 1;
            }
        }
        return out.toString();
    }
}
