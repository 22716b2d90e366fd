// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Removal of common indentation from code blocks.
 */
final class Dedent {
    private Dedent() {
    }

    /**
     * Removes the longest run of spaces and tabs shared by the start of every line that has other characters on it.
     * <p>
     * Lines made only of spaces and tabs become empty and do not take part in computing the common indentation.
     */
    static String dedent(final String text) {
        final var lines = text.split("\n", -1);
        @Nullable String margin = null;
        for (int i = 0; i < lines.length; i += 1) {
            final var line = lines[i];
            final var indentLength = indentLength(line);
            if (indentLength == line.length()) {
                lines[i] = "";
                continue;
            }
            final var indent = line.substring(0, indentLength);
            margin = (margin == null) ? indent : commonPrefix(margin, indent);
        }
        if (margin != null && !margin.isEmpty()) {
            final var marginLength = margin.length();
            for (int i = 0; i < lines.length; i += 1) {
                if (lines[i].startsWith(margin)) {
                    lines[i] = lines[i].substring(marginLength);
                }
            }
        }
        return String.join("\n", lines);
    }

    private static int indentLength(final String line) {
        var length = 0;
        while (length < line.length() && isIndentCharacter(line.charAt(length))) {
            length += 1;
        }
        return length;
    }

    private static String commonPrefix(final String first, final String second) {
        final var limit = Math.min(first.length(), second.length());
        var length = 0;
        while (length < limit && first.charAt(length) == second.charAt(length)) {
            length += 1;
        }
        return first.substring(0, length);
    }

    private static boolean isIndentCharacter(final char ch) {
        return ch == ' ' || ch == '\t';
    }
}
