// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.markup;

/**
 * A position in a markup document, used for error reporting.
 *
 * @param lineNumber The one-based line number.
 */
public record SourceLocation(int lineNumber) {
    @Override
    public String toString() {
        return "line " + lineNumber;
    }
}
