// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.markup;

import panprob.util.condition.Condition;

/**
 * A condition type indicating that a markup document could not be tokenized.
 */
public final class MarkupReadErrorCondition extends Condition {
    MarkupReadErrorCondition(final String rawMessage, final SourceLocation location) {
        super(rawMessage);
        this.location = location;
    }

    /**
     * Returns where in the document the problem was found.
     */
    public SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nIn " + location;
    }

    private final SourceLocation location;
}
