// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import panprob.markup.SourceLocation;
import panprob.util.condition.Condition;

/**
 * A condition type indicating that a known construct was used incorrectly, for example with too few arguments.
 */
public final class MalformedConstructCondition extends Condition {
    MalformedConstructCondition(final String name, final String problem, final SourceLocation location) {
        super("Malformed '" + name + "': " + problem);
        this.name = name;
        this.location = location;
    }

    /**
     * Returns the name of the offending construct.
     */
    public String name() {
        return name;
    }

    public SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nIn " + location;
    }

    private final String name;
    private final SourceLocation location;
}
