// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import panprob.markup.SourceLocation;
import panprob.util.condition.Condition;

/**
 * A condition type indicating that the converter has no conversion for an environment or command name.
 */
public final class UnknownConstructCondition extends Condition {
    UnknownConstructCondition(final String kind, final String name, final SourceLocation location) {
        super("Unknown " + kind + " '" + name + '\'');
        this.name = name;
        this.location = location;
    }

    /**
     * Returns the name of the unknown construct.
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
