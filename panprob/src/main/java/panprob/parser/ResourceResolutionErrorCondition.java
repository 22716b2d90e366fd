// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import panprob.util.condition.Condition;

/**
 * A condition type indicating that a file referenced by the document could not be read, either because reading it
 * failed or because its path is not valid on this system.
 */
public final class ResourceResolutionErrorCondition extends Condition {
    ResourceResolutionErrorCondition(final String name, final String path, final Exception cause) {
        super("Cannot read '" + path + "' referenced by \\" + name + ": " + cause.getMessage());
        this.name = name;
        this.path = path;
        this.cause = cause;
    }

    /**
     * Returns the name of the command that referenced the file.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the path as written in the document.
     */
    public String path() {
        return path;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nCaused by: " + cause;
    }

    private final String name;
    private final String path;
    private final Exception cause;
}
