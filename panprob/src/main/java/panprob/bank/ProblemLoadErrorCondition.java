// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.bank;

import panprob.util.condition.Condition;

/**
 * A condition type indicating that a problem, or the bank containing it, could not be loaded.
 */
public final class ProblemLoadErrorCondition extends Condition {
    ProblemLoadErrorCondition(final String identifier, final String message) {
        super("Problem " + identifier + ": " + message);
        this.identifier = identifier;
    }

    /**
     * Returns the identifier, that is, the directory name, of the offending problem.
     */
    public String identifier() {
        return identifier;
    }

    private final String identifier;
}
