// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.ast;

/**
 * The places a node can occur in. Every {@link NodeType} lists the contexts it is allowed in and names the context its
 * own children live in.
 */
enum Context {
    ROOT("root"),
    PROBLEM_BODY("problem body"),
    SUBPROBLEM_BODY("subproblem body"),
    CHOICE_LIST("choice list"),
    RICH_CONTENT("rich content"),
    PHRASING("phrasing");

    Context(final String readableName) {
        this.readableName = readableName;
    }

    @Override
    public String toString() {
        return readableName;
    }

    private final String readableName;
}
