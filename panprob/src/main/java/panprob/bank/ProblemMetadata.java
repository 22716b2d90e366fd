// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.bank;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The front matter of a problem.
 *
 * @param tags   Topics the problem covers; empty if none were given.
 * @param source Where the problem comes from, e.g. the exam it first appeared in, or {@code null} if unknown.
 */
public record ProblemMetadata(List<String> tags, @Nullable String source) {
    @JsonCreator
    public ProblemMetadata(
        @JsonProperty("tags") final @Nullable List<String> tags,
        @JsonProperty("source") final @Nullable String source
    ) {
        this.tags = (tags == null) ? List.of() : List.copyOf(tags);
        this.source = source;
    }

    /**
     * Returns the metadata of a problem without front matter.
     */
    public static ProblemMetadata empty() {
        return emptyMetadata;
    }

    private static final ProblemMetadata emptyMetadata = new ProblemMetadata(List.of(), null);
}
