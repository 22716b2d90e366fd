// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.bank;

import java.nio.file.Path;

/**
 * A problem as found on disk, before parsing.
 *
 * @param identifier The name of the problem directory, e.g. {@code "07"}.
 * @param directory  The problem directory; images and code files are resolved against it.
 * @param contents   The markup with the front matter removed.
 * @param metadata   The parsed front matter.
 */
public record ProblemSource(String identifier, Path directory, String contents, ProblemMetadata metadata) {
}
