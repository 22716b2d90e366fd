// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Loading problems and problem banks from disk.
 * <p>
 * A bank is a directory of numbered problem directories; each problem directory holds a {@code problem.tex} file,
 * optionally starting with YAML front matter on {@code %%} lines, plus any images and code files it references.
 */
@NonNullByDefault
package panprob.bank;

import panprob.util.annotation.NonNullByDefault;
