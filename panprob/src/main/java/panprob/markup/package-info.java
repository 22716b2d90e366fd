// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Tokenization of the LaTeX-like problem markup into a generic tree of text, environments and commands.
 */
@NonNullByDefault
package panprob.markup;

import panprob.util.annotation.NonNullByDefault;
