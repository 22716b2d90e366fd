// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The problem tree: immutable, validated nodes with per-type child and attribute constraints.
 */
@NonNullByDefault
package panprob.ast;

import panprob.util.annotation.NonNullByDefault;
