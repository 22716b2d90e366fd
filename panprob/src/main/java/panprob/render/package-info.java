// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * HTML output of problem trees.
 */
@NonNullByDefault
package panprob.render;

import panprob.util.annotation.NonNullByDefault;
