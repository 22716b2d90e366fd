// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conversion of markup trees into problem trees, and the paragraph pass that runs afterwards.
 */
@NonNullByDefault
package panprob.parser;

import panprob.util.annotation.NonNullByDefault;
