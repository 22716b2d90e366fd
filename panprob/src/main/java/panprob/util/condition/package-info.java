// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system used in place of exceptions for every recoverable failure: malformed markup,
 * unresolvable resources, invalid trees, unreadable problem directories.
 */
@NonNullByDefault
package panprob.util.condition;

import panprob.util.annotation.NonNullByDefault;
