// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small general-purpose helpers: operation traces and checked exception plumbing.
 */
@NonNullByDefault
package panprob.util;

import panprob.util.annotation.NonNullByDefault;
