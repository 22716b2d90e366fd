// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The {@code panprob} command: renders problems and problem banks to HTML on standard output.
 */
@NonNullByDefault
package panprob.cli;

import panprob.util.annotation.NonNullByDefault;
