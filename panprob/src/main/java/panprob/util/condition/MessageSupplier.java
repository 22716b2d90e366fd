// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

/**
 * Produces a trace message on demand.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
