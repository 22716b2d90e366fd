// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition.exception;

import java.io.IOException;

/**
 * An I/O operation failed, for instance writing rendered HTML to standard output.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
