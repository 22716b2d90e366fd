// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.cli;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReentrantLock;
import panprob.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * Exclusive access to the standard streams, for try-with-resources.
 * <p>
 * Rendered HTML goes to {@link #out()}, always encoded as UTF-8; diagnostics go to {@link #err()}; restart choices are
 * read from {@link #in()}.
 */
final class Streams implements AutoCloseable {
    // Unlocked in close().
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams() {
        try {
            Holder.lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    static Streams acquire() {
        return new Streams();
    }

    @Override
    public void close() {
        Holder.lock.unlock();
    }

    @SuppressWarnings("MethodMayBeStatic")
    Writer out() {
        return Holder.outputWriter;
    }

    @SuppressWarnings({"MethodMayBeStatic", "SameReturnValue", "UseOfSystemOutOrSystemErr"})
    PrintStream err() {
        return System.err;
    }

    @SuppressWarnings("MethodMayBeStatic")
    BufferedReader in() {
        return Holder.inputReader;
    }

    // Initialized on first use only.
    private static final class Holder {
        private static Charset getInputCharset() {
            final var console = System.console();
            return (console == null) ? Charset.defaultCharset() : console.charset();
        }

        private static final ReentrantLock lock = new ReentrantLock();
        private static final BufferedReader inputReader =
            new BufferedReader(new InputStreamReader(new StandardInput(), getInputCharset()));
        @SuppressWarnings("UseOfSystemOutOrSystemErr")
        private static final Writer outputWriter =
            new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }

    // Reads through to System.in on every call, so that a later System.setIn is honored.
    private static final class StandardInput extends InputStream {
        @Override
        public int read(final byte @NonNull [] bytes, final int offset, final int length) throws IOException {
            return System.in.read(bytes, offset, length);
        }

        @Override
        public int available() throws IOException {
            return System.in.available();
        }

        @Override
        public int read() throws IOException {
            return System.in.read();
        }
    }
}
