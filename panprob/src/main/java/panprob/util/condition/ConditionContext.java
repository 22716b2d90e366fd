// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util.condition;

import java.util.Iterator;
import java.util.NoSuchElementException;
import panprob.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-thread registry of condition handlers and restart points.
 * <p>
 * The registry itself is never handed out; the static methods below always act on the calling thread's instance.
 * Parsing and rendering a problem happens on a single thread, so handlers and restarts are never shared between
 * threads.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals a non-fatal condition.
     * <p>
     * Handlers run newest first. A handler that returns normally declines the condition and the next one runs; once
     * every handler has declined, this method returns.
     * <p>
     * A handler may unwind to a restart instead, in which case {@link Unwind} propagates out of this method.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals a fatal condition.
     * <p>
     * Runs the handlers exactly like {@link #signal(Condition)}, but if all of them decline, throws
     * {@link UnhandledErrorError}. Since this method never returns normally, call sites write
     * {@code throw ConditionContext.error(...)} to keep the compiler's flow analysis accurate.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a restart point named {@code restartName} established around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if something unwound to the restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns the restart points currently established on this thread, newest first.
     */
    public static @NotNull Iterable<@NotNull Restart> restarts() {
        return localContext().new RestartIterable();
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from inside a handler only reaches the handlers established before that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    private final class RestartIterable implements Iterable<@NotNull Restart> {
        @Override
        public @NotNull Iterator<@NotNull Restart> iterator() {
            return new RestartIterator(firstRestart);
        }
    }

    private static final class RestartIterator implements Iterator<@NotNull Restart> {
        private RestartIterator(final @Nullable Restart firstRestart) {
            current = firstRestart;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NotNull Restart next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more restarts left");
            }
            current = result.next;
            return result;
        }

        private @Nullable Restart current;
    }
}
