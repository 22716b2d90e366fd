// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import panprob.util.Trace;
import panprob.util.condition.Condition;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.HandlerProcedure;
import panprob.util.condition.Restart;
import panprob.util.condition.SignaledCondition;

/**
 * The outermost handler: reports fatal conditions to the user and lets them pick a restart.
 * <p>
 * Non-fatal conditions are declined.
 */
final class FallbackHandler implements HandlerProcedure {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            return;
        }
        final var restarts = new ArrayList<Restart>();
        ConditionContext.restarts().forEach(restarts::add);
        try (final var streams = Streams.acquire()) {
            showCondition(streams.err(), condition.condition());
            chooseRestart(streams, restarts).unwindTo();
        }
    }

    private static void showCondition(final PrintStream err, final Condition condition) {
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.activeTraces()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static Restart chooseRestart(final Streams streams, final List<Restart> restarts) {
        if (restarts.isEmpty()) {
            throw new IllegalStateException("No restarts available");
        }
        final var last = restarts.get(restarts.size() - 1);

        final var err = streams.err();
        showRestarts(err, restarts);
        while (true) {
            err.print("Enter restart number > ");
            try {
                final var line = streams.in().readLine();
                if (line == null) {
                    err.println("End of input found, picking the outermost restart, " + last.name() + '.');
                    return last;
                }
                final var index = Integer.parseInt(line.strip());
                if (index >= 1 && index <= restarts.size()) {
                    return restarts.get(index - 1);
                }
                err.println("Invalid restart index " + index + ", value out of bounds.");
            } catch (final NumberFormatException e) {
                err.println("Restart index not an integer: " + e.getMessage());
            } catch (final IOException e) {
                err.println("I/O error occurred: " + e);
                err.println("Picking the outermost restart, " + last.name() + '.');
                return last;
            }
        }
    }

    private static void showRestarts(final PrintStream stream, final List<Restart> restarts) {
        var index = 1;
        stream.println("Available restarts:");
        for (final var restart : restarts) {
            stream.println(" " + index + ". " + restart.name());
            index += 1;
        }
        stream.println();
    }

    private static final FallbackHandler instance = new FallbackHandler();
}
