// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import panprob.bank.ProblemLoader;
import panprob.bank.ProblemSource;
import panprob.parser.ProblemParser;
import panprob.render.HtmlRenderer;
import panprob.render.RenderOptions;
import panprob.util.Trace;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.Handler;
import panprob.util.condition.exception.IOExceptionCondition;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        var embedImages = false;
        final var paths = new ArrayList<Path>();
        for (final var arg : args) {
            if ("--embed-images".equals(arg)) {
                embedImages = true;
            } else if (arg.startsWith("--")) {
                return usageError("Unknown option " + arg);
            } else {
                paths.add(Path.of(arg));
            }
        }
        if (paths.isEmpty()) {
            return usageError("At least one problem or problem bank directory expected");
        }
        final var options = new RenderOptions(embedImages);

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                var allRendered = true;
                for (final var path : paths) {
                    for (final var directory : problemDirectories(path)) {
                        allRendered &= renderProblem(directory, options);
                    }
                }
                return allRendered ? ExitCode.SUCCESS : ExitCode.ERROR;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static List<Path> problemDirectories(final Path path) {
        return ProblemLoader.isProblemDirectory(path) ? List.of(path) : ProblemLoader.listProblemDirectories(path);
    }

    private static boolean renderProblem(final Path directory, final RenderOptions options) {
        final var rendered = ConditionContext.withRestart("skip-problem", restart -> {
            final var source = ProblemLoader.loadProblem(directory);
            try (final var trace = new Trace(() -> "Rendering problem " + source.identifier())) {
                trace.use();
                final var html = HtmlRenderer.renderToString(ProblemParser.parse(source.contents(), directory), options);
                writeOutput(source, html);
                return Boolean.TRUE;
            }
        });
        return rendered != null;
    }

    private static void writeOutput(final ProblemSource source, final String html) {
        try (final var streams = Streams.acquire()) {
            final var out = streams.out();
            out.write("<!-- problem " + source.identifier() + " -->\n");
            out.write(html);
            out.write('\n');
            out.flush();
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private static ExitCode usageError(final String message) {
        try (final var streams = Streams.acquire()) {
            streams.err().println(message);
            streams.err().println("Usage: panprob [--embed-images] <problem or bank directory>...");
            return ExitCode.USAGE;
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
