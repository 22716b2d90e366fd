// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.bank;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import panprob.util.Trace;
import panprob.util.condition.ConditionContext;
import panprob.util.condition.UnhandledErrorError;

/**
 * Reads problems and problem banks from disk.
 * <p>
 * Every failure signals a fatal {@link ProblemLoadErrorCondition}.
 */
public final class ProblemLoader {
    private ProblemLoader() {
    }

    /**
     * Returns {@code true} if {@code directory} looks like a single problem rather than a bank.
     */
    public static boolean isProblemDirectory(final Path directory) {
        return Files.isRegularFile(directory.resolve(problemFileName));
    }

    /**
     * Loads the problem in {@code directory}.
     * <p>
     * Leading lines of {@code problem.tex} that start with {@code %%} are the front matter: with the leading
     * {@code %} and space characters removed, they form a YAML mapping with the optional keys {@code tags}, a list of
     * strings, and {@code source}, a string. The rest of the file, trimmed, is the problem markup.
     */
    public static ProblemSource loadProblem(final Path directory) {
        final var identifier = identifierOf(directory);
        try (final var trace = new Trace(() -> "Loading problem " + identifier + " from " + directory)) {
            trace.use();
            final var file = directory.resolve(problemFileName);
            if (!Files.isRegularFile(file)) {
                throw signalError(identifier, "directory " + directory + " does not contain a " + problemFileName
                    + " file");
            }
            final String raw;
            try {
                raw = Files.readString(file, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw signalError(identifier, "cannot read " + file + ": " + e.getMessage());
            }

            final var lines = raw.lines().toList();
            var frontMatterLength = 0;
            while (frontMatterLength < lines.size() && lines.get(frontMatterLength).startsWith(frontMatterPrefix)) {
                frontMatterLength += 1;
            }
            final var frontMatter = lines.subList(0, frontMatterLength).stream()
                .map(ProblemLoader::stripFrontMatterMarker)
                .collect(Collectors.joining("\n"))
                .strip();
            final var contents = String.join("\n", lines.subList(frontMatterLength, lines.size())).strip();
            return new ProblemSource(identifier, directory, contents, parseMetadata(identifier, frontMatter));
        }
    }

    /**
     * Lists the problem directories of the bank rooted at {@code root}, sorted by name.
     * <p>
     * Subdirectories whose names start with {@code .} or {@code _} are ignored; any other subdirectory must have a
     * numeric name, and no two may denote the same number.
     */
    public static List<Path> listProblemDirectories(final Path root) {
        try (final var trace = new Trace(() -> "Listing problems in " + root)) {
            trace.use();
            final List<Path> directories;
            try (final var stream = Files.list(root)) {
                directories = stream
                    .filter(Files::isDirectory)
                    .sorted(Comparator.comparing(ProblemLoader::identifierOf))
                    .toList();
            } catch (final IOException e) {
                throw signalError(identifierOf(root), "cannot list bank directory " + root + ": " + e.getMessage());
            }

            final var result = new ArrayList<Path>(directories.size());
            final var seenNumbers = new HashMap<BigInteger, String>();
            for (final var directory : directories) {
                final var name = identifierOf(directory);
                if (name.startsWith(".") || name.startsWith("_")) {
                    continue;
                }
                if (!isNumeric(name)) {
                    throw signalError(name, "name of problem directory " + directory + " is not a number");
                }
                final var previous = seenNumbers.put(new BigInteger(name), name);
                if (previous != null) {
                    throw signalError(name, "duplicate problem identifier, already used by " + previous);
                }
                result.add(directory);
            }
            return result;
        }
    }

    /**
     * Loads every problem of the bank rooted at {@code root}, in directory name order.
     */
    public static List<ProblemSource> loadBank(final Path root) {
        final var result = new ArrayList<ProblemSource>();
        for (final var directory : listProblemDirectories(root)) {
            result.add(loadProblem(directory));
        }
        return result;
    }

    private static ProblemMetadata parseMetadata(final String identifier, final String frontMatter) {
        if (frontMatter.isEmpty()) {
            return ProblemMetadata.empty();
        }
        try {
            final var metadata = yamlMapper.readValue(frontMatter, ProblemMetadata.class);
            return (metadata == null) ? ProblemMetadata.empty() : metadata;
        } catch (final JsonProcessingException e) {
            throw signalError(identifier, "issue with metadata: " + e.getOriginalMessage());
        }
    }

    private static String stripFrontMatterMarker(final String line) {
        var start = 0;
        while (start < line.length() && (line.charAt(start) == '%' || line.charAt(start) == ' ')) {
            start += 1;
        }
        return line.substring(start);
    }

    private static boolean isNumeric(final String name) {
        return !name.isEmpty() && name.chars().allMatch(Character::isDigit);
    }

    private static String identifierOf(final Path directory) {
        final var fileName = directory.getFileName();
        return (fileName == null) ? directory.toString() : fileName.toString();
    }

    private static UnhandledErrorError signalError(final String identifier, final String message) {
        return ConditionContext.error(new ProblemLoadErrorCondition(identifier, message));
    }

    private static final String problemFileName = "problem.tex";
    private static final String frontMatterPrefix = "%%";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
}
