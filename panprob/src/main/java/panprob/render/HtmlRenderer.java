// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.render;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import panprob.ast.Attributes;
import panprob.ast.Node;
import panprob.ast.NodeType;
import panprob.util.UnreachableCodeReachedError;
import panprob.util.condition.ConditionContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The problem-tree-to-HTML renderer.
 * <p>
 * Each node type is rendered by an entry of a table keyed by {@link NodeType}; a type without an entry signals a fatal
 * {@link MissingRendererCondition}. Children of block containers are separated by line feeds, children of a paragraph
 * are written back to back. Text and attribute values are HTML-escaped, formulas are wrapped in the delimiters MathJax
 * expects.
 */
public final class HtmlRenderer {
    private HtmlRenderer(final @NotNull Writer writer, final @NotNull RenderOptions options) {
        this.writer = writer;
        this.options = options;
    }

    /**
     * Renders the tree rooted at {@code node} to {@code writer} with default options.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void render(final @NotNull Writer writer, final @NotNull Node node) throws IOException {
        render(writer, node, RenderOptions.defaults());
    }

    /**
     * Renders the tree rooted at {@code node} to {@code writer}.
     * <p>
     * Any {@link IOException}s thrown by the writer are allowed to propagate.
     */
    public static void render(
        final @NotNull Writer writer,
        final @NotNull Node node,
        final @NotNull RenderOptions options
    ) throws IOException {
        new HtmlRenderer(writer, options).renderNode(node);
    }

    /**
     * Renders the tree rooted at {@code node} into a string, with default options.
     */
    public static @NotNull String renderToString(final @NotNull Node node) {
        return renderToString(node, RenderOptions.defaults());
    }

    /**
     * Renders the tree rooted at {@code node} into a string.
     */
    public static @NotNull String renderToString(final @NotNull Node node, final @NotNull RenderOptions options) {
        final var writer = new StringWriter();
        try {
            render(writer, node, options);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError("StringWriter threw an IOException: " + e);
        }
        return writer.toString();
    }

    private void renderNode(final @NotNull Node node) throws IOException {
        final var renderer = renderers.get(node.type());
        if (renderer == null) {
            throw ConditionContext.error(new MissingRendererCondition(node.type()));
        }
        renderer.render(this, node);
    }

    private void renderBlock(
        final @NotNull String openingTag,
        final @NotNull String closingTag,
        final @NotNull Node node
    ) throws IOException {
        writer.write(openingTag);
        var first = true;
        for (final var child : node.children()) {
            if (!first) {
                writer.write('\n');
            }
            first = false;
            renderNode(child);
        }
        writer.write(closingTag);
    }

    private void renderParagraph(final @NotNull Node node) throws IOException {
        writer.write("<p>");
        for (final var child : node.children()) {
            renderNode(child);
        }
        writer.write("</p>");
    }

    private void renderWrappedText(
        final @NotNull String prefix,
        final @NotNull String text,
        final @NotNull String suffix
    ) throws IOException {
        writer.write(prefix);
        writeEscaped(text, TextEscaper.instance);
        writer.write(suffix);
    }

    private void renderImage(final @NotNull Node node) throws IOException {
        final var relativePath = Attributes.getString(node, "relativePath");
        writer.write("<img src=\"");
        if (options.embedImages()) {
            writer.write("data:");
            writer.write(guessMediaType(relativePath));
            writer.write(";base64,");
            writer.write(Base64.getEncoder().encodeToString(Attributes.getBytes(node, "data")));
        } else {
            writeEscaped(relativePath, AttributeEscaper.instance);
        }
        writer.write("\" />");
    }

    private void writeEscaped(final @NotNull String string, final @NotNull Escaper escaper) throws IOException {
        int index = 0;
        int indexToEscape;
        while ((indexToEscape = findCharacterToEscape(string, index, escaper)) >= 0) {
            writer.write(string, index, indexToEscape - index);
            writer.write(Objects.requireNonNull(escaper.escape(string.charAt(indexToEscape))));
            index = indexToEscape + 1;
        }
        if (index < string.length()) {
            writer.write(string, index, string.length() - index);
        }
    }

    private static int findCharacterToEscape(
        final @NotNull String string,
        final int startIndex,
        final @NotNull Escaper escaper
    ) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            if (escaper.escape(string.charAt(i)) != null) {
                return i;
            }
        }
        return -1;
    }

    private static @NotNull String guessMediaType(final @NotNull String path) {
        final var dot = path.lastIndexOf('.');
        final var extension = (dot < 0) ? "" : path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (extension) {
            case "png" -> "image/png";
            case "jpg", "jpeg" -> "image/jpeg";
            case "gif" -> "image/gif";
            case "svg" -> "image/svg+xml";
            case "webp" -> "image/webp";
            default -> "application/octet-stream";
        };
    }

    private static @NotNull NodeRenderer block(final @NotNull String cssClass) {
        final var openingTag = "<div class=\"" + cssClass + "\">";
        return (final HtmlRenderer renderer, final Node node) -> renderer.renderBlock(openingTag, "</div>", node);
    }

    private static @NotNull NodeRenderer text(final @NotNull String prefix, final @NotNull String suffix) {
        return (final HtmlRenderer renderer, final Node node) ->
            renderer.renderWrappedText(prefix, Attributes.getString(node, "text"), suffix);
    }

    private static @NotNull NodeRenderer math(final @NotNull String prefix, final @NotNull String suffix) {
        return (final HtmlRenderer renderer, final Node node) ->
            renderer.renderWrappedText(prefix, Attributes.getString(node, "latex"), suffix);
    }

    private static @NotNull NodeRenderer code(final @NotNull String prefix, final @NotNull String suffix) {
        return (final HtmlRenderer renderer, final Node node) ->
            renderer.renderWrappedText(prefix, Attributes.getString(node, "code"), suffix);
    }

    private static @NotNull NodeRenderer fixed(final @NotNull String html) {
        return (final HtmlRenderer renderer, final Node node) -> renderer.writer.write(html);
    }

    private static @NotNull Map<NodeType, NodeRenderer> createRenderers() {
        final var result = new EnumMap<NodeType, NodeRenderer>(NodeType.class);
        result.put(NodeType.PROBLEM, block("problem"));
        result.put(NodeType.SUBPROBLEM, block("subproblem"));
        result.put(NodeType.PARAGRAPH, HtmlRenderer::renderParagraph);
        result.put(NodeType.NORMAL_TEXT, text("", ""));
        result.put(NodeType.BOLD_TEXT, text("<b>", "</b>"));
        result.put(NodeType.ITALIC_TEXT, text("<i>", "</i>"));
        result.put(NodeType.DISPLAY_MATH, math("<div class=\"math\">\\[", "\\]</div>"));
        result.put(NodeType.INLINE_MATH, math("<span class=\"math\">$", "$</span>"));
        result.put(NodeType.CODE, code("<pre class=\"code\">", "</pre>"));
        result.put(NodeType.INLINE_CODE, code("<span class=\"code\">", "</span>"));
        result.put(NodeType.IMAGE, HtmlRenderer::renderImage);
        result.put(NodeType.MULTIPLE_CHOICES, block("multiple-choices"));
        result.put(NodeType.MULTIPLE_SELECT, block("multiple-select"));
        result.put(NodeType.CHOICE, block("choice"));
        result.put(NodeType.TRUE_FALSE, fixed("<input type=\"checkbox\" class=\"true-false\" />"));
        result.put(NodeType.FILL_IN_THE_BLANK, fixed("<input type=\"text\" class=\"fill-in-the-blank\" />"));
        result.put(NodeType.SOLUTION, (final HtmlRenderer renderer, final Node node) ->
            renderer.renderBlock("<details><summary>Solution</summary>", "</details>", node));
        return result;
    }

    private static final Map<NodeType, NodeRenderer> renderers = createRenderers();

    private final @NotNull Writer writer;
    private final @NotNull RenderOptions options;

    @FunctionalInterface
    private interface NodeRenderer {
        void render(@NotNull HtmlRenderer renderer, @NotNull Node node) throws IOException;
    }

    private sealed interface Escaper {
        @Nullable String escape(char character);
    }

    private static final class TextEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return switch (character) {
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '&' -> "&amp;";
                default -> null;
            };
        }

        private static final TextEscaper instance = new TextEscaper();
    }

    private static final class AttributeEscaper implements Escaper {
        @Override
        public @Nullable String escape(final char character) {
            return (character == '"') ? "&quot;" : TextEscaper.instance.escape(character);
        }

        private static final AttributeEscaper instance = new AttributeEscaper();
    }
}
