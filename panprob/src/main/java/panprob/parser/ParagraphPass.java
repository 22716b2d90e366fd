// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import panprob.ast.Attributes;
import panprob.ast.Node;
import panprob.ast.NodeType;
import panprob.ast.Nodes;

/**
 * The paragraph pass: groups text into paragraphs.
 * <p>
 * The markup has no explicit paragraph construct; paragraphs are separated by blank lines inside ordinary text. This
 * pass rebuilds a freshly converted tree so that every maximal run of paragraph-eligible children (text, inline math,
 * inline code) becomes one or more {@link NodeType#PARAGRAPH} nodes, split wherever a normal text node contains
 * {@code "\n\n"}. Other children are kept in place, and the pass recurses into them.
 * <p>
 * The input tree is left untouched. Splitting keeps empty pieces, so text ending in a blank line produces an empty
 * trailing paragraph.
 */
public final class ParagraphPass {
    private ParagraphPass() {
    }

    /**
     * Returns a copy of {@code node} with paragraphs reconstructed throughout.
     */
    public static Node apply(final Node node) {
        if (!(node instanceof Node.Internal internal)) {
            return node;
        }
        // Nodes that cannot hold paragraphs, such as a paragraph itself, keep their eligible children as they are.
        final var acceptsParagraphs = internal.type().allowsChild(NodeType.PARAGRAPH);
        var result = internal.withoutChildren();
        final var run = new ArrayList<Node>();
        for (final var child : internal.children()) {
            if (acceptsParagraphs && child.type().isParagraphEligible()) {
                run.add(child);
                continue;
            }
            result = appendParagraphs(result, run);
            run.clear();
            result = result.appended(apply(child));
        }
        return appendParagraphs(result, run);
    }

    private static Node.Internal appendParagraphs(final Node.Internal parent, final List<Node> run) {
        if (run.isEmpty()) {
            return parent;
        }
        var result = parent;
        final var group = new ArrayList<Node>();
        for (final var piece : splitAtBreaks(run)) {
            if (piece instanceof Piece.Content content) {
                group.add(content.node());
            } else if (!group.isEmpty()) {
                result = result.appended(Nodes.paragraph(group));
                group.clear();
            }
        }
        if (!group.isEmpty()) {
            result = result.appended(Nodes.paragraph(group));
        }
        return result;
    }

    private static List<Piece> splitAtBreaks(final List<Node> run) {
        final var pieces = new ArrayList<Piece>(run.size());
        for (final var node : run) {
            if (node.type() != NodeType.NORMAL_TEXT) {
                pieces.add(new Piece.Content(node));
                continue;
            }
            final var text = Attributes.getString(node, "text");
            if (!text.contains(paragraphSeparator)) {
                pieces.add(new Piece.Content(node));
                continue;
            }
            final var parts = separatorPattern.split(text, -1);
            for (int i = 0; i < parts.length; i += 1) {
                if (i > 0) {
                    pieces.add(Piece.Break.instance);
                }
                pieces.add(new Piece.Content(Nodes.normalText(parts[i])));
            }
        }
        return pieces;
    }

    private static final String paragraphSeparator = "\n\n";
    private static final Pattern separatorPattern = Pattern.compile(paragraphSeparator, Pattern.LITERAL);

    /**
     * An element of a run after splitting: either a node or the boundary between two paragraphs.
     */
    private sealed interface Piece {
        record Content(Node node) implements Piece {
        }

        final class Break implements Piece {
            private Break() {
            }

            private static final Break instance = new Break();
        }
    }
}
