// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import java.util.ArrayList;
import writedown.ast.Node;
import writedown.ast.Payload;
import writedown.ast.Session;
import writedown.source.LineBuffer;
import writedown.util.annotation.Nullable;

/**
 * Parses block comments, which open with {@code @*} and close with {@code *@} at the end of the same or a later line.
 * <p>
 * A block that is never closed ends with the enclosing window or at the end of its file, whichever comes first.
 */
final class CommentBlockParser {
    private CommentBlockParser() {
    }

    /**
     * Parses the block comment starting at {@code position} and appends it to {@code holder}.
     * <p>
     * The resulting node is attributed to the opening line, with the line's content replaced by the whole block as
     * written, so that stripping the markup from that single line reproduces the block.
     *
     * @return The index of the first line after the block.
     */
    static int parse(
        final Node holder,
        final LineBuffer lines,
        final int position,
        final int end,
        final @Nullable Session template
    ) {
        final var first = lines.get(position);
        var pos = position + 1;
        final var verbatim = new ArrayList<String>();
        final var parts = new ArrayList<String>();
        verbatim.add(first.content());

        final var opening = Instructions.strip(first.content());
        if (isClosed(opening)) {
            parts.add(withoutClose(opening));
        } else {
            parts.add(opening);
            while (pos < end && lines.isValid(pos)) {
                final var content = lines.get(pos).content();
                if (content.equals(Instructions.END_OF_STREAM)) {
                    break;
                }
                pos += 1;
                verbatim.add(content);
                if (isClosed(content)) {
                    parts.add(withoutClose(content));
                    break;
                }
                parts.add(content);
            }
        }

        final var text = new StringBuilder();
        for (final var part : parts) {
            if (text.length() != 0) {
                text.append('\n');
            }
            text.append(part.strip());
        }
        final var node = new Node(
            first.withContent(String.join("\n", verbatim)),
            new Payload.Comment(text.toString().strip())
        );
        holder.append(node, template);
        return pos;
    }

    private static boolean isClosed(final String content) {
        return content.stripTrailing().endsWith(Instructions.COMMENT_BLOCK_END);
    }

    private static String withoutClose(final String content) {
        final var trimmed = content.stripTrailing();
        return trimmed.substring(0, trimmed.length() - Instructions.COMMENT_BLOCK_END.length());
    }
}
