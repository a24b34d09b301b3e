// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.regex.Pattern;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import writedown.source.SourceLine;
import writedown.util.annotation.Nullable;

/**
 * A node of the document tree.
 * <p>
 * A node owns its children, in insertion order, and keeps a non-owning reference to its parent. The data specific to
 * the kind of node is held by its {@link Payload}. Trees are built by the parser and should be treated as read-only
 * afterwards.
 */
public final class Node {
    /**
     * Initializes a new, detached node.
     */
    public Node(final SourceLine line, final Payload payload) {
        this.line = line;
        this.payload = payload;
    }

    /**
     * Returns a new, empty document root.
     */
    public static Node document() {
        return new Node(DOCUMENT_LINE, new Payload.Document());
    }

    /**
     * Retrieves the line this node was built from.
     */
    public SourceLine line() {
        return line;
    }

    public String source() {
        return line.source();
    }

    public int lineNumber() {
        return line.lineNumber();
    }

    /**
     * Retrieves the raw content of the line this node was built from.
     */
    public String raw() {
        return line.content();
    }

    public Payload payload() {
        return payload;
    }

    /**
     * Retrieves the payload of this node as the given payload type.
     *
     * @throws ClassCastException If the payload is of a different type.
     */
    public <T extends Payload> T payload(final Class<T> type) {
        return type.cast(payload);
    }

    /**
     * Returns {@code true} iff the payload of this node is of the given type.
     */
    public boolean is(final Class<? extends Payload> type) {
        return type.isInstance(payload);
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The parent link is part of the tree structure")
    public @Nullable Node parent() {
        return parent;
    }

    /**
     * Retrieves an unmodifiable view of the children of this node.
     */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Retrieves the session this node was written in, or {@code null} if it isn't associated with a session.
     */
    public @Nullable Session session() {
        return session;
    }

    /**
     * Appends a child node with no session template in force.
     *
     * @see #append(Node, Session)
     */
    public void append(final Node child) {
        append(child, null);
    }

    /**
     * Appends a child node.
     * <p>
     * The child is associated with {@code sessionTemplate} if it's not {@code null}, otherwise it inherits the
     * session of this node.
     *
     * @throws IllegalStateException If the child already has a parent.
     */
    public void append(final Node child, final @Nullable Session sessionTemplate) {
        if (child.parent != null) {
            throw new IllegalStateException("Node from " + child.line.location() + " already has a parent");
        }
        child.parent = this;
        child.session = sessionTemplate != null ? sessionTemplate : session;
        children.add(child);
    }

    /**
     * Returns the descendants of this node matching the given predicate, in depth-first pre-order.
     *
     * @param recursive If {@code false}, only the immediate children are considered.
     */
    public List<Node> filter(final Predicate<? super Node> predicate, final boolean recursive) {
        final var result = new ArrayList<Node>();
        collect(predicate, recursive, result);
        return result;
    }

    /**
     * Returns the descendants of this node whose payload is of the given type, in depth-first pre-order.
     *
     * @param recursive If {@code false}, only the immediate children are considered.
     */
    public List<Node> find(final Class<? extends Payload> type, final boolean recursive) {
        return filter(node -> node.is(type), recursive);
    }

    /**
     * Returns all descendants of this node whose payload is of the given type.
     */
    public List<Node> find(final Class<? extends Payload> type) {
        return find(type, true);
    }

    /**
     * Returns {@code true} iff this is the document root or a structural node.
     */
    public boolean isStructural() {
        return payload instanceof Payload.Document || payload instanceof Payload.Structural;
    }

    /**
     * Returns {@code true} iff this is a structural node with no structural descendants.
     */
    public boolean isStructuralLeaf() {
        return isStructural() && filter(Node::isStructural, true).isEmpty();
    }

    /**
     * Returns the structural nodes among this node and its ancestors, from the root down.
     */
    public List<Node> structuralLineage() {
        final var lineage = new ArrayList<Node>();
        for (var current = this; current != null; current = current.parent) {
            if (current.isStructural()) {
                lineage.add(current);
            }
        }
        Collections.reverse(lineage);
        return lineage;
    }

    /**
     * Renders the structural lineage of this node as {@code Grandparent > Parent > Self}.
     */
    public String structuralPath() {
        final var builder = new StringBuilder();
        for (final var node : structuralLineage()) {
            if (builder.length() != 0) {
                builder.append(" > ");
            }
            builder.append(node);
        }
        return builder.toString();
    }

    /**
     * Returns the number of whitespace-separated words in this node's text.
     *
     * @param recursive If {@code true}, the words of all text descendants are counted too.
     */
    public int wordCount(final boolean recursive) {
        return count(recursive, Node::wordsOf);
    }

    public int wordCount() {
        return wordCount(true);
    }

    /**
     * Returns the number of characters in this node's text.
     *
     * @param recursive If {@code true}, the characters of all text descendants are counted too.
     */
    public int charCount(final boolean recursive) {
        return count(recursive, String::length);
    }

    public int charCount() {
        return charCount(true);
    }

    /**
     * Returns the origin of this node as {@code source:line}, prefixed with an indentation marker for the given
     * tree depth.
     */
    public String sourceInfo(final int level) {
        final var location = line.location();
        return level > 0 ? "--".repeat(level) + " " + location : location;
    }

    /**
     * Returns all descendants of this node in depth-first pre-order, each with its depth below this node.
     */
    public List<Entry> dump() {
        final var result = new ArrayList<Entry>();
        dumpInto(1, result);
        return result;
    }

    /**
     * Renders the payload. The document root renders as the concatenation of its titles, or {@code Document} if it
     * has none.
     */
    @Override
    public String toString() {
        if (payload instanceof Payload.Document) {
            final var titles = new StringBuilder();
            for (final var title : find(Payload.Title.class)) {
                titles.append(title.payload(Payload.Title.class).text());
            }
            return titles.length() != 0 ? titles.toString() : payload.toString();
        }
        return payload.toString();
    }

    private void collect(final Predicate<? super Node> predicate, final boolean recursive, final List<Node> result) {
        for (final var child : children) {
            if (predicate.test(child)) {
                result.add(child);
            }
            if (recursive) {
                child.collect(predicate, true, result);
            }
        }
    }

    private int count(final boolean recursive, final ToIntFunction<String> measure) {
        if (payload instanceof Payload.Text text) {
            return measure.applyAsInt(text.text());
        }
        if (!recursive) {
            return 0;
        }
        var total = 0;
        for (final var node : find(Payload.Text.class)) {
            total += measure.applyAsInt(node.payload(Payload.Text.class).text());
        }
        return total;
    }

    private void dumpInto(final int level, final List<Entry> result) {
        for (final var child : children) {
            result.add(new Entry(level, child));
            child.dumpInto(level + 1, result);
        }
    }

    private static int wordsOf(final String text) {
        var words = 0;
        for (final var word : whitespace.split(text)) {
            if (!word.isEmpty()) {
                words += 1;
            }
        }
        return words;
    }

    /**
     * A node along with its depth in a tree listing.
     */
    public record Entry(int level, Node node) {
    }

    private static final SourceLine DOCUMENT_LINE = new SourceLine("document", 0, "");
    // Any Unicode space separates words, including the no-break ones.
    private static final Pattern whitespace = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final SourceLine line;
    private final Payload payload;
    private final ArrayList<Node> children = new ArrayList<>();
    private @Nullable Node parent;
    private @Nullable Session session;
}
