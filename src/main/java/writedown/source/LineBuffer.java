// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.source;

import java.util.ArrayList;
import java.util.NoSuchElementException;

/**
 * Index-addressable, re-readable access to a {@link LineSource}.
 * <p>
 * Lines are pulled from the source on demand and kept until {@link #truncate(int)} discards them. Indices are absolute
 * positions in the stream: truncation never shifts them, it only makes the discarded prefix permanently inaccessible.
 * Memory use is therefore bounded by the distance between the last truncation point and the furthest line read.
 */
public final class LineBuffer {
    /**
     * Wraps the given source. The buffer doesn't take ownership; closing the source is up to the caller.
     */
    public LineBuffer(final LineSource source) {
        this.source = source;
    }

    /**
     * Returns {@code true} iff the line at the given index is retained or can be pulled from the source.
     * <p>
     * May pull lines from the source. Indices before the retention window are never valid.
     */
    public boolean isValid(final int index) {
        if (index < offset) {
            return false;
        }
        return fill(index);
    }

    /**
     * Returns the line at the given index, pulling lines from the source as needed.
     *
     * @throws IndexOutOfBoundsException If the index lies before the retention window.
     * @throws NoSuchElementException    If the source is exhausted before reaching the index.
     */
    public SourceLine get(final int index) {
        if (index < offset) {
            throw new IndexOutOfBoundsException(
                "Line index " + index + " lies before the retention window starting at " + offset);
        }
        if (!fill(index)) {
            throw new NoSuchElementException("Line source exhausted before line index " + index);
        }
        return buffer.get(index - offset);
    }

    /**
     * Discards every retained line with an index lower than {@code position}.
     * <p>
     * Positions past the lines pulled so far are clamped, so later lines are never skipped.
     */
    public void truncate(final int position) {
        final var target = Math.min(position, consumed());
        if (target <= offset) {
            return;
        }
        buffer.subList(0, target - offset).clear();
        offset = target;
    }

    /**
     * Returns the index of the first retained line.
     */
    public int offset() {
        return offset;
    }

    /**
     * Returns the number of lines currently retained.
     */
    public int retained() {
        return buffer.size();
    }

    private int consumed() {
        return offset + buffer.size();
    }

    private boolean fill(final int index) {
        while (index >= consumed()) {
            if (exhausted) {
                return false;
            }
            final var line = source.next();
            if (line == null) {
                exhausted = true;
                return false;
            }
            buffer.add(line);
        }
        return true;
    }

    private final LineSource source;
    private final ArrayList<SourceLine> buffer = new ArrayList<>();
    private int offset = 0;
    private boolean exhausted = false;
}
