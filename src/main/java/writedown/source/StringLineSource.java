// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.source;

import writedown.util.annotation.Nullable;

final class StringLineSource implements LineSource {
    StringLineSource(final String text) {
        lines = text.split("\n", -1);
    }

    @Override
    public @Nullable SourceLine next() {
        if (index < lines.length) {
            index += 1;
            return new SourceLine(SourceLine.STRING_SOURCE, index, lines[index - 1]);
        }
        if (index == lines.length) {
            index += 1;
            return new SourceLine(SourceLine.STRING_SOURCE, index, END_MARKER);
        }
        return null;
    }

    @Override
    public void close() {
        index = lines.length + 1;
    }

    private final String[] lines;
    private int index = 0;
}
