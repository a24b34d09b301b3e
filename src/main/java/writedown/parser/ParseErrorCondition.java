// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import writedown.source.SourceLine;
import writedown.util.condition.Condition;

/**
 * A fatal condition indicating that an instruction carries an argument that cannot be given any meaning.
 */
public final class ParseErrorCondition extends Condition {
    ParseErrorCondition(final SourceLine line, final String message) {
        super(line.location() + ": " + message);
        this.line = line;
    }

    /**
     * Retrieves the offending line.
     */
    public SourceLine line() {
        return line;
    }

    private final SourceLine line;
}
