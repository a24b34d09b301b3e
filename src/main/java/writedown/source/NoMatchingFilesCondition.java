// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.source;

import writedown.util.condition.Condition;

/**
 * A fatal condition indicating that a path or glob pattern named no readable file.
 */
public final class NoMatchingFilesCondition extends Condition {
    public NoMatchingFilesCondition(final String path) {
        super("No files matched path " + path);
        this.path = path;
    }

    /**
     * Retrieves the offending path or pattern.
     */
    public String path() {
        return path;
    }

    private final String path;
}
