// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.ast;

import writedown.util.annotation.Nullable;

/**
 * The progress of a piece of writing, as declared by a status instruction.
 */
public enum WritingStatus {
    NEW("new"),
    DRAFT("draft"),
    REVISION("revision"),
    DONE("done");

    WritingStatus(final String keyword) {
        this.keyword = keyword;
    }

    /**
     * Retrieves the keyword authors use for this status.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Looks up the status with the given keyword. Matching is case-sensitive.
     *
     * @return The status, or {@code null} if no status uses that keyword.
     */
    public static @Nullable WritingStatus fromKeyword(final String keyword) {
        for (final var status : values()) {
            if (status.keyword.equals(keyword)) {
                return status;
            }
        }
        return null;
    }

    private final String keyword;
}
