// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.ast;

/**
 * The kinds of structural nodes, from the outermost to the innermost.
 */
public enum StructuralKind {
    ACT("Act"),
    PART("Part"),
    CHAPTER("Chapter"),
    SCENE("Scene"),
    SECTION("Section");

    StructuralKind(final String label) {
        this.label = label;
    }

    /**
     * Retrieves the user-readable name of this kind, such as {@code Chapter}.
     */
    public String label() {
        return label;
    }

    private final String label;
}
