// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.ast;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import writedown.source.SourceLine;
import writedown.util.annotation.Nullable;

/**
 * A real-world writing session, shared by every node written during it.
 * <p>
 * Sessions compare by identity: two session instructions with the same date and name still denote two sessions,
 * which is what grouping nodes by session relies on.
 */
public final class Session {
    public Session(
        final SourceLine line,
        final @Nullable LocalDate date,
        final @Nullable Integer target,
        final @Nullable String name
    ) {
        this.line = line;
        this.date = date;
        this.target = target;
        this.name = name;
    }

    /**
     * Retrieves the session instruction line.
     */
    public SourceLine line() {
        return line;
    }

    public @Nullable LocalDate date() {
        return date;
    }

    /**
     * Retrieves the target word count of the session, if one was given.
     */
    public @Nullable Integer target() {
        return target;
    }

    public @Nullable String name() {
        return name;
    }

    /**
     * Renders the session as e.g. {@code Session 05/20/2022 At the park}.
     */
    @Override
    public String toString() {
        final var builder = new StringBuilder("Session");
        if (date != null) {
            builder.append(' ').append(dateFormat.format(date));
        }
        if (name != null) {
            builder.append(' ').append(name);
        }
        return builder.toString();
    }

    private static final DateTimeFormatter dateFormat = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    private final SourceLine line;
    private final @Nullable LocalDate date;
    private final @Nullable Integer target;
    private final @Nullable String name;
}
