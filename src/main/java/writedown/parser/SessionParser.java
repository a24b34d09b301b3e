// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;
import writedown.ast.Session;
import writedown.source.SourceLine;
import writedown.util.annotation.Nullable;

/**
 * Parses the argument of session instructions.
 * <p>
 * The argument is {@code [date-or-target-or-name] [target] [name]}, every part optional. Authors write any subset of
 * these, so the first token is interpreted leniently: as a {@code month/day/year} date if it is one, as the target if
 * it is an integer and no other target follows, and as the first word of the name otherwise.
 */
final class SessionParser {
    private SessionParser() {
    }

    static Session parse(final SourceLine line) {
        final var argument = Instructions.strip(line.content());
        final var matcher = argumentPattern.matcher(argument);
        if (!matcher.lookingAt()) {
            return new Session(line, null, null, emptyToNull(argument));
        }

        final var first = matcher.group(1);
        final var targetText = matcher.group(2);
        var name = matcher.group(3);
        var target = (targetText == null) ? null : parseInteger(targetText);
        if (targetText != null && target == null) {
            name = join(targetText, name);
        }

        final var date = parseDate(first);
        if (date == null) {
            final var firstAsTarget = (target == null) ? parseInteger(first) : null;
            if (firstAsTarget != null) {
                target = firstAsTarget;
            } else {
                name = join(first, name);
            }
        }
        return new Session(line, date, target, emptyToNull(name));
    }

    private static @Nullable LocalDate parseDate(final String text) {
        try {
            return LocalDate.parse(text, dateFormat);
        } catch (final DateTimeParseException e) {
            return null;
        }
    }

    private static @Nullable Integer parseInteger(final String text) {
        if (!integerPattern.matcher(text).matches()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (final NumberFormatException e) {
            // Too many digits.
            return null;
        }
    }

    private static String join(final String head, final @Nullable String tail) {
        return (tail == null) ? head : head + " " + tail;
    }

    private static @Nullable String emptyToNull(final @Nullable String text) {
        return (text == null || text.isEmpty()) ? null : text;
    }

    private static final Pattern argumentPattern = Pattern.compile("^(\\S*)(?:\\s+(\\d+)(?=\\s|$))?(?:\\s+(.+))?");
    private static final Pattern integerPattern = Pattern.compile("\\d+");
    private static final DateTimeFormatter dateFormat =
        DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT);
}
