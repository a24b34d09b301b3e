// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A parser for the Writedown manuscript markup.
 */
module writedown {
    requires static jsr305;
    requires static org.checkerframework.checker.qual;
    requires static com.github.spotbugs.annotations;

    exports writedown.ast;
    exports writedown.parser;
    exports writedown.source;
    exports writedown.util;
    exports writedown.util.annotation;
    exports writedown.util.condition;
    exports writedown.util.condition.exception;
}
