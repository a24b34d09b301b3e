// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The Writedown parser, turning a stream of lines into a document tree.
 */
@NonNullByDefault
package writedown.parser;

import writedown.util.annotation.NonNullByDefault;
