// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The document tree produced by the parser.
 */
@NonNullByDefault
package writedown.ast;

import writedown.util.annotation.NonNullByDefault;
