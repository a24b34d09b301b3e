// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package writedown.parser;

import writedown.ast.Session;
import writedown.util.annotation.Nullable;

/**
 * Where parsing continues after a parse call returns.
 *
 * @param position The index of the first line not consumed by the call.
 * @param template The session template in force after the consumed lines, or {@code null} if none is.
 */
record Resume(int position, @Nullable Session template) {
}
