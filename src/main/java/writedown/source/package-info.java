// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Turning strings and files into a buffered stream of source lines.
 */
@NonNullByDefault
package writedown.source;

import writedown.util.annotation.NonNullByDefault;
