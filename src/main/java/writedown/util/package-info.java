// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the parser and its front ends.
 */
@NonNullByDefault
package writedown.util;

import writedown.util.annotation.NonNullByDefault;
