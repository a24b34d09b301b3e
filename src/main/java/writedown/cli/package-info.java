// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line interface: parses the given paths and prints the outline of the resulting document.
 */
@NonNullByDefault
package writedown.cli;

import writedown.util.annotation.NonNullByDefault;
