// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * The parser reports every diagnostic as a condition: warnings with {@link writedown.util.condition.ConditionContext#signal},
 * which returns normally when no handler takes charge, and fatal errors with
 * {@link writedown.util.condition.ConditionContext#error}, which never returns.
 */
@NonNullByDefault
package writedown.util.condition;

import writedown.util.annotation.NonNullByDefault;
