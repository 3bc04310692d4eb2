// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core;

/**
 * Global toggles for verbose diagnostics: one per traversal hop, one per cache decision.
 *
 * <p>Thread safety: the flags are volatile and independent.
 */
public final class StrataDebug {

    private static volatile boolean traversalLogging = false;
    private static volatile boolean cacheLogging = false;

    private StrataDebug() {
    }

    public static void setTraversalLogging(final boolean enabled) {
        traversalLogging = enabled;
    }

    public static boolean isTraversalLoggingEnabled() {
        return traversalLogging;
    }

    public static void setCacheLogging(final boolean enabled) {
        cacheLogging = enabled;
    }

    public static boolean isCacheLoggingEnabled() {
        return cacheLogging;
    }
}
