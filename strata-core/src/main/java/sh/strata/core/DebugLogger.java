// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic logger for per-hop and per-entry events, routed to the
 * {@code sh.strata.debug} SLF4J logger at INFO when the matching {@link StrataDebug}
 * toggle is on.
 *
 * <p>Messages use {@link String#formatted(Object...)} placeholders and are capped in
 * length, since a single line may embed a list of extrinsic hashes.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.strata.debug");

    private static final int MAX_LOG_LENGTH = 2000;
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private DebugLogger() {
    }

    public static void logTraversal(final String message, final Object... args) {
        if (!StrataDebug.isTraversalLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logCache(final String message, final Object... args) {
        if (!StrataDebug.isCacheLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        if (formatted.length() > MAX_LOG_LENGTH) {
            formatted = formatted.substring(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
        }
        LOG.info(formatted);
    }
}
