package tech.axiom.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Centralized TSID generation.
 * TSID (Time-Sorted ID) provides:
 * - Time-sortable (creation order preserved)
 * - 64-bit efficiency (vs 128-bit UUID)
 * - Monotonic within a node (no collisions between calls)
 *
 * Divisions use the numeric form as their primary key. Execution, trace, event
 * and audit IDs use the 13-character Crockford Base32 form.
 */
public final class TsidGenerator {

    /**
     * Generate a numeric TSID, used for division primary keys.
     *
     * @return a positive, time-ordered long
     */
    public static long generateLong() {
        return TsidCreator.getTsid().toLong();
    }

    /**
     * Generate a raw TSID string.
     *
     * @return the raw TSID (e.g., "0HZXEQ5Y8JY5Z")
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
        // Utility class
    }
}
