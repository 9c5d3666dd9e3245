package taskgrid.engine.model;

import java.util.Locale;

/**
 * Task priority, ordered from lowest to highest rank.
 */
public enum TaskPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parse a priority name, case-insensitive. "medium" is accepted as NORMAL.
     */
    public static TaskPriority parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("priority is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("MEDIUM")) {
            return NORMAL;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value, e);
        }
    }
}
