package com.rtcc.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Event priority. Numerically lower means more urgent.
 */
public enum EventPriority {
    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    LOW(4),
    INFO(5);

    private final int level;

    EventPriority(int level) {
        this.level = level;
    }

    @JsonValue
    public int level() {
        return level;
    }

    /**
     * Map a numeric level onto a priority, clamping into [1, 5].
     */
    @JsonCreator
    public static EventPriority fromLevel(int level) {
        int clamped = Math.min(Math.max(level, 1), 5);
        return values()[clamped - 1];
    }

    /**
     * Parse a raw priority value: a number, a numeric string or a name
     * such as "critical". Returns null when the value is not recognized.
     */
    public static EventPriority parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return fromLevel(number.intValue());
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return fromLevel(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            for (EventPriority priority : values()) {
                if (priority.name().equals(text.toUpperCase(Locale.ROOT))) {
                    return priority;
                }
            }
            return null;
        }
    }

    /**
     * True if this priority is at least as urgent as the given ceiling.
     */
    public boolean isWithin(EventPriority ceiling) {
        return level <= ceiling.level;
    }
}
