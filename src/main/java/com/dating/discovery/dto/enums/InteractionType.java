package com.dating.discovery.dto.enums;

import com.dating.discovery.exceptions.InvalidOperationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Directional action one user takes toward another.
 * <p>
 * {@link #BLOCK} and {@link #REPORT} are terminal: once stored for an ordered pair the row is never
 * downgraded back to a positive or neutral interaction.
 * </p>
 */
public enum InteractionType {
    LIKE("like"),
    PASS("pass"),
    SUPERLIKE("superlike"),
    BLOCK("block"),
    REPORT("report");

    private static final Set<InteractionType> POSITIVE = EnumSet.of(LIKE, SUPERLIKE);
    private static final Set<InteractionType> TERMINAL = EnumSet.of(BLOCK, REPORT);

    private final String value;

    InteractionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isPositive() {
        return POSITIVE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Parses the wire value of an interaction type.
     *
     * @param raw case-insensitive value such as {@code "like"}
     * @return the matching type
     * @throws InvalidOperationException if the value is blank or unknown
     */
    public static InteractionType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidOperationException("Interaction type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidOperationException("Unsupported interaction type: " + raw));
    }
}
