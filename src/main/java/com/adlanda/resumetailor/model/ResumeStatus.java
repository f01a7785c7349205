package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.InvalidStatusTransitionException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a resume, with the full transition table in one place.
 *
 * <pre>
 * draft      -> generated
 * generated  -> reviewed | draft
 * reviewed   -> submitted | generated
 * submitted  -> interview | rejected
 * interview  -> accepted | rejected
 * accepted, rejected: terminal
 * </pre>
 */
public enum ResumeStatus {
    DRAFT,
    GENERATED,
    REVIEWED,
    SUBMITTED,
    INTERVIEW,
    REJECTED,
    ACCEPTED;

    private static final Map<ResumeStatus, Set<ResumeStatus>> TRANSITIONS = new EnumMap<>(ResumeStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(GENERATED));
        TRANSITIONS.put(GENERATED, EnumSet.of(REVIEWED, DRAFT));
        TRANSITIONS.put(REVIEWED, EnumSet.of(SUBMITTED, GENERATED));
        TRANSITIONS.put(SUBMITTED, EnumSet.of(INTERVIEW, REJECTED));
        TRANSITIONS.put(INTERVIEW, EnumSet.of(ACCEPTED, REJECTED));
        TRANSITIONS.put(REJECTED, EnumSet.noneOf(ResumeStatus.class));
        TRANSITIONS.put(ACCEPTED, EnumSet.noneOf(ResumeStatus.class));
    }

    public Set<ResumeStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(ResumeStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Statuses from which the tailoring pipeline may (re)generate content.
     */
    public boolean allowsGeneration() {
        return this == DRAFT || this == GENERATED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResumeStatus fromWireValue(String value) {
        if (value != null) {
            for (ResumeStatus status : values()) {
                if (status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return status;
                }
            }
        }
        throw InvalidStatusTransitionException.unknownStatus(value);
    }
}
