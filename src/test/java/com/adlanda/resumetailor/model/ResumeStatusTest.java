package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ErrorCode;
import com.adlanda.resumetailor.exception.InvalidStatusTransitionException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.adlanda.resumetailor.model.ResumeStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResumeStatusTest {

    private static final Map<ResumeStatus, Set<ResumeStatus>> EXPECTED = Map.of(
            DRAFT, EnumSet.of(GENERATED),
            GENERATED, EnumSet.of(REVIEWED, DRAFT),
            REVIEWED, EnumSet.of(SUBMITTED, GENERATED),
            SUBMITTED, EnumSet.of(INTERVIEW, REJECTED),
            INTERVIEW, EnumSet.of(ACCEPTED, REJECTED),
            REJECTED, EnumSet.noneOf(ResumeStatus.class),
            ACCEPTED, EnumSet.noneOf(ResumeStatus.class)
    );

    @Test
    void canTransitionTo_matchesTableForEveryPair() {
        for (ResumeStatus from : values()) {
            for (ResumeStatus to : values()) {
                assertThat(from.canTransitionTo(to))
                        .as("%s -> %s", from, to)
                        .isEqualTo(EXPECTED.get(from).contains(to));
            }
        }
    }

    @Test
    void transitionStatus_onResume_succeedsOnlyForAllowedPairs() {
        for (ResumeStatus from : values()) {
            for (ResumeStatus to : values()) {
                Resume resume = resumeIn(from);

                if (EXPECTED.get(from).contains(to)) {
                    resume.transitionStatus(to);
                    assertThat(resume.getStatus()).isEqualTo(to);
                } else {
                    assertThatThrownBy(() -> resume.transitionStatus(to))
                            .isInstanceOf(InvalidStatusTransitionException.class);
                    assertThat(resume.getStatus()).isEqualTo(from);
                }
            }
        }
    }

    @Test
    void terminalStates_allowNothing() {
        assertThat(ACCEPTED.isTerminal()).isTrue();
        assertThat(REJECTED.isTerminal()).isTrue();
        assertThat(INTERVIEW.isTerminal()).isFalse();
        assertThat(ACCEPTED.allowedTransitions()).isEmpty();
    }

    @Test
    void allowsGeneration_onlyFromDraftAndGenerated() {
        assertThat(EnumSet.allOf(ResumeStatus.class))
                .filteredOn(ResumeStatus::allowsGeneration)
                .containsExactlyInAnyOrder(DRAFT, GENERATED);
    }

    @Test
    void fromWireValue_unknown_failsWithInvalidResumeStatus() {
        assertThat(fromWireValue(" Reviewed ")).isEqualTo(REVIEWED);
        assertThatThrownBy(() -> fromWireValue("archived"))
                .isInstanceOf(InvalidStatusTransitionException.class)
                .extracting(e -> ((InvalidStatusTransitionException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_RESUME_STATUS);
    }

    /**
     * Walks a fresh resume along legal edges until it reaches {@code target}.
     */
    static Resume resumeIn(ResumeStatus target) {
        Resume resume = new Resume("user-1", "Senior Go Engineer");
        switch (target) {
            case DRAFT -> { }
            case GENERATED -> resume.transitionStatus(GENERATED);
            case REVIEWED -> walk(resume, GENERATED, REVIEWED);
            case SUBMITTED -> walk(resume, GENERATED, REVIEWED, SUBMITTED);
            case INTERVIEW -> walk(resume, GENERATED, REVIEWED, SUBMITTED, INTERVIEW);
            case REJECTED -> walk(resume, GENERATED, REVIEWED, SUBMITTED, REJECTED);
            case ACCEPTED -> walk(resume, GENERATED, REVIEWED, SUBMITTED, INTERVIEW, ACCEPTED);
        }
        return resume;
    }

    private static void walk(Resume resume, ResumeStatus... path) {
        for (ResumeStatus step : path) {
            resume.transitionStatus(step);
        }
    }
}
