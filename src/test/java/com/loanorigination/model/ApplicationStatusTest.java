package com.loanorigination.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Set;

import static com.loanorigination.model.ApplicationStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationStatus")
class ApplicationStatusTest {

    @Test
    @DisplayName("Should allow exactly the documented transitions")
    void shouldExposeTransitionTable() {
        assertThat(DRAFT.allowedTransitions()).containsExactlyInAnyOrder(SUBMITTED, CANCELLED);
        assertThat(SUBMITTED.allowedTransitions())
                .containsExactlyInAnyOrder(IN_REVIEW, DOCS_PENDING, CORRECTIONS_PENDING, CANCELLED);
        assertThat(IN_REVIEW.allowedTransitions()).containsExactlyInAnyOrder(
                DOCS_PENDING, CORRECTIONS_PENDING, ANALYST_REVIEW, APPROVED, REJECTED, CANCELLED);
        assertThat(DOCS_PENDING.allowedTransitions()).containsExactlyInAnyOrder(IN_REVIEW, SUBMITTED, CANCELLED);
        assertThat(CORRECTIONS_PENDING.allowedTransitions())
                .containsExactlyInAnyOrder(IN_REVIEW, SUBMITTED, CANCELLED);
        assertThat(ANALYST_REVIEW.allowedTransitions()).containsExactlyInAnyOrder(
                SUPERVISOR_REVIEW, DOCS_PENDING, CORRECTIONS_PENDING, APPROVED, REJECTED, CANCELLED);
        assertThat(SUPERVISOR_REVIEW.allowedTransitions()).containsExactlyInAnyOrder(APPROVED, REJECTED, CANCELLED);
        assertThat(APPROVED.allowedTransitions()).containsExactlyInAnyOrder(SYNCED, DISBURSED, CANCELLED);
        assertThat(DISBURSED.allowedTransitions()).containsExactlyInAnyOrder(ACTIVE, COMPLETED, DEFAULT);
        assertThat(ACTIVE.allowedTransitions()).containsExactlyInAnyOrder(COMPLETED, DEFAULT);
        assertThat(COUNTER_OFFERED.allowedTransitions()).isEmpty();
    }

    @Test
    @DisplayName("Should keep both exits from APPROVED")
    void shouldKeepDisbursementAndSyncFromApproved() {
        assertThat(APPROVED.canTransitionTo(DISBURSED)).isTrue();
        assertThat(APPROVED.canTransitionTo(SYNCED)).isTrue();
    }

    @Test
    @DisplayName("Should only flag final statuses as terminal")
    void shouldFlagTerminalStatuses() {
        Set<ApplicationStatus> terminal = EnumSet.noneOf(ApplicationStatus.class);
        for (ApplicationStatus status : values()) {
            if (status.isTerminal()) {
                terminal.add(status);
            }
        }

        assertThat(terminal).containsExactlyInAnyOrder(REJECTED, CANCELLED, SYNCED, COMPLETED, DEFAULT);
    }

    @ParameterizedTest
    @EnumSource(value = ApplicationStatus.class, names = {"REJECTED", "CANCELLED", "SYNCED", "COMPLETED", "DEFAULT"})
    @DisplayName("Terminal statuses should have no exits")
    void terminalStatusesShouldHaveNoExits(ApplicationStatus status) {
        assertThat(status.allowedTransitions()).isEmpty();
        for (ApplicationStatus target : values()) {
            assertThat(status.canTransitionTo(target)).isFalse();
        }
    }

    @ParameterizedTest
    @EnumSource(ApplicationStatus.class)
    @DisplayName("No status should transition to itself or to null")
    void shouldRejectSelfAndNullTransitions(ApplicationStatus status) {
        assertThat(status.canTransitionTo(status)).isFalse();
        assertThat(status.canTransitionTo(null)).isFalse();
    }

    @Test
    @DisplayName("COUNTER_OFFERED should be unreachable")
    void counterOfferedShouldBeUnreachable() {
        for (ApplicationStatus status : values()) {
            assertThat(status.canTransitionTo(COUNTER_OFFERED)).isFalse();
        }
    }

    @Test
    @DisplayName("Should hide internal review statuses from applicants")
    void shouldHideStaffOnlyStatuses() {
        assertThat(ANALYST_REVIEW.isVisibleToApplicant()).isFalse();
        assertThat(SUPERVISOR_REVIEW.isVisibleToApplicant()).isFalse();
        assertThat(SYNCED.isVisibleToApplicant()).isFalse();
        assertThat(IN_REVIEW.isVisibleToApplicant()).isTrue();
        assertThat(APPROVED.isVisibleToApplicant()).isTrue();
        assertThat(SYNCED.getVisibility()).isEqualTo(Visibility.STAFF_ONLY);
    }

    @Test
    @DisplayName("Should treat only the three review statuses as review")
    void shouldIdentifyReviewStatuses() {
        for (ApplicationStatus status : values()) {
            boolean expected = status == IN_REVIEW || status == ANALYST_REVIEW || status == SUPERVISOR_REVIEW;
            assertThat(status.isReview()).as(status.name()).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("Should expose a display label for every status")
    void shouldExposeLabels() {
        assertThat(DRAFT.getLabel()).isEqualTo("Borrador");
        assertThat(APPROVED.getLabel()).isEqualTo("Aprobada");
        for (ApplicationStatus status : values()) {
            assertThat(status.getLabel()).isNotBlank();
        }
    }

    @Test
    @DisplayName("Allowed transitions should be read-only")
    void allowedTransitionsShouldBeReadOnly() {
        assertThatThrownBy(() -> DRAFT.allowedTransitions().add(APPROVED))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
