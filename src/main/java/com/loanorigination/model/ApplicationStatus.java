package com.loanorigination.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Every status a credit application can hold.
 *
 * One enum covers both the statuses shown to applicants and the ones used
 * only inside the staff review workflow; {@link Visibility} tells them apart.
 * The allowed transitions live here as well so there is a single table.
 */
public enum ApplicationStatus {
    DRAFT("Borrador", Visibility.APPLICANT, false),
    SUBMITTED("Enviada", Visibility.APPLICANT, false),
    IN_REVIEW("En revisión", Visibility.APPLICANT, false),
    DOCS_PENDING("Documentos pendientes", Visibility.APPLICANT, false),
    CORRECTIONS_PENDING("Correcciones pendientes", Visibility.APPLICANT, false),
    ANALYST_REVIEW("Revisión de analista", Visibility.STAFF_ONLY, false),
    SUPERVISOR_REVIEW("Revisión de supervisor", Visibility.STAFF_ONLY, false),
    COUNTER_OFFERED("Contraoferta", Visibility.APPLICANT, false),
    APPROVED("Aprobada", Visibility.APPLICANT, false),
    REJECTED("Rechazada", Visibility.APPLICANT, true),
    CANCELLED("Cancelada", Visibility.APPLICANT, true),
    SYNCED("Sincronizada", Visibility.STAFF_ONLY, true),
    DISBURSED("Desembolsada", Visibility.APPLICANT, false),
    ACTIVE("Activa", Visibility.APPLICANT, false),
    COMPLETED("Completada", Visibility.APPLICANT, true),
    DEFAULT("En mora", Visibility.APPLICANT, true);

    public enum Visibility {
        APPLICANT,
        STAFF_ONLY
    }

    private static final Map<ApplicationStatus, Set<ApplicationStatus>> TRANSITIONS =
            new EnumMap<>(ApplicationStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(SUBMITTED, CANCELLED));
        TRANSITIONS.put(SUBMITTED, EnumSet.of(IN_REVIEW, DOCS_PENDING, CORRECTIONS_PENDING, CANCELLED));
        TRANSITIONS.put(IN_REVIEW, EnumSet.of(DOCS_PENDING, CORRECTIONS_PENDING, ANALYST_REVIEW,
                APPROVED, REJECTED, CANCELLED));
        TRANSITIONS.put(DOCS_PENDING, EnumSet.of(IN_REVIEW, SUBMITTED, CANCELLED));
        TRANSITIONS.put(CORRECTIONS_PENDING, EnumSet.of(IN_REVIEW, SUBMITTED, CANCELLED));
        TRANSITIONS.put(ANALYST_REVIEW, EnumSet.of(SUPERVISOR_REVIEW, DOCS_PENDING, CORRECTIONS_PENDING,
                APPROVED, REJECTED, CANCELLED));
        TRANSITIONS.put(SUPERVISOR_REVIEW, EnumSet.of(APPROVED, REJECTED, CANCELLED));
        // Legacy status: kept for stored rows, no edges in or out
        TRANSITIONS.put(COUNTER_OFFERED, EnumSet.noneOf(ApplicationStatus.class));
        TRANSITIONS.put(APPROVED, EnumSet.of(SYNCED, DISBURSED, CANCELLED));
        TRANSITIONS.put(DISBURSED, EnumSet.of(ACTIVE, COMPLETED, DEFAULT));
        TRANSITIONS.put(ACTIVE, EnumSet.of(COMPLETED, DEFAULT));
        for (ApplicationStatus status : values()) {
            if (status.terminal) {
                TRANSITIONS.put(status, EnumSet.noneOf(ApplicationStatus.class));
            }
        }
    }

    private static final Set<ApplicationStatus> REVIEW_STATUSES =
            Collections.unmodifiableSet(EnumSet.of(IN_REVIEW, ANALYST_REVIEW, SUPERVISOR_REVIEW));

    private final String label;
    private final Visibility visibility;
    private final boolean terminal;

    ApplicationStatus(String label, Visibility visibility, boolean terminal) {
        this.label = label;
        this.visibility = visibility;
        this.terminal = terminal;
    }

    public String getLabel() {
        return label;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isVisibleToApplicant() {
        return visibility == Visibility.APPLICANT;
    }

    /**
     * Statuses in which staff are actively reviewing the application.
     */
    public boolean isReview() {
        return REVIEW_STATUSES.contains(this);
    }

    public Set<ApplicationStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(ApplicationStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }
}
