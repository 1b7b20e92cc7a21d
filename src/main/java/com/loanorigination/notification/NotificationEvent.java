package com.loanorigination.notification;

import com.loanorigination.model.ApplicationStatus;

/**
 * Notification keys understood by the delivery side. The key picks the
 * tenant's template; the label is what staff see in template settings.
 */
public enum NotificationEvent {
    APPLICATION_SUBMITTED("application.submitted", "Solicitud Enviada"),
    APPLICATION_IN_REVIEW("application.in_review", "Solicitud en Revisión"),
    APPLICATION_APPROVED("application.approved", "Solicitud Aprobada"),
    APPLICATION_REJECTED("application.rejected", "Solicitud Rechazada"),
    APPLICATION_DOCS_PENDING("application.docs_pending", "Documentos Pendientes"),
    APPLICATION_CORRECTIONS_REQUESTED("application.corrections_requested", "Correcciones Solicitadas"),
    APPLICATION_COUNTER_OFFER("application.counter_offer", "Nueva Propuesta"),
    STATUS_CHANGED("status.changed", "Estado Cambiado");

    private final String key;
    private final String label;

    NotificationEvent(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Statuses with their own template map to it; any other status the
     * applicant can see falls back to {@link #STATUS_CHANGED}.
     */
    public static NotificationEvent forStatus(ApplicationStatus status) {
        return switch (status) {
            case SUBMITTED -> APPLICATION_SUBMITTED;
            case IN_REVIEW -> APPLICATION_IN_REVIEW;
            case APPROVED -> APPLICATION_APPROVED;
            case REJECTED -> APPLICATION_REJECTED;
            case DOCS_PENDING -> APPLICATION_DOCS_PENDING;
            case CORRECTIONS_PENDING -> APPLICATION_CORRECTIONS_REQUESTED;
            default -> STATUS_CHANGED;
        };
    }
}
