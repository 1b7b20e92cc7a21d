package com.loanorigination.config;

/**
 * Kafka topic names for lifecycle events, kept in one place.
 */
public class KafkaTopics {

    // Every applied status change
    public static final String APPLICATION_STATUS_CHANGED = "application.status.changed";

    // Staff proposed alternative terms
    public static final String COUNTER_OFFER_SENT = "application.counter-offer.sent";

    // Applicant accepted or declined the alternative terms
    public static final String COUNTER_OFFER_RESPONDED = "application.counter-offer.responded";

    private KafkaTopics() {
    }
}
