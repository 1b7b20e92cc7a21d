package com.loanorigination.exception;

public class NoPendingCounterOfferException extends LendingException {

    public NoPendingCounterOfferException(String applicationId) {
        super("No pending counter offer for application: " + applicationId);
    }
}
