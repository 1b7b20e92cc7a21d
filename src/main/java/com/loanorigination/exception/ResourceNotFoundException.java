package com.loanorigination.exception;

public class ResourceNotFoundException extends LendingException {

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
    }
}
