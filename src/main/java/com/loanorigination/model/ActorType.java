package com.loanorigination.model;

public enum ActorType {
    STAFF,
    APPLICANT,
    SYSTEM
}
