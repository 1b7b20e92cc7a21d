package com.loanorigination.model;

/**
 * Who is applying. Only individual applications are processed today.
 */
public enum ApplicantType {
    INDIVIDUAL,
    COMPANY
}
