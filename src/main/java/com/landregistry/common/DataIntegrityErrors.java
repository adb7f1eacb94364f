package com.landregistry.common;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * Tells unique-constraint races apart from other integrity failures (value too long, numeric
 * overflow, not-null), which must surface as storage errors and not as conflicts.
 */
public final class DataIntegrityErrors {

    private DataIntegrityErrors() {
    }

    /**
     * Whether {@code e} was raised by the named constraint. Drivers report the name in different
     * cases, and H2 reports the backing index name, so the match is a case-insensitive containment.
     */
    public static boolean violates(DataIntegrityViolationException e, String constraintName) {
        String expected = constraintName.toLowerCase(Locale.ROOT);
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) cause).getConstraintName();
                if (name != null && name.toLowerCase(Locale.ROOT).contains(expected)) {
                    return true;
                }
            }
        }
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(expected);
    }
}
