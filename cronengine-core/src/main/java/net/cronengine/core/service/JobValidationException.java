package net.cronengine.core.service;

/** Rejected registration or update; raised before anything reaches the store. */
public class JobValidationException extends RuntimeException {
    private final String field;

    public JobValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
