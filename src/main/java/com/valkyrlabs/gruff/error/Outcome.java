package com.valkyrlabs.gruff.error;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import org.springframework.security.access.AccessDeniedException;

/**
 * Result of an operation that can be refused for a reason the caller should render:
 * a missing resource, a conflict with an invariant, invalid ACL principals, or a
 * missing permission. Storage faults are never folded into an outcome; they
 * propagate as exceptions.
 *
 * @param <T> payload type on success
 */
public final class Outcome<T> {

    public static final String CODE_NOT_FOUND = "NOT_FOUND";
    public static final String CODE_FORBIDDEN = "FORBIDDEN";
    public static final String CODE_INVALID_ACL = "INVALID_ACL";

    public enum Status {
        OK,
        NOT_FOUND,
        CONFLICT,
        INVALID,
        FORBIDDEN
    }

    private final Status status;
    private final T value;
    private final String code;
    private final String message;
    private final List<String> errors;

    private Outcome(Status status, T value, String code, String message, List<String> errors) {
        this.status = status;
        this.value = value;
        this.code = code;
        this.message = message;
        this.errors = errors == null ? Collections.emptyList() : List.copyOf(errors);
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Status.OK, value, null, null, null);
    }

    /**
     * @param what human name of the missing thing, e.g. "Entity" or "Member in group"
     */
    public static <T> Outcome<T> notFound(String what) {
        return new Outcome<>(Status.NOT_FOUND, null, CODE_NOT_FOUND, what + " not found", null);
    }

    public static <T> Outcome<T> conflict(String code, String message) {
        return new Outcome<>(Status.CONFLICT, null, code, message, null);
    }

    public static <T> Outcome<T> invalid(List<String> errors) {
        return new Outcome<>(Status.INVALID, null, CODE_INVALID_ACL,
                "Invalid ACL entries: " + String.join(", ", errors), errors);
    }

    public static <T> Outcome<T> forbidden(String message) {
        return new Outcome<>(Status.FORBIDDEN, null, CODE_FORBIDDEN, message, null);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return the payload, {@code null} unless {@link #isOk()}
     */
    public T getValue() {
        return value;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getErrors() {
        return errors;
    }

    /**
     * Re-types a refusal, or transforms the payload of a success.
     */
    @SuppressWarnings("unchecked")
    public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
        if (status != Status.OK) {
            return (Outcome<U>) this;
        }
        return new Outcome<>(Status.OK, mapper.apply(value), null, null, null);
    }

    /**
     * Unwraps the payload, turning a refusal into the matching exception.
     */
    public T orElseThrow() {
        switch (status) {
        case OK:
            return value;
        case NOT_FOUND:
            throw new ResourceNotFoundException(code, message);
        case CONFLICT:
            throw new ConflictException(code, message);
        case INVALID:
            throw new InvalidAclException(message, errors);
        case FORBIDDEN:
            throw new AccessDeniedException(message);
        default:
            throw new IllegalStateException("Unhandled outcome status " + status);
        }
    }

    @Override
    public String toString() {
        if (status == Status.OK) {
            return "Outcome[OK " + value + "]";
        }
        return "Outcome[" + status + " " + code + ": " + message + "]";
    }
}
