package com.labshare.backend.modules.auth.application;

import java.util.Objects;

/**
 * Result of a primary auth operation that touches the datastore.
 * Keeps "wrong credential" apart from "backend unreachable".
 */
public interface AuthOutcome<T> {

    static <T> AuthOutcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> AuthOutcome<T> invalid(InvalidReason reason) {
        return new Invalid<>(reason);
    }

    static <T> AuthOutcome<T> collaboratorError(RuntimeException cause) {
        return new CollaboratorError<>(cause);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    record Ok<T>(T value) implements AuthOutcome<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }
    }

    record Invalid<T>(InvalidReason reason) implements AuthOutcome<T> {
        public Invalid {
            Objects.requireNonNull(reason, "reason");
        }
    }

    record CollaboratorError<T>(RuntimeException cause) implements AuthOutcome<T> {
        public CollaboratorError {
            Objects.requireNonNull(cause, "cause");
        }
    }
}
