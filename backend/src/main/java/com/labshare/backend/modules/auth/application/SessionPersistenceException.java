package com.labshare.backend.modules.auth.application;

public class SessionPersistenceException extends RuntimeException {

    public SessionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
