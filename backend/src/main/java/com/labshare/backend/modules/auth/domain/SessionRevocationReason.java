package com.labshare.backend.modules.auth.domain;

public enum SessionRevocationReason {
    LOGOUT,
    LOGOUT_ALL,
    FINGERPRINT_MISMATCH
}
