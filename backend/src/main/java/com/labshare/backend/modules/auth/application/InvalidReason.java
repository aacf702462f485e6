package com.labshare.backend.modules.auth.application;

/**
 * 실패 사유. Only ever logged; callers see a single generic error.
 */
public enum InvalidReason {
    MALFORMED_INPUT,
    NOT_FOUND,
    EXPIRED,
    CONSUMED,
    FINGERPRINT_MISMATCH
}
