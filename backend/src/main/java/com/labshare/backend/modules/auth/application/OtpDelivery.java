package com.labshare.backend.modules.auth.application;

import java.time.Duration;

/**
 * Out-of-band channel for handing a code to the student.
 */
public interface OtpDelivery {

    /**
     * @throws OtpDeliveryException when the message could not be handed off
     */
    void deliver(String email, String recipientName, String code, Duration validFor);

    class OtpDeliveryException extends RuntimeException {
        public OtpDeliveryException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
