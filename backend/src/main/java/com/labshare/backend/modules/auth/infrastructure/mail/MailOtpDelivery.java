package com.labshare.backend.modules.auth.infrastructure.mail;

import java.time.Duration;

import com.labshare.backend.modules.auth.application.OtpDelivery;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
public class MailOtpDelivery implements OtpDelivery {

    private final JavaMailSender mailSender;
    private final String from;
    private final String subject;

    public MailOtpDelivery(
            JavaMailSender mailSender,
            @Value("${labshare.auth.otp.mail.from:no-reply@labshare.app}") String from,
            @Value("${labshare.auth.otp.mail.subject:LabShare login code}") String subject
    ) {
        this.mailSender = mailSender;
        this.from = from;
        this.subject = subject;
    }

    @Override
    public void deliver(String email, String recipientName, String code, Duration validFor) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(email);
        message.setSubject(subject);
        message.setText(body(recipientName, code, validFor));
        try {
            mailSender.send(message);
        } catch (MailException ex) {
            throw new OtpDeliveryException("Failed to send login code email", ex);
        }
    }

    private static String body(String recipientName, String code, Duration validFor) {
        String greeting = recipientName == null || recipientName.isBlank() ? "Hello," : "Hello " + recipientName + ",";
        return greeting + "\n\n"
                + "Your LabShare login code is: " + code + "\n"
                + "It expires in " + validFor.toMinutes() + " minutes.\n\n"
                + "If you did not request this code, you can ignore this email.\n";
    }
}
