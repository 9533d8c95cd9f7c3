package com.calai.credreset.passwordreset.mail;

/**
 * Outbound delivery of the reset link. Callers do not wait for, or learn
 * about, delivery success.
 */
public interface ResetMailer {

    void sendResetLink(String email, String displayName, String rawToken);
}
