package com.calai.credreset.passwordreset.mail;

import com.calai.credreset.config.AsyncSchedulingConfig;
import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpResetMailer implements ResetMailer {

    private final JavaMailSender mail;
    private final PasswordResetProperties props;

    /**
     * 在 resetMailExecutor 上跑；寄失敗只記 log，不影響 issue 的回應（避免洩漏帳號存在與否）
     */
    @Async(AsyncSchedulingConfig.RESET_MAIL_EXECUTOR)
    @Override
    public void sendResetLink(String email, String displayName, String rawToken) {
        if (!props.getMail().isEnabled()) {
            log.info("reset mail disabled, skip send. to={}", mask(email));
            return;
        }
        try {
            mail.send(buildMessage(email, displayName, rawToken));
            log.info("reset mail sent. to={}", mask(email));
        } catch (MailException e) {
            log.error("reset mail send failed. to={} err={}", mask(email), e.getClass().getSimpleName(), e);
        }
    }

    SimpleMailMessage buildMessage(String email, String displayName, String rawToken) {
        String greeting = (displayName == null || displayName.isBlank()) ? "Hello," : "Hello " + displayName + ",";
        long minutes = props.getTokenTtl().toMinutes();

        var msg = new SimpleMailMessage();
        msg.setFrom(props.getMail().getSender());
        msg.setTo(email);
        msg.setSubject(props.getMail().getSubject());
        msg.setText(greeting + "\n\n"
                + "We received a request to reset your password. Open the link below to choose a new one:\n\n"
                + resetLink(email, rawToken) + "\n\n"
                + "The link expires in " + minutes + " minutes and can be used once.\n"
                + "If you did not request a password reset, you can ignore this email.");
        return msg;
    }

    String resetLink(String email, String rawToken) {
        String base = props.getResetLinkBaseUrl();
        String sep = base.contains("?") ? "&" : "?";
        return base + sep + "token=" + rawToken
                + "&email=" + URLEncoder.encode(email, StandardCharsets.UTF_8);
    }

    /** a***@example.com */
    static String mask(String email) {
        if (email == null) return null;
        int at = email.indexOf('@');
        if (at <= 1) return "***" + (at >= 0 ? email.substring(at) : "");
        return email.charAt(0) + "***" + email.substring(at);
    }
}
