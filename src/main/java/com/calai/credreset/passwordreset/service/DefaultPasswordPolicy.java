package com.calai.credreset.passwordreset.service;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 與註冊 / 改密碼同一套規則：至少 12 碼，大寫、小寫、數字、特殊字元各一。
 */
@Component
public class DefaultPasswordPolicy implements PasswordPolicy {

    public static final int MIN_LENGTH = 12;

    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*(),.?\":{}|<>]");

    @Override
    public Optional<String> violation(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            return Optional.of("Password must be at least " + MIN_LENGTH + " characters long.");
        }
        if (!UPPER.matcher(password).find()) {
            return Optional.of("Password must contain at least one uppercase letter.");
        }
        if (!LOWER.matcher(password).find()) {
            return Optional.of("Password must contain at least one lowercase letter.");
        }
        if (!DIGIT.matcher(password).find()) {
            return Optional.of("Password must contain at least one number.");
        }
        if (!SPECIAL.matcher(password).find()) {
            return Optional.of("Password must contain at least one special character.");
        }
        return Optional.empty();
    }
}
