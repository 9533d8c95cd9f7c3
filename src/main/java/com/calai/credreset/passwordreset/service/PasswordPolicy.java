package com.calai.credreset.passwordreset.service;

import java.util.Optional;

public interface PasswordPolicy {

    /**
     * @return the first violated rule as a user-facing message, or empty if the
     *         password is acceptable
     */
    Optional<String> violation(String password);
}
