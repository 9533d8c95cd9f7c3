package com.calai.credreset;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class CredResetApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredResetApplication.class, args);
    }

    /**
     * 測試環境不啟動排程，避免 retention worker 在 H2 建表前就去刪 password_reset_tokens
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
        // no-op
    }
}
