package com.calai.credreset.passwordreset.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.password-reset")
public class PasswordResetProperties {

    /** HMAC key for token hashes. Rotating it invalidates every outstanding token. */
    @ToString.Exclude
    @NotBlank
    private String pepper;

    /** 發出後多久失效 */
    @NotNull
    private Duration tokenTtl = Duration.ofMinutes(60);

    /** 過期後再保留多久才由 retention worker 刪掉 */
    @NotNull
    private Duration retention = Duration.ofDays(7);

    /** Deep link; token and email are appended as query parameters. */
    @NotBlank
    private String resetLinkBaseUrl = "https://app.example.com/reset-password";

    @Valid
    private Mail mail = new Mail();

    @Valid
    private Diagnostics diagnostics = new Diagnostics();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class Mail {
        private boolean enabled = true;
        private String sender = "no-reply@example.com";
        private String subject = "Reset your password";
    }

    @Data
    public static class Diagnostics {
        /** dev/test 才開：回應裡附 diagnostics 物件 */
        private boolean expose = false;

        /** 帶這個值的 X-Reset-Diagnostics-Key header 也可以拿到 diagnostics；空字串 = 關閉 */
        @ToString.Exclude
        private String operatorKey = "";

        /** true：回應與判定不一致時直接丟例外（dev/test）；false：只記 ERROR log（prod） */
        private boolean failOnMismatch = false;
    }

    @Data
    public static class RateLimit {
        @NotNull
        private Duration window = Duration.ofMinutes(15);
        @Min(1)
        private int issue = 3;
        @Min(1)
        private int verify = 10;
        @Min(1)
        private int reset = 5;
        /** 計數 cache 的 key 上限，超過就淘汰，避免大量不同來源把記憶體吃光 */
        @Min(1)
        private long maxTrackedCallers = 100_000;
    }
}
