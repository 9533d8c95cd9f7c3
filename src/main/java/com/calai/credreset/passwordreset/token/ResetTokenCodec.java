package com.calai.credreset.passwordreset.token;

import com.calai.credreset.common.crypto.HmacSha256;
import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reset token 的唯一編解碼點：產生、正規化、格式檢查、加 pepper 的雜湊。
 * <p>
 * 只有這個類別會看到 raw token（加上寄信那一下）。
 * normalize 是 issue 端與 consume 端共用的同一份實作，不要在別處另外寫一套。
 */
@Component
public class ResetTokenCodec {

    public static final int TOKEN_BYTES = 32;                 // 256-bit
    public static final int TOKEN_LENGTH = TOKEN_BYTES * 2;   // hex
    public static final int HASH_FRAGMENT_LENGTH = 8;

    private static final SecureRandom SR = new SecureRandom();

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_PARAM =
            Pattern.compile("(?:^|[?&#;])token=([0-9a-f]+)");
    private static final Pattern FORMAT = Pattern.compile("^[0-9a-f]{" + TOKEN_LENGTH + "}$");

    private final byte[] pepper;

    @Autowired
    public ResetTokenCodec(PasswordResetProperties props) {
        this(props.getPepper());
    }

    public ResetTokenCodec(String pepper) {
        if (pepper == null || pepper.isBlank()) {
            throw new IllegalStateException("PASSWORD_RESET_PEPPER_MISSING");
        }
        this.pepper = pepper.getBytes(StandardCharsets.UTF_8);
    }

    /** 64 字元小寫 hex */
    public String generate() {
        byte[] buf = new byte[TOKEN_BYTES];
        SR.nextBytes(buf);
        StringBuilder sb = new StringBuilder(TOKEN_LENGTH);
        for (byte b : buf) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    /**
     * 使用者貼上的可能是 token、整段 deep link、或只是 query 片段。
     * 去掉所有空白、轉小寫，再抓 token= 的值（沒有就用整段）。
     * 順序不能換：先正規化再抓，normalize(normalize(x)) 才會等於 normalize(x)。
     */
    public static String normalize(String input) {
        if (input == null) return "";
        String s = WHITESPACE.matcher(input).replaceAll("").toLowerCase(Locale.ROOT);
        Matcher m = TOKEN_PARAM.matcher(s);
        return m.find() ? m.group(1) : s;
    }

    /** 只是便宜的前置過濾，通過不代表 token 有效 */
    public static boolean validateFormat(String token) {
        return token != null && FORMAT.matcher(token).matches();
    }

    /** HMAC-SHA256(pepper, token)；呼叫端應先 normalize */
    public String hash(String normalizedToken) {
        return HmacSha256.hex(pepper, normalizedToken);
    }

    /** log / diagnostics 用的雜湊尾碼，永遠不回完整 hash */
    public static String fragment(String tokenHash) {
        if (tokenHash == null || tokenHash.length() < HASH_FRAGMENT_LENGTH) return null;
        return tokenHash.substring(tokenHash.length() - HASH_FRAGMENT_LENGTH);
    }
}
