package com.calai.credreset.common.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

public final class HmacSha256 {

    private static final String ALG = "HmacSHA256";

    private HmacSha256() {}

    /**
     * HMAC-SHA256(key, msg)，輸出 64 字元小寫 hex。
     * Mac 不是 thread-safe，每次呼叫各自建立。
     */
    public static String hex(byte[] key, String msg) {
        if (key == null || key.length == 0) {
            throw new IllegalStateException("HMAC_KEY_MISSING");
        }
        try {
            Mac mac = Mac.getInstance(ALG);
            mac.init(new SecretKeySpec(key, ALG));
            byte[] out = mac.doFinal(msg.getBytes(StandardCharsets.UTF_8));
            return toHex(out);
        } catch (Exception e) {
            throw new IllegalStateException("HMAC_SHA256_FAILED", e);
        }
    }

    public static String hex(String secret, String msg) {
        return hex(secret == null ? null : secret.getBytes(StandardCharsets.UTF_8), msg);
    }

    /** 固定時間比較，避免以回應時間猜測 secret */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8)
        );
    }

    static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
