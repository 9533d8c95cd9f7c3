package com.calai.credreset.passwordreset.dto;

public record ResetPasswordRequest(String token, String newPassword) {

    // 密碼不能出現在任何 log（包含 record 預設的 toString）
    @Override
    public String toString() {
        return "ResetPasswordRequest[tokenLength=" + (token == null ? 0 : token.length())
                + ", newPassword=***]";
    }
}
