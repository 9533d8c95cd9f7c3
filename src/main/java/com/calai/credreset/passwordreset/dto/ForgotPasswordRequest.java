package com.calai.credreset.passwordreset.dto;

public record ForgotPasswordRequest(String email) {}
