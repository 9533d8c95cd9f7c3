package com.calai.credreset.passwordreset.dto;

public record MessageResponse(String message, String requestId) {}
