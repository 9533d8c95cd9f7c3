package com.calai.credreset.passwordreset.guard;

public enum ResetOperation {
    ISSUE,
    VERIFY,
    RESET
}
