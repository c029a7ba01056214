package io.tfb.api.verification;

public enum VerificationStatus {
    PASS,
    WARN,
    ERROR
}
