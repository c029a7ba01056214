package io.tfb.api.verification;

/**
 * One error or warning raised while verifying a test endpoint.
 *
 * @param shortMessage one-line summary shown in the verification summary
 * @param longMessage  full detail, written to the per-test log during verification
 */
public record VerificationMessage(String shortMessage, String longMessage) {

    public VerificationMessage {
        if (shortMessage == null) {
            throw new IllegalArgumentException("Short message must not be null");
        }
        if (longMessage == null) {
            longMessage = "";
        }
    }

    public static VerificationMessage of(String shortMessage) {
        return new VerificationMessage(shortMessage, "");
    }
}
