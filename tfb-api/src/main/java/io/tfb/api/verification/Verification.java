package io.tfb.api.verification;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of verifying one test type (json, plaintext, db, ...) of a framework.
 * <p>
 * Errors take priority over warnings: an outcome with at least one error is
 * {@link VerificationStatus#ERROR} whatever its warnings are, and it only passes
 * when both lists are empty.
 */
public record Verification(
        String frameworkName,
        String typeName,
        List<VerificationMessage> errors,
        List<VerificationMessage> warnings
) {

    public Verification {
        if (frameworkName == null) {
            throw new IllegalArgumentException("Framework name must not be null");
        }
        if (typeName == null) {
            throw new IllegalArgumentException("Type name must not be null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static Verification passed(String frameworkName, String typeName) {
        return new Verification(frameworkName, typeName, List.of(), List.of());
    }

    public VerificationStatus status() {
        if (!errors.isEmpty()) {
            return VerificationStatus.ERROR;
        }
        if (!warnings.isEmpty()) {
            return VerificationStatus.WARN;
        }
        return VerificationStatus.PASS;
    }

    /**
     * The message surfaced in a summary line: the first error for ERROR,
     * the first warning for WARN, nothing for PASS.
     */
    public Optional<VerificationMessage> firstMessage() {
        return switch (status()) {
            case ERROR -> Optional.of(errors.get(0));
            case WARN -> Optional.of(warnings.get(0));
            case PASS -> Optional.empty();
        };
    }
}
