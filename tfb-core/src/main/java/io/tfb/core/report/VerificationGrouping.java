package io.tfb.core.report;

import io.tfb.api.verification.Verification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups verification outcomes by framework.
 */
public final class VerificationGrouping {

    private VerificationGrouping() {}

    /**
     * @return framework name to its outcomes, frameworks sorted by name, outcomes
     *         in the order they were supplied
     */
    public static Map<String, List<Verification>> byFramework(List<Verification> verifications) {
        Map<String, List<Verification>> frameworks = new TreeMap<>();
        for (Verification verification : verifications) {
            frameworks.computeIfAbsent(verification.frameworkName(), k -> new ArrayList<>())
                    .add(verification);
        }
        frameworks.replaceAll((name, outcomes) -> Collections.unmodifiableList(outcomes));
        return Collections.unmodifiableMap(frameworks);
    }
}
