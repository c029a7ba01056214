package io.tfb.core.report;

import io.tfb.api.verification.Verification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationGroupingTest {

    @Test
    void shouldKeepSuppliedOrderWithinFramework() {
        var plaintext = Verification.passed("gemini", "plaintext");
        var json = Verification.passed("gemini", "json");
        var db = Verification.passed("gemini", "db");

        var grouped = VerificationGrouping.byFramework(List.of(plaintext, json, db));

        assertThat(grouped).containsOnlyKeys("gemini");
        assertThat(grouped.get("gemini")).containsExactly(plaintext, json, db);
    }

    @Test
    void shouldSortFrameworksByName() {
        var grouped = VerificationGrouping.byFramework(List.of(
                Verification.passed("vertx", "json"),
                Verification.passed("actix", "json"),
                Verification.passed("gemini", "json")));

        assertThat(grouped.keySet()).containsExactly("actix", "gemini", "vertx");
    }

    @Test
    void shouldReturnEmptyMapForNoOutcomes() {
        assertThat(VerificationGrouping.byFramework(List.of())).isEmpty();
    }

    @Test
    void groupsShouldBeReadOnly() {
        var grouped = VerificationGrouping.byFramework(List.of(Verification.passed("gemini", "json")));

        assertThatThrownBy(() -> grouped.get("gemini").add(Verification.passed("gemini", "db")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
