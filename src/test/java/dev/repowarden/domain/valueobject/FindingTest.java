package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingTest {

    @Test
    @DisplayName("labels are derived from category and value only")
    void labelDerivation() {
        assertThat(Finding.of(FindingCategory.LANGUAGE, Severity.INFO, "python").label()).contains("lang:python");
        assertThat(Finding.of(FindingCategory.SIZE, Severity.WARN, "large").label()).contains("size:large");
        assertThat(new Finding(FindingCategory.SECURITY, Severity.CRITICAL, "dangerous-call", "a.py:3").label())
                .contains("security:dangerous-call");
        assertThat(Finding.of(FindingCategory.PRIORITY, Severity.CRITICAL, "urgent").label()).contains("priority:urgent");
        assertThat(Finding.of(FindingCategory.CLASSIFICATION, Severity.INFO, "bug").label()).contains("bug");
        assertThat(Finding.of(FindingCategory.CLASSIFICATION, Severity.INFO, "feature").label()).contains("enhancement");
    }

    @Test
    @DisplayName("ownership findings never produce a label")
    void ownershipHasNoLabel() {
        assertThat(Finding.of(FindingCategory.OWNERSHIP, Severity.INFO, "alice").label()).isEmpty();
    }

    @Test
    @DisplayName("evidence does not affect the label")
    void evidenceIgnoredForLabel() {
        Finding a = new Finding(FindingCategory.SECURITY, Severity.CRITICAL, "hardcoded-credential", "a.py:1");
        Finding b = new Finding(FindingCategory.SECURITY, Severity.CRITICAL, "hardcoded-credential", "b.py:9");
        assertThat(a.label()).isEqualTo(b.label());
    }

    @Test
    @DisplayName("canonical order is independent of input order")
    void canonicalOrder() {
        Finding lang = Finding.of(FindingCategory.LANGUAGE, Severity.INFO, "go");
        Finding size = Finding.of(FindingCategory.SIZE, Severity.INFO, "small");
        Finding sec = new Finding(FindingCategory.SECURITY, Severity.WARN, "sql-injection-risk", "q.py:2");

        List<Finding> shuffled = new ArrayList<>(List.of(sec, lang, size));
        shuffled.sort(Finding.ORDER);

        assertThat(shuffled).containsExactly(lang, size, sec);
    }

    @Test
    @DisplayName("blank value is rejected")
    void rejectsBlankValue() {
        assertThatThrownBy(() -> Finding.of(FindingCategory.LANGUAGE, Severity.INFO, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
