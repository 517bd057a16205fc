package com.newsinsight.reliability.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static com.newsinsight.reliability.scoring.ScoringFixtures.evidence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FreshnessCalculatorTest {

    private FreshnessCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new FreshnessCalculator(ScoringFixtures.scoringProperties(), ScoringFixtures.FIXED_CLOCK);
    }

    @Test
    @DisplayName("No evidence yields the floor")
    void noEvidence() {
        assertThat(calculator.calculate("Any", "oncology", List.of()).score()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("Fifteen or more recent items saturate at 1.0")
    void saturation() {
        assertThat(calculator.calculate("Any", "oncology",
                evidence(15, "Any", "oncology", "2023-02-01", null)).score()).isEqualTo(1.0);
        assertThat(calculator.calculate("Any", "oncology",
                evidence(40, "Any", "oncology", "2024", null)).score()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Old and undated items are not counted")
    void oldAndUndatedItems() {
        ComponentScore score = calculator.calculate("Any", "oncology", List.of(
                evidence("Any", "oncology", "2023 May 12", "a", null),
                evidence("Any", "oncology", "2022-01-01", "b", null),
                evidence("Any", "oncology", "2021", "c", null),
                evidence("Any", "oncology", "unknown", "d", null),
                evidence("Any", "oncology", null, "e", null),
                evidence("Any", "oncology", "20", "f", null)));

        assertThat(score.score()).isCloseTo(2.0 / 15, within(1e-9));
        assertThat(score.detail())
                .containsEntry("recent_count", 2)
                .containsEntry("undated_count", 3);
    }

    @Test
    @DisplayName("Future years count as recent")
    void futureYears() {
        ComponentScore score = calculator.calculate("Any", "oncology",
                evidence(3, "Any", "oncology", "2025", null));

        assertThat(score.detail()).containsEntry("recent_count", 3);
    }

    @Test
    @DisplayName("Year is read from the first four characters")
    void publicationYear() {
        assertThat(FreshnessCalculator.publicationYear("2023-05")).isEqualTo(OptionalInt.of(2023));
        assertThat(FreshnessCalculator.publicationYear("1999 Dec")).isEqualTo(OptionalInt.of(1999));
        assertThat(FreshnessCalculator.publicationYear("May 2023")).isEmpty();
        assertThat(FreshnessCalculator.publicationYear("")).isEmpty();
    }
}
