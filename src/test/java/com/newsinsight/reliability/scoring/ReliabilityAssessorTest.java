package com.newsinsight.reliability.scoring;

import com.newsinsight.reliability.entity.ReliabilityBand;
import com.newsinsight.reliability.entity.UncertaintyLevel;
import com.newsinsight.reliability.entity.UseCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.newsinsight.reliability.scoring.ScoringFixtures.GENERAL_ABSTRACT;
import static com.newsinsight.reliability.scoring.ScoringFixtures.ONCOLOGY_ABSTRACT;
import static com.newsinsight.reliability.scoring.ScoringFixtures.evidence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReliabilityAssessorTest {

    private ReliabilityAssessor assessor;

    @BeforeEach
    void setUp() {
        assessor = ScoringFixtures.assessor();
    }

    @Test
    @DisplayName("Specialized recent venue outranks a flagship with old off-topic evidence for clinical use")
    void specializedVenueOutranksFlagship() {
        // given
        var jcoEvidence = evidence(8, "Journal of Clinical Oncology", "oncology", "2023", ONCOLOGY_ABSTRACT);
        var natureEvidence = evidence(3, "Nature", "oncology", "2015", GENERAL_ABSTRACT);

        // when
        ReliabilityAssessment jco = assessor.assess("Journal of Clinical Oncology", "oncology", UseCase.CLINICAL, jcoEvidence, null);
        ReliabilityAssessment nature = assessor.assess("Nature", "oncology", UseCase.CLINICAL, natureEvidence, 45.0);

        // then
        assertThat(jco.result().score()).isEqualTo(0.919);
        assertThat(jco.result().band()).isEqualTo(ReliabilityBand.HIGH);
        assertThat(nature.result().score()).isEqualTo(0.598);
        assertThat(nature.result().band()).isEqualTo(ReliabilityBand.EXPLORATORY);
        assertThat(jco.result().score()).isGreaterThan(nature.result().score());
    }

    @Test
    @DisplayName("Zero evidence falls back to name estimates with high uncertainty")
    void zeroEvidence() {
        ReliabilityAssessment assessment = assessor.assess("Cancer Research", "Oncology", UseCase.CLINICAL, List.of(), null);

        assertThat(assessment.domain()).isEqualTo("oncology");
        assertThat(assessment.evidenceCount()).isZero();
        assertThat(assessment.result().uncertainty()).isEqualTo(UncertaintyLevel.HIGH);
        assertThat(assessment.result().components().relevance()).isEqualTo(0.8);
        assertThat(assessment.result().components().freshness()).isEqualTo(0.1);
        assertThat(assessment.details().get(ScoreComponent.RELEVANCE)).containsEntry("method", "name_estimate");
        // 0.45*0.7 + 0.20*0.8 + 0.05*0.1 + 0.25*0.4 + 0.05*0.65
        assertThat(assessment.result().score()).isBetween(0.612, 0.613);
        assertThat(assessment.result().reasons()).contains("Limited evidence available - interpret cautiously");
    }

    @Test
    @DisplayName("Null evidence is treated as empty")
    void nullEvidence() {
        ReliabilityAssessment assessment = assessor.assess("Regional Bulletin", "neurology", UseCase.EXPLORATORY, null, null);

        assertThat(assessment.result().score()).isBetween(0.0, 1.0);
        assertThat(assessment.result().reasons()).isNotEmpty();
    }

    @Test
    @DisplayName("Identical inputs produce identical results")
    void deterministic() {
        var items = evidence(12, "Blood", "oncology", "2023", ONCOLOGY_ABSTRACT);

        ReliabilityAssessment first = assessor.assess("Blood", "oncology", UseCase.EXPLORATORY, items, 15.0);
        ReliabilityAssessment second = assessor.assess("Blood", "oncology", UseCase.EXPLORATORY, items, 15.0);

        assertThat(second.result()).isEqualTo(first.result());
        assertThat(second.details()).isEqualTo(first.details());
        assertThat(first.version()).isEqualTo("v2");
        assertThat(first.computedAt()).isEqualTo(ScoringFixtures.FIXED_CLOCK.instant());
    }

    @Test
    @DisplayName("Every component must have a calculator")
    void missingCalculatorRejected() {
        var properties = ScoringFixtures.scoringProperties();
        List<ComponentCalculator> partial = List.of(new GuidelineCalculator(properties), new RigorCalculator(properties));

        assertThatThrownBy(() -> new ReliabilityAssessor(partial, new CompositeScorer(properties), properties,
                ScoringFixtures.FIXED_CLOCK))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("authority");
    }
}
