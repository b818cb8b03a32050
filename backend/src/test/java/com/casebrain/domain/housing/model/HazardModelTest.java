package com.casebrain.domain.housing.model;

import com.casebrain.domain.housing.exception.InvalidIndicatorPackException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HazardModelTest {

    @Nested
    @DisplayName("IndicatorPack")
    class IndicatorPackTests {
        @Test
        void missing_list_fails_fast() {
            assertThatThrownBy(() -> new IndicatorPack(List.of("damp"), null, List.of(), List.of()))
                    .isInstanceOf(InvalidIndicatorPackException.class)
                    .hasMessageContaining("vulnerableOccupantFactors");
        }

        @Test
        void null_phrase_fails_fast() {
            assertThatThrownBy(() -> new IndicatorPack(Arrays.asList("damp", null), List.of(), List.of(), List.of()))
                    .isInstanceOf(InvalidIndicatorPackException.class)
                    .hasMessageContaining("dampMouldFactors");
        }

        @Test
        void empty_lists_are_valid() {
            IndicatorPack pack = new IndicatorPack(List.of(), List.of(), List.of(), List.of());
            assertThat(pack.dampMouldFactors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("HazardInput")
    class HazardInputTests {
        @Test
        void defaults_for_missing_fields() {
            HazardInput input = HazardInput.builder().build();
            assertThat(input.documents()).isEmpty();
            assertThat(input.landlordType()).isEqualTo(LandlordType.UNKNOWN);
            assertThat(input.hasChildOccupant()).isFalse();
        }
    }

    @Nested
    @DisplayName("LandlordType")
    class LandlordTypeTests {
        @Test
        void parses_known_values_case_insensitively() {
            assertThat(LandlordType.fromValue("social")).isEqualTo(LandlordType.SOCIAL);
            assertThat(LandlordType.fromValue(" Private ")).isEqualTo(LandlordType.PRIVATE);
        }

        @Test
        void anything_else_is_unknown() {
            assertThat(LandlordType.fromValue(null)).isEqualTo(LandlordType.UNKNOWN);
            assertThat(LandlordType.fromValue("council")).isEqualTo(LandlordType.UNKNOWN);
            assertThat(LandlordType.fromValue("")).isEqualTo(LandlordType.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("HousingHazardSummary.empty")
    class EmptySummaryTests {
        @Test
        void baseline_has_nothing_detected() {
            HousingHazardSummary empty = HousingHazardSummary.empty();
            assertThat(empty.dampMouldDetected()).isFalse();
            assertThat(empty.vulnerableOccupantsDetected()).isFalse();
            assertThat(empty.healthSymptomsDetected()).isFalse();
            assertThat(empty.delayPatternsDetected()).isFalse();
            assertThat(empty.awaabApplies()).isFalse();
            assertThat(empty.urgentAction()).isFalse();
            assertThat(empty.hhsrsCategory()).isNull();
            assertThat(empty.awaabDeadlineDays()).isNull();
            assertThat(empty.dampMouldSeverity()).isEqualTo(Severity.LOW);
            assertThat(empty.vulnerabilitySeverity()).isEqualTo(Severity.LOW);
            assertThat(empty.awaabBreachRisk()).isEqualTo(Severity.LOW);
            assertThat(empty.overallRiskLevel()).isEqualTo(Severity.LOW);
            assertThat(empty.recommendations()).isEmpty();
            assertThat(empty.hhsrsHazards()).isEmpty();
        }

        @Test
        void baseline_is_a_fresh_equal_value() {
            assertThat(HousingHazardSummary.empty()).isEqualTo(HousingHazardSummary.empty());
        }
    }
}
