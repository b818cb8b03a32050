package com.casebrain.infrastructure.hazard.pack;

import com.casebrain.domain.housing.exception.InvalidIndicatorPackException;
import com.casebrain.domain.housing.model.IndicatorPack;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonIndicatorPackRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonIndicatorPackRegistry registry(String location) {
        return new JsonIndicatorPackRegistry(objectMapper, location);
    }

    @Nested
    @DisplayName("loading")
    class LoadingTests {
        @Test
        void loads_hazard_model_and_skips_packs_without_one() {
            JsonIndicatorPackRegistry registry = registry("classpath*:test-packs/valid/*.json");

            assertThat(registry.practiceAreas()).containsExactly("housing_disrepair");
            IndicatorPack pack = registry.findByPracticeArea("housing_disrepair").orElseThrow();
            assertThat(pack.dampMouldFactors()).containsExactly("mould", "damp");
            assertThat(pack.delayPatterns()).containsExactly("ignored");
        }

        @Test
        void bundled_default_pack_is_valid() {
            JsonIndicatorPackRegistry registry = registry("classpath*:packs/*.json");

            IndicatorPack pack = registry.findByPracticeArea("housing_disrepair").orElseThrow();
            assertThat(pack.dampMouldFactors()).contains("black mould", "condensation");
            assertThat(pack.vulnerableOccupantFactors()).isNotEmpty();
            assertThat(pack.symptomKeywords()).isNotEmpty();
            assertThat(pack.delayPatterns()).isNotEmpty();
        }

        @Test
        @DisplayName("a phrase list that is not an array fails fast")
        void non_array_list_fails() {
            assertThatThrownBy(() -> registry("classpath*:test-packs/malformed/*.json"))
                    .isInstanceOf(InvalidIndicatorPackException.class)
                    .hasMessageContaining("dampMouldFactors");
        }

        @Test
        void non_string_phrase_fails() {
            assertThatThrownBy(() -> registry("classpath*:test-packs/non-string/*.json"))
                    .isInstanceOf(InvalidIndicatorPackException.class)
                    .hasMessageContaining("vulnerableOccupantFactors");
        }

        @Test
        void no_files_means_no_packs() {
            JsonIndicatorPackRegistry registry = registry("classpath*:test-packs/none/*.json");
            assertThat(registry.practiceAreas()).isEmpty();
            assertThat(registry.findByPracticeArea("housing_disrepair")).isEmpty();
        }
    }

    @Nested
    @DisplayName("practice area lookup")
    class LookupTests {
        private final JsonIndicatorPackRegistry registry = registry("classpath*:test-packs/valid/*.json");

        @Test
        void housing_variants_resolve_to_housing_disrepair() {
            assertThat(registry.findByPracticeArea("Housing Disrepair")).isPresent();
            assertThat(registry.findByPracticeArea("housing")).isPresent();
            assertThat(registry.findByPracticeArea("DISREPAIR-claims")).isPresent();
        }

        @Test
        void unknown_or_blank_area_is_empty() {
            assertThat(registry.findByPracticeArea("criminal")).isEmpty();
            assertThat(registry.findByPracticeArea("personal_injury")).isEmpty();
            assertThat(registry.findByPracticeArea("")).isEmpty();
            assertThat(registry.findByPracticeArea(null)).isEmpty();
        }
    }
}
