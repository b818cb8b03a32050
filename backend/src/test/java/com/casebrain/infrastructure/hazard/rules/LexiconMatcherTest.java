package com.casebrain.infrastructure.hazard.rules;

import com.casebrain.domain.housing.model.HazardInput;
import com.casebrain.domain.housing.model.IndicatorMatches;
import com.casebrain.domain.housing.model.IndicatorPack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexiconMatcherTest {

    private LexiconMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new LexiconMatcher();
    }

    @Nested
    @DisplayName("match")
    class MatchTests {
        @Test
        void returns_contained_phrases_in_lexicon_order() {
            String corpus = "condensation on windows and black mould in the bathroom";
            assertThat(matcher.match(corpus, List.of("black mould", "leak", "condensation")))
                    .containsExactly("black mould", "condensation");
        }

        @Test
        @DisplayName("order follows the lexicon, not the position in the text")
        void order_is_lexicon_order() {
            String corpus = "mould first then damp";
            assertThat(matcher.match(corpus, List.of("damp", "mould"))).containsExactly("damp", "mould");
        }

        @Test
        void phrases_are_matched_case_insensitively() {
            assertThat(matcher.match("rising damp in hallway", List.of("Rising Damp"))).containsExactly("Rising Damp");
        }

        @Test
        @DisplayName("substring semantics: a phrase inside a longer word still matches")
        void substring_inside_word_matches() {
            assertThat(matcher.match("the dampness persists", List.of("damp"))).containsExactly("damp");
            assertThat(matcher.match("scattered leaflets", List.of("cat"))).containsExactly("cat");
        }

        @Test
        void no_match_gives_empty_list() {
            assertThat(matcher.match("dry flat", List.of("mould"))).isEmpty();
            assertThat(matcher.match("anything", List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("matchAll: explicit occupant flags")
    class MatchAllTests {
        private final IndicatorPack pack = new IndicatorPack(
                List.of("mould"), List.of("child", "pregnant"), List.of("asthma"), List.of("ignored"));

        @Test
        void flags_are_appended_with_fixed_labels() {
            HazardInput input = HazardInput.builder()
                    .hasChildOccupant(true).hasElderlyOccupant(true).hasDisabledOccupant(true).build();

            IndicatorMatches matches = matcher.matchAll("", pack, input);

            assertThat(matches.vulnerableFactors()).containsExactly("child", "elderly", "disabled");
            assertThat(matches.vulnerableOccupantsDetected()).isTrue();
        }

        @Test
        void flag_does_not_duplicate_a_text_match() {
            HazardInput input = HazardInput.builder().hasChildOccupant(true).build();

            IndicatorMatches matches = matcher.matchAll("pregnant tenant with a child", pack, input);

            assertThat(matches.vulnerableFactors()).containsExactly("child", "pregnant");
        }

        @Test
        void all_categories_are_matched() {
            IndicatorMatches matches = matcher.matchAll(
                    "mould, asthma, landlord ignored us", pack, HazardInput.builder().build());

            assertThat(matches.dampMouldIndicators()).containsExactly("mould");
            assertThat(matches.symptoms()).containsExactly("asthma");
            assertThat(matches.delayFactors()).containsExactly("ignored");
            assertThat(matches.vulnerableFactors()).isEmpty();
        }
    }
}
