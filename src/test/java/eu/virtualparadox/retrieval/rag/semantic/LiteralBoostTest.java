package eu.virtualparadox.retrieval.rag.semantic;

import eu.virtualparadox.retrieval.application.config.BoostConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LiteralBoostTest {

    private LiteralBoost literalBoost;

    @BeforeEach
    void setUp() {
        final BoostConfig config = new BoostConfig();
        config.setTerms(List.of(
                new BoostConfig.BoostTerm(List.of("xolo", "โซโล่"), true),
                new BoostConfig.BoostTerm(List.of("bangkapi", "บางกะปิ"), false)));
        literalBoost = new LiteralBoost(config);
    }

    @Test
    @DisplayName("Only terms mentioned by the query are active")
    void testActiveTerms() {
        final List<LiteralBoost.ActiveTerm> active = literalBoost.activeTerms("Where is XOLO?");

        assertThat(active).hasSize(1);
        assertThat(active.get(0).boost()).isEqualTo(0.8);
        assertThat(literalBoost.activeTerms("opening hours")).isEmpty();
        assertThat(literalBoost.activeTerms(" ")).isEmpty();
    }

    @Test
    @DisplayName("A Thai spelling in the query boosts chunks with the Latin spelling")
    void testCrossScriptBoost() {
        final List<LiteralBoost.ActiveTerm> active = literalBoost.activeTerms("ร้านโซโล่");

        assertThat(literalBoost.boostFor(active, "XOLO store menu")).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Boosts of several active terms add up")
    void testBoostsAddUp() {
        final List<LiteralBoost.ActiveTerm> active = literalBoost.activeTerms("xolo bangkapi");

        assertThat(literalBoost.boostFor(active, "Xolo Bangkapi branch")).isCloseTo(1.1, within(1e-9));
        assertThat(literalBoost.boostFor(active, "Bangkapi district")).isCloseTo(0.3, within(1e-9));
        assertThat(literalBoost.boostFor(active, "nothing relevant")).isZero();
    }

    @Test
    @DisplayName("A Thai word sharing only consonants with a literal neither activates nor earns it")
    void testConsonantLookalikeIgnored() {
        assertThat(literalBoost.activeTerms("โซลูชันการเงิน")).isEmpty();

        final List<LiteralBoost.ActiveTerm> active = literalBoost.activeTerms("XOLO");
        assertThat(literalBoost.boostFor(active, "โซลูชันการเงินสำหรับธุรกิจ")).isZero();
    }

    @Test
    @DisplayName("Tone marks and whitespace width do not affect literal matching")
    void testToneMarkAndSpacingInsensitive() {
        final List<LiteralBoost.ActiveTerm> active = literalBoost.activeTerms("โซโล่");

        assertThat(literalBoost.boostFor(active, "เมนูร้านโซโล วันนี้")).isEqualTo(0.8);
        assertThat(literalBoost.boostFor(active, "Xolo\t\tmenu")).isEqualTo(0.8);
    }
}
