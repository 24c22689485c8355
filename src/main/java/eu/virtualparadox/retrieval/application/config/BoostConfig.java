package eu.virtualparadox.retrieval.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Curated literals (brand names, locations) whose presence in both query and chunk raises the
 * chunk's semantic score. Embeddings tend to under-weight such rare proper nouns.
 */
@Configuration
@ConfigurationProperties(prefix = "retrieval.boost")
@Getter @Setter
public class BoostConfig {

    private double primaryBoost = 0.8;
    private double secondaryBoost = 0.3;
    private List<BoostTerm> terms = new ArrayList<>();

    /**
     * One literal with its spelling variants, e.g. a Latin and a Thai spelling of the same brand.
     */
    @Getter @Setter
    public static class BoostTerm {
        private List<String> variants = new ArrayList<>();
        private boolean primary;

        public BoostTerm() {
        }

        public BoostTerm(final List<String> variants, final boolean primary) {
            this.variants = new ArrayList<>(variants);
            this.primary = primary;
        }
    }
}
