package ai.duel.config;

import ai.duel.catalog.CardCatalog;
import ai.duel.catalog.CardCatalogLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the card catalog as a singleton bean, loaded once from the classpath at startup.
 * <p>
 * Locations are configurable with {@code catalog.monsters} and {@code catalog.fusions}.
 */
@Configuration
public class CatalogConfiguration {

    @Bean
    public CardCatalog cardCatalog(
            @Value("${catalog.monsters:catalog/monsters.json}") String monstersResource,
            @Value("${catalog.fusions:catalog/fusions.json}") String fusionsResource) {
        return new CardCatalogLoader().loadFromClasspath(monstersResource, fusionsResource);
    }
}
