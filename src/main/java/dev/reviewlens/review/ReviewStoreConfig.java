package dev.reviewlens.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Loads the review corpus once at startup and publishes it as an immutable {@link ReviewStore}
 * singleton.
 *
 * <p>The source location is externalised via {@code reviewlens.reviews.location} and accepts any
 * Spring resource prefix ({@code classpath:}, {@code file:}).
 */
@Configuration
public class ReviewStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ReviewStoreConfig.class);

    @Bean
    public ReviewCsvLoader reviewCsvLoader() {
        return new ReviewCsvLoader();
    }

    /**
     * Reads every review from the configured location.
     *
     * @param loader   the CSV loader
     * @param location the review source (e.g. {@code classpath:data/reviews.csv})
     * @return the read-only review store shared by all requests
     */
    @Bean
    public ReviewStore reviewStore(
            ReviewCsvLoader loader,
            @Value("${reviewlens.reviews.location}") Resource location) {
        if (!location.exists()) {
            throw new ReviewLoadException("Review source not found: " + location.getDescription());
        }
        ReviewStore store = new ReviewStore(loader.load(location));
        log.info("Review store initialised with {} reviews", store.size());
        return store;
    }
}
