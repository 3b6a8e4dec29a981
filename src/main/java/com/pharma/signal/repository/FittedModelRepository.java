package com.pharma.signal.repository;

import com.pharma.signal.engine.forecast.FittedForecast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Append-only cache of fitted forecast models. An entry is never replaced once
 * written; a different snapshot or setting produces a different key.
 */
@Repository
public class FittedModelRepository {

    private static final Logger log = LoggerFactory.getLogger(FittedModelRepository.class);

    private final Map<ModelCacheKey, FittedForecast> models = new ConcurrentHashMap<>();

    public FittedForecast getOrFit(ModelCacheKey key, Supplier<FittedForecast> fitter) {
        FittedForecast cached = models.get(key);
        if (cached != null) {
            log.debug("Reusing fitted model for {}", key);
            return cached;
        }
        // fit outside the map lock; a concurrent fit of the same key loses to the first writer
        FittedForecast fitted = fitter.get();
        FittedForecast existing = models.putIfAbsent(key, fitted);
        return existing != null ? existing : fitted;
    }

    public Optional<FittedForecast> find(ModelCacheKey key) {
        return Optional.ofNullable(models.get(key));
    }

    public int size() {
        return models.size();
    }
}
