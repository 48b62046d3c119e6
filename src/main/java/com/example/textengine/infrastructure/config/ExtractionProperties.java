package com.example.textengine.infrastructure.config;

import com.example.textengine.domain.model.ExtractionOptions;
import com.example.textengine.domain.model.OrderingMode;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Engine settings bound from {@code textengine.extraction.*}.
 *
 * @param workers           batch worker count, {@code 0} picks {@code min(cpus, 4)}
 * @param ordering          default reading-order strategy
 * @param cacheCapacity     decoded-object cache capacity, {@code 0} sizes it from the page count
 * @param fontCacheCapacity font metric cache capacity
 * @param residentPages     pages kept decoded by the lazy page manager
 * @param rowSeparator      text between rows
 * @param pageSeparator     text between pages of a joined batch
 * @param insertWordSpacing insert spaces between runs separated by a visible gap
 * @param bufferPoolSize    idle scratch buffers kept for reuse
 */
@ConfigurationProperties(prefix = "textengine.extraction")
public record ExtractionProperties(
        @DefaultValue("0") int workers,
        @DefaultValue("SIMPLE") OrderingMode ordering,
        @DefaultValue("0") int cacheCapacity,
        @DefaultValue("1000") int fontCacheCapacity,
        @DefaultValue("10") int residentPages,
        @DefaultValue("\n") String rowSeparator,
        @DefaultValue("\n") String pageSeparator,
        @DefaultValue("false") boolean insertWordSpacing,
        @DefaultValue("32") int bufferPoolSize
) {

    public ExtractionOptions extractionOptions() {
        return new ExtractionOptions(ordering, rowSeparator, insertWordSpacing);
    }
}
