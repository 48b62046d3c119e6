package com.example.textengine.infrastructure.config;

import com.example.textengine.application.service.BatchExtractionService;
import com.example.textengine.application.service.IncrementalExtractionFactory;
import com.example.textengine.application.service.PageExtractor;
import com.example.textengine.domain.layout.ReadingOrderReconstructor;
import com.example.textengine.infrastructure.buffer.ScratchBufferPool;
import com.example.textengine.infrastructure.cache.ReferenceCaches;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine. Engine classes stay plain objects so they can be built directly in tests.
 */
@Configuration
public class ExtractionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExtractionConfig.class);

    @Bean
    public ReferenceCaches referenceCaches(ExtractionProperties properties) {
        log.info("Reference caches: objects={}, fonts={}", properties.cacheCapacity(), properties.fontCacheCapacity());
        return new ReferenceCaches(properties.cacheCapacity(), properties.fontCacheCapacity());
    }

    @Bean
    public ScratchBufferPool scratchBufferPool(ExtractionProperties properties) {
        return new ScratchBufferPool(properties.bufferPoolSize());
    }

    @Bean
    public ReadingOrderReconstructor readingOrderReconstructor() {
        return new ReadingOrderReconstructor();
    }

    @Bean
    public PageExtractor pageExtractor(ReadingOrderReconstructor reconstructor, ReferenceCaches caches,
                                       ScratchBufferPool bufferPool) {
        return new PageExtractor(reconstructor, caches, bufferPool);
    }

    @Bean
    public BatchExtractionService batchExtractionService(PageExtractor pageExtractor, ReferenceCaches caches,
                                                         ExtractionProperties properties) {
        return new BatchExtractionService(pageExtractor, caches, properties.pageSeparator());
    }

    @Bean
    public IncrementalExtractionFactory incrementalExtractionFactory(PageExtractor pageExtractor,
                                                                     ExtractionProperties properties) {
        return new IncrementalExtractionFactory(pageExtractor, properties.extractionOptions(),
                properties.residentPages());
    }
}
