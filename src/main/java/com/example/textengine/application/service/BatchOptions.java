package com.example.textengine.application.service;

import com.example.textengine.application.concurrent.CancellationToken;
import com.example.textengine.domain.model.ExtractionOptions;

import java.util.Objects;

/**
 * Settings of one batch call.
 *
 * @param workers    worker threads, {@code 0} picks {@code min(cpus, 4)}; negative values are rejected
 * @param extraction per-page ordering and rendering options
 * @param token      cooperative cancellation token shared with the caller
 */
public record BatchOptions(int workers, ExtractionOptions extraction, CancellationToken token) {

    public BatchOptions {
        extraction = Objects.requireNonNullElseGet(extraction, ExtractionOptions::defaults);
        token = Objects.requireNonNullElseGet(token, CancellationToken::create);
    }

    public static BatchOptions defaults() {
        return new BatchOptions(0, ExtractionOptions.defaults(), CancellationToken.create());
    }

    public static BatchOptions of(ExtractionOptions extraction) {
        return new BatchOptions(0, extraction, CancellationToken.create());
    }

    public BatchOptions withWorkers(int newWorkers) {
        return new BatchOptions(newWorkers, extraction, token);
    }

    public BatchOptions withToken(CancellationToken newToken) {
        return new BatchOptions(workers, extraction, newToken);
    }
}
