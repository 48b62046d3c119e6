package com.example.textengine.domain.model;

/**
 * Residency snapshot of a lazy page manager.
 */
public record PageManagerStats(int totalPages, int residentPages) {
}
