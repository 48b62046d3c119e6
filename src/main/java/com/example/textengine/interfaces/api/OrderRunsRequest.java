package com.example.textengine.interfaces.api;

import com.example.textengine.domain.model.TextRun;

import java.util.List;

/**
 * JSON body of {@code POST /api/order}.
 *
 * @param ordering {@code simple} or {@code smart}; blank or unknown values use the configured default
 * @param runs     runs of one page in any order
 */
public record OrderRunsRequest(String ordering, List<TextRun> runs) {
}
