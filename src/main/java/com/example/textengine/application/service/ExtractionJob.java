package com.example.textengine.application.service;

/**
 * A page waiting in the batch queue together with the result slot it fills.
 */
record ExtractionJob(int pageNumber, int slot) {

    static final ExtractionJob STOP = new ExtractionJob(-1, -1);

    boolean isStop() {
        return this == STOP;
    }
}
