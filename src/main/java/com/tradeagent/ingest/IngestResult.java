package com.tradeagent.ingest;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Counts and per-source errors of one ingest call. Errors are collected rather than thrown so
 * one failing timeframe does not stop the others; the runner treats any error as a failed
 * ingest.
 */
@Getter
public class IngestResult {

    private int candlesInserted;
    private int orderBooksSaved;
    private int newsInserted;
    private final List<String> errors = new ArrayList<>();

    void addCandles(int count) {
        candlesInserted += count;
    }

    void orderBookSaved() {
        orderBooksSaved++;
    }

    void addNews(int count) {
        newsInserted += count;
    }

    void addError(String error) {
        errors.add(error);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }
}
