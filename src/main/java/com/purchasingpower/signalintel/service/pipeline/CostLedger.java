package com.purchasingpower.signalintel.service.pipeline;

import com.google.common.util.concurrent.AtomicDouble;

/**
 * Running USD estimate per provider category for one request. Thread-safe because search
 * sub-queries and enrichment lookups record costs from pool threads.
 */
public class CostLedger {

    private final AtomicDouble search = new AtomicDouble();
    private final AtomicDouble model = new AtomicDouble();
    private final AtomicDouble enrichment = new AtomicDouble();

    public void addSearch(double cost) {
        search.addAndGet(cost);
    }

    public void addModel(double cost) {
        model.addAndGet(cost);
    }

    public void addEnrichment(double cost) {
        enrichment.addAndGet(cost);
    }

    public double getSearch() {
        return search.get();
    }

    public double getModel() {
        return model.get();
    }

    public double getEnrichment() {
        return enrichment.get();
    }
}
