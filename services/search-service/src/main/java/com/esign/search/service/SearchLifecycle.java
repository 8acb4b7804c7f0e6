package com.esign.search.service;

import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Ties {@link SearchOrchestrator#initialize()} and {@link SearchOrchestrator#shutdown()} to the
 * application context.
 */
@Component
public class SearchLifecycle implements SmartLifecycle {
    private final SearchOrchestrator orchestrator;
    private volatile boolean running;

    public SearchLifecycle(SearchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void start() {
        orchestrator.initialize();
        running = true;
    }

    @Override
    public void stop() {
        try {
            orchestrator.shutdown();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
