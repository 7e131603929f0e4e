package com.fragrance.enrichment.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tracks the state of one request and rejects illegal transitions.
 * Confined to the request's thread.
 */
@Slf4j
public final class PipelineRun {

    @Getter
    private final String name;

    @Getter
    private PipelineState state = PipelineState.START;

    private final List<PipelineState> history = new ArrayList<>(List.of(PipelineState.START));

    PipelineRun(final String name) {
        this.name = name;
    }

    PipelineRun moveTo(final PipelineState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " → " + next + " for '" + name + "'");
        }
        log.debug("'{}': {} → {}", name, state, next);
        state = next;
        history.add(next);
        return this;
    }

    public List<PipelineState> history() {
        return Collections.unmodifiableList(history);
    }
}
