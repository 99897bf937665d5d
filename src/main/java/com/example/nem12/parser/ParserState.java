package com.example.nem12.parser;

import com.example.nem12.model.MeterContext;

import java.util.Objects;

/**
 * Position of a single parse in the NEM12 record hierarchy. Transitions return a new
 * state; the active context is only ever replaced, never modified.
 */
public final class ParserState {

    public enum Phase {
        NO_CONTEXT,
        HAS_CONTEXT,
        DONE
    }

    private static final ParserState INITIAL = new ParserState(Phase.NO_CONTEXT, null);

    private final Phase phase;
    private final MeterContext context;

    private ParserState(Phase phase, MeterContext context) {
        this.phase = phase;
        this.context = context;
    }

    public static ParserState initial() {
        return INITIAL;
    }

    public ParserState withContext(MeterContext newContext) {
        Objects.requireNonNull(newContext, "newContext");
        if (phase == Phase.DONE) {
            throw new IllegalStateException("Parse already finished");
        }
        return new ParserState(Phase.HAS_CONTEXT, newContext);
    }

    public ParserState finish() {
        return new ParserState(Phase.DONE, context);
    }

    public Phase getPhase() {
        return phase;
    }

    public boolean isDone() {
        return phase == Phase.DONE;
    }

    public boolean hasContext() {
        return phase == Phase.HAS_CONTEXT;
    }

    /**
     * @throws IllegalStateException when no 200 record has been seen yet
     */
    public MeterContext getContext() {
        if (phase != Phase.HAS_CONTEXT) {
            throw new IllegalStateException("No active meter context in phase " + phase);
        }
        return context;
    }

    @Override
    public String toString() {
        return phase + (context == null ? "" : "(" + context + ")");
    }
}
