package com.tradejournal.application.statemachine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * State machine for the handling of one relayed envelope
 *
 * <pre>
 * RECEIVED --DISPATCH--> DISPATCHING --SUCCEED--> APPLIED
 *                                    --FAIL-----> FAILED
 *          --REJECT----> REJECTED    &lt;--REJECT--
 * </pre>
 *
 * APPLIED, FAILED and REJECTED are terminal.
 */
@Component
public class EnvelopeStateMachine {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeStateMachine.class);

    public enum State {
        RECEIVED,
        DISPATCHING,
        APPLIED,
        FAILED,
        REJECTED;

        public boolean isTerminal() {
            return this == APPLIED || this == FAILED || this == REJECTED;
        }
    }

    public enum Event {
        DISPATCH,
        SUCCEED,
        FAIL,
        REJECT
    }

    /**
     * Result of a state transition attempt
     */
    public static class TransitionResult {
        private final State newState;
        private final boolean valid;
        private final String errorMessage;

        private TransitionResult(State newState, boolean valid, String errorMessage) {
            this.newState = newState;
            this.valid = valid;
            this.errorMessage = errorMessage;
        }

        public static TransitionResult success(State newState) {
            return new TransitionResult(newState, true, null);
        }

        public static TransitionResult failure(String errorMessage) {
            return new TransitionResult(null, false, errorMessage);
        }

        public State getNewState() {
            return newState;
        }

        public boolean isValid() {
            return valid;
        }

        public String getErrorMessage() {
            return errorMessage;
        }
    }

    public TransitionResult transition(State currentState, Event event) {
        log.debug("Envelope transition: {} + {}", currentState, event);

        if (currentState == null || event == null) {
            return TransitionResult.failure("State and event are required");
        }
        if (currentState.isTerminal()) {
            return TransitionResult.failure(
                    String.format("%s is terminal, cannot apply %s", currentState, event));
        }

        if (currentState == State.RECEIVED) {
            if (event == Event.DISPATCH) {
                return TransitionResult.success(State.DISPATCHING);
            }
            if (event == Event.REJECT) {
                return TransitionResult.success(State.REJECTED);
            }
            return TransitionResult.failure(
                    String.format("Only DISPATCH or REJECT allowed on a RECEIVED envelope. Received: %s", event));
        }

        // DISPATCHING
        switch (event) {
            case SUCCEED:
                return TransitionResult.success(State.APPLIED);
            case FAIL:
                return TransitionResult.success(State.FAILED);
            case REJECT:
                return TransitionResult.success(State.REJECTED);
            default:
                return TransitionResult.failure("Envelope is already being dispatched");
        }
    }

    /**
     * Applies the transition or fails loudly; the relay only drives valid paths.
     */
    public State advance(State currentState, Event event) {
        TransitionResult result = transition(currentState, event);
        if (!result.isValid()) {
            throw new IllegalStateException(result.getErrorMessage());
        }
        return result.getNewState();
    }
}
