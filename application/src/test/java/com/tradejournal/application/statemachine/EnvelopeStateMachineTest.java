package com.tradejournal.application.statemachine;

import com.tradejournal.application.statemachine.EnvelopeStateMachine.Event;
import com.tradejournal.application.statemachine.EnvelopeStateMachine.State;
import com.tradejournal.application.statemachine.EnvelopeStateMachine.TransitionResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeStateMachineTest {

    private final EnvelopeStateMachine stateMachine = new EnvelopeStateMachine();

    @Test
    void testSuccessPath() {
        State state = stateMachine.advance(State.RECEIVED, Event.DISPATCH);
        assertEquals(State.DISPATCHING, state);

        assertEquals(State.APPLIED, stateMachine.advance(state, Event.SUCCEED));
    }

    @Test
    void testFailurePath() {
        assertEquals(State.FAILED, stateMachine.advance(State.DISPATCHING, Event.FAIL));
    }

    @Test
    void testRejection_FromReceivedOrDispatching() {
        assertEquals(State.REJECTED, stateMachine.advance(State.RECEIVED, Event.REJECT));
        assertEquals(State.REJECTED, stateMachine.advance(State.DISPATCHING, Event.REJECT));
    }

    @Test
    void testReceived_CannotSucceedWithoutDispatch() {
        TransitionResult result = stateMachine.transition(State.RECEIVED, Event.SUCCEED);

        assertFalse(result.isValid());
        assertNull(result.getNewState());
        assertTrue(result.getErrorMessage().contains("SUCCEED"));
    }

    @Test
    void testTerminalStates_RejectFurtherEvents() {
        for (State terminal : new State[]{State.APPLIED, State.FAILED, State.REJECTED}) {
            assertTrue(terminal.isTerminal());
            for (Event event : Event.values()) {
                assertFalse(stateMachine.transition(terminal, event).isValid());
            }
        }
        assertThrows(IllegalStateException.class, () -> stateMachine.advance(State.APPLIED, Event.DISPATCH));
    }

    @Test
    void testDispatching_CannotDispatchTwice() {
        assertFalse(stateMachine.transition(State.DISPATCHING, Event.DISPATCH).isValid());
    }
}
