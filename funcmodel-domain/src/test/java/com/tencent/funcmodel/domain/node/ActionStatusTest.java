package com.tencent.funcmodel.domain.node;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionStatusTest {

    @Test
    void testTransitions() {
        assertTrue(ActionStatus.DRAFT.canTransitionTo(ActionStatus.ACTIVE));
        assertTrue(ActionStatus.ACTIVE.canTransitionTo(ActionStatus.EXECUTING));
        assertTrue(ActionStatus.FAILED.canTransitionTo(ActionStatus.RETRYING));
        assertTrue(ActionStatus.RETRYING.canTransitionTo(ActionStatus.EXECUTING));

        assertFalse(ActionStatus.DRAFT.canTransitionTo(ActionStatus.EXECUTING));
        assertFalse(ActionStatus.COMPLETED.canTransitionTo(ActionStatus.ACTIVE));
        assertTrue(ActionStatus.ARCHIVED.allowedTransitions().isEmpty());
        assertTrue(ActionStatus.ARCHIVED.isTerminal());
    }

    @Test
    void testNodeStatusMapping() {
        assertEquals(NodeStatus.ACTIVE, ActionStatus.EXECUTING.toNodeStatus());
        assertEquals(NodeStatus.ERROR, ActionStatus.FAILED.toNodeStatus());
        assertEquals(NodeStatus.CONFIGURED, ActionStatus.CONFIGURED.toNodeStatus());
        assertEquals(NodeStatus.ARCHIVED, ActionStatus.ARCHIVED.toNodeStatus());
    }

    @Test
    void testFromValue() {
        assertEquals(ActionStatus.RETRYING, ActionStatus.fromValue("Retrying").getValue());
        assertTrue(ActionStatus.fromValue("paused").isFailure());
    }
}
