package com.tandemsystems;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallTest {

    @Test
    void testWaitCallFillsSlotOnce() {
        ResponseSlot<Object> slot = new ResponseSlot<>();
        Call<String> call = new Call.Wait<>("msg_one", "hello", slot);
        Reply<Integer> reply = slot.reply();

        assertTrue(call.wantsReply());
        assertTrue(call.reply(1));
        assertFalse(call.reply(2));
        assertTrue(slot.isResolved());
        assertEquals(Result.success(1), reply.await());
    }

    @Test
    void testFireCallIgnoresReply() {
        Call<String> call = new Call.Fire<>("msg_one_no_wait", "hello");

        assertFalse(call.wantsReply());
        assertTrue(call.resp().isEmpty());
        assertFalse(call.reply(1));
    }

    @Test
    void testAbandonFailsPendingSlotOnly() {
        ResponseSlot<Object> pending = new ResponseSlot<>();
        ResponseSlot<Object> answered = new ResponseSlot<>();
        answered.send("done");

        assertTrue(pending.abandon("gone"));
        assertFalse(answered.abandon("gone"));
        assertEquals(OperationError.MAILBOX_CLOSED_OR_ABANDONED, pending.reply().await().error().orElseThrow());
        assertEquals(Result.success("done"), answered.reply().await());
    }

    @Test
    void testSendAfterCallerCancelledIsNoOp() {
        ResponseSlot<Object> slot = new ResponseSlot<>();
        slot.reply().cancel();

        assertFalse(slot.send("late"));
    }

    @Test
    void testRejectsNullMessage() {
        assertThrows(NullPointerException.class, () -> new Call.Fire<String>("op", null));
    }
}
