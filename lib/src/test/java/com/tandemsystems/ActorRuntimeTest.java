package com.tandemsystems;

import com.tandemsystems.CalcActor.CalcProcessor;
import com.tandemsystems.CalcActor.CalcProcessorMsg;
import com.tandemsystems.CalcActor.MsgOne;
import com.tandemsystems.config.ThreadPoolFactory;
import com.tandemsystems.mailbox.config.MailboxConfig;
import com.tandemsystems.synthesis.ActorBlueprint;
import com.tandemsystems.test.AsyncAssertion;
import com.tandemsystems.test.HandlerGate;
import com.tandemsystems.test.MessageCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ActorRuntimeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ActorRuntime runtime;
    private ActorBlueprint blueprint;

    @BeforeEach
    void setUp() {
        runtime = new ActorRuntime();
        blueprint = CalcActor.blueprint();
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.shutdown();
        }
        runtime = null;
    }

    /**
     * Fails every MsgOne with a value below zero, replies with the value otherwise.
     */
    static class FailingProcessor implements Processor<CalcProcessorMsg> {
        @Override
        public CompletionStage<?> process(Call<CalcProcessorMsg> call) {
            int value = ((MsgOne) call.message()).value();
            if (value < 0) {
                throw new IllegalArgumentException("negative: " + value);
            }
            call.reply(value);
            return CompletableFuture.completedFuture(null);
        }
    }

    @Test
    void testSpawnRegistersActor() {
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new)
                .withId("calc-1")
                .spawn();

        assertEquals(Set.of("calc-1"), runtime.actorIds());
        assertTrue(runtime.isAlive("calc-1"));
        assertFalse(runtime.isAlive("missing"));
        calc.close();
    }

    @Test
    void testDuplicateIdIsRejected() {
        runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new).withId("calc").spawn();

        assertThrows(IllegalStateException.class, () ->
                runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new).withId("calc").spawn());
    }

    @Test
    void testMessageTypeMustMatchBlueprint() {
        assertThrows(IllegalArgumentException.class, () ->
                runtime.actorOf(blueprint, String.class, () -> call -> CompletableFuture.completedFuture(null)));
    }

    @Test
    void testActorDeregistersWhenLastHandleCloses() {
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new)
                .withId("calc")
                .spawn();

        calc.close();

        AsyncAssertion.eventually(() -> runtime.actorIds().isEmpty(), TIMEOUT);
        assertFalse(runtime.isAlive("calc"));
    }

    @Test
    void testIdCanBeReusedAfterTermination() throws InterruptedException {
        ActorHandle<CalcProcessorMsg> first = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new)
                .withId("calc")
                .spawn();
        assertTrue(runtime.stopAndWait("calc", TIMEOUT));
        AsyncAssertion.eventually(() -> !runtime.actorIds().contains("calc"), TIMEOUT);

        ActorHandle<CalcProcessorMsg> second = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new)
                .withId("calc")
                .spawn();

        assertEquals(Result.success(101), second.call("msg_one", new MsgOne(1)));
        first.close();
        second.close();
    }

    @Test
    void testStopAbandonsQueuedCallsAndRejectsNewOnes() throws InterruptedException {
        HandlerGate gate = new HandlerGate();
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, () -> call -> {
            gate.pass();
            call.reply(1);
            return CompletableFuture.completedFuture(null);
        }).withId("calc").spawn();

        Reply<Integer> inFlight = calc.callAsync("msg_one", new MsgOne(1));
        assertTrue(gate.awaitEntered(TIMEOUT));
        Reply<Integer> queued = calc.callAsync("msg_one", new MsgOne(2));

        assertTrue(runtime.stopAndWait("calc", TIMEOUT));

        assertTrue(inFlight.await().isSuccess() || inFlight.await().error().isPresent());
        assertEquals(OperationError.MAILBOX_CLOSED_OR_ABANDONED, queued.await().error().orElseThrow());
        assertEquals(OperationError.SEND_FAILED, calc.call("msg_one", new MsgOne(3)).error().orElseThrow());
        assertFalse(calc.isAlive());
    }

    @Test
    void testStopOfUnknownActor() throws InterruptedException {
        assertFalse(runtime.stop("missing"));
        assertTrue(runtime.stopAndWait("missing", TIMEOUT));
    }

    @Test
    void testStopSupervisionEndsWorkerOnHandlerFailure() {
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, FailingProcessor::new)
                .withId("failing")
                .spawn();

        Result<Integer> failed = calc.call("msg_one", new MsgOne(-1));

        assertEquals(OperationError.MAILBOX_CLOSED_OR_ABANDONED, failed.error().orElseThrow());
        AsyncAssertion.eventually(() -> !calc.isAlive(), TIMEOUT);
        assertEquals(OperationError.SEND_FAILED, calc.call("msg_one", new MsgOne(1)).error().orElseThrow());
    }

    @Test
    void testResumeSupervisionKeepsWorkerRunning() {
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, FailingProcessor::new)
                .withSupervisionStrategy(SupervisionStrategy.RESUME)
                .spawn();

        Result<Integer> failed = calc.call("msg_one", new MsgOne(-1));
        Result<Integer> next = calc.call("msg_one", new MsgOne(4));

        assertEquals(OperationError.MAILBOX_CLOSED_OR_ABANDONED, failed.error().orElseThrow());
        assertEquals(Result.success(4), next);
        assertTrue(calc.isAlive());
        calc.close();
    }

    @Test
    void testExceptionallyCompletedStageCountsAsFailure() {
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class,
                () -> call -> CompletableFuture.failedFuture(new IllegalStateException("boom"))).spawn();

        Result<Integer> result = calc.call("msg_one", new MsgOne(1));

        assertEquals(OperationError.MAILBOX_CLOSED_OR_ABANDONED, result.error().orElseThrow());
        AsyncAssertion.eventually(() -> !calc.isAlive(), TIMEOUT);
    }

    @Test
    void testLifecycleHooksRunOnWorkerThread() {
        MessageCapture<String> events = MessageCapture.create();
        AtomicReference<String> workerThread = new AtomicReference<>();
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, () -> new Processor<CalcProcessorMsg>() {
            @Override
            public CompletionStage<?> process(Call<CalcProcessorMsg> call) {
                events.accept("process");
                call.reply(0);
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public void preStart() {
                workerThread.set(Thread.currentThread().getName());
                events.accept("preStart");
            }

            @Override
            public void postStop() {
                events.accept("postStop");
            }
        }).spawn();

        calc.call("msg_one", new MsgOne(1));
        calc.close();

        AsyncAssertion.eventually(() -> events.size() == 3, TIMEOUT);
        assertEquals(List.of("preStart", "process", "postStop"), events.all());
        assertTrue(workerThread.get().startsWith("tandem-actor-"));
    }

    @Test
    void testBoundedMailboxMakesSendersWait() throws InterruptedException {
        HandlerGate gate = new HandlerGate();
        MessageCapture<Integer> seen = MessageCapture.create();
        MailboxConfig bounded = new MailboxConfig().setBounded(true).setMaxCapacity(2).setInitialCapacity(2);
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, () -> call -> {
            int value = ((MsgOne) call.message()).value();
            if (value == 0) {
                gate.pass();
            }
            seen.accept(value);
            return CompletableFuture.completedFuture(null);
        }).withMailboxConfig(bounded).spawn();

        calc.call("msg_one_no_wait", new MsgOne(0));
        assertTrue(gate.awaitEntered(TIMEOUT));
        calc.call("msg_one_no_wait", new MsgOne(1));
        calc.call("msg_one_no_wait", new MsgOne(2));

        CompletableFuture<Result<Void>> blocked = CompletableFuture.supplyAsync(
                () -> calc.call("msg_one_no_wait", new MsgOne(3)));
        Thread.sleep(100);
        assertFalse(blocked.isDone());

        gate.open();
        assertTrue(blocked.join().isSuccess());
        assertTrue(seen.awaitCount(4, TIMEOUT));
        assertEquals(List.of(0, 1, 2, 3), seen.all());
        calc.close();
    }

    @Test
    void testBlockedSenderFailsWhenActorStops() throws InterruptedException {
        HandlerGate gate = new HandlerGate();
        MailboxConfig bounded = new MailboxConfig().setBounded(true).setMaxCapacity(1).setInitialCapacity(1);
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, () -> call -> {
            gate.pass();
            return CompletableFuture.completedFuture(null);
        }).withId("bounded").withMailboxConfig(bounded).spawn();

        calc.call("msg_one_no_wait", new MsgOne(0));
        assertTrue(gate.awaitEntered(TIMEOUT));
        calc.call("msg_one_no_wait", new MsgOne(1));
        CompletableFuture<Result<Void>> blocked = CompletableFuture.supplyAsync(
                () -> calc.call("msg_one_no_wait", new MsgOne(2)));

        runtime.stop("bounded");
        gate.open();

        assertEquals(OperationError.SEND_FAILED, blocked.join().error().orElseThrow());
    }

    @Test
    void testShutdownStopsEveryActor() {
        ActorHandle<CalcProcessorMsg> first = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new).spawn();
        ActorHandle<CalcProcessorMsg> second = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new).spawn();

        runtime.shutdown();

        assertTrue(runtime.isShutdown());
        assertFalse(first.isAlive());
        assertFalse(second.isAlive());
        assertEquals(OperationError.SEND_FAILED, first.call("msg_one", new MsgOne(1)).error().orElseThrow());
        assertThrows(IllegalStateException.class, () ->
                runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new).spawn());
    }

    @Test
    void testShutdownResolvesCallsOfActorsThatNeverRan() throws Exception {
        runtime.shutdown();
        runtime = new ActorRuntime(new ThreadPoolFactory()
                .setExecutorType(ThreadPoolFactory.ThreadPoolType.FIXED)
                .setFixedPoolSize(1)
                .setShutdownTimeoutSeconds(2));
        HandlerGate gate = new HandlerGate();
        ActorHandle<CalcProcessorMsg> busy = runtime.actorOf(blueprint, CalcProcessorMsg.class, () -> call -> {
            gate.pass();
            return CompletableFuture.completedFuture(null);
        }).spawn();
        busy.call("msg_one_no_wait", new MsgOne(0));
        assertTrue(gate.awaitEntered(TIMEOUT));

        ActorHandle<CalcProcessorMsg> waiting = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new).spawn();
        Reply<Integer> pending = waiting.callAsync("msg_one", new MsgOne(1));

        runtime.shutdown();

        assertEquals(OperationError.MAILBOX_CLOSED_OR_ABANDONED, pending.await(TIMEOUT).error().orElseThrow());
        assertFalse(waiting.isAlive());
    }

    @Test
    void testDefaultIdsUseProcessorName() {
        ActorHandle<CalcProcessorMsg> calc = runtime.actorOf(blueprint, CalcProcessorMsg.class, CalcProcessor::new).spawn();

        assertTrue(calc.actorId().startsWith("CalcProcessor:"));
        calc.close();
    }
}
