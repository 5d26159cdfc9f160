package com.tandemsystems;

import com.tandemsystems.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The consumer side of an actor. Polls the mailbox and hands each call to the processor,
 * one at a time, waiting for the handler's stage to complete before taking the next call.
 *
 * <p>The worker ends when the mailbox is closed and drained (every handle closed), when
 * {@link #stop()} is called, or when the handler fails under {@link SupervisionStrategy#STOP}.
 * Every wait-form call it accepted is resolved by then: replied to, or abandoned with
 * {@link OperationError#MAILBOX_CLOSED_OR_ABANDONED}.
 *
 * @param <M> The type of messages the processor handles
 */
final class ActorWorker<M> implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ActorWorker.class);

    private final String actorId;
    private final Mailbox<Call<M>> mailbox;
    private final Processor<M> processor;
    private final SupervisionStrategy supervisionStrategy;
    private final long pollTimeoutMillis;
    private final Consumer<String> terminationCallback;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile boolean running = true;
    private volatile Thread thread;

    ActorWorker(String actorId,
                Mailbox<Call<M>> mailbox,
                Processor<M> processor,
                SupervisionStrategy supervisionStrategy,
                long pollTimeoutMillis,
                Consumer<String> terminationCallback) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.processor = processor;
        this.supervisionStrategy = supervisionStrategy;
        this.pollTimeoutMillis = pollTimeoutMillis;
        this.terminationCallback = terminationCallback;
    }

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        thread = Thread.currentThread();
        if (!running) {
            logger.debug("Actor {} stopped before it started", actorId);
            terminate(false);
            return;
        }
        logger.info("Starting actor {}", actorId);
        try {
            processor.preStart();
            processMailboxLoop();
        } catch (Throwable e) {
            logger.error("Actor {} failed to start", actorId, e);
        } finally {
            terminate(true);
        }
    }

    /**
     * Terminates a worker the executor never ran, resolving its queued calls.
     *
     * @return true if the worker had not started
     */
    boolean terminateIfNotStarted() {
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        running = false;
        terminate(false);
        return true;
    }

    private void processMailboxLoop() {
        while (running && !mailbox.isDrained()) {
            Call<M> call;
            try {
                call = mailbox.poll(pollTimeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                logger.debug("Actor {} mailbox interrupted", actorId);
                break;
            }
            if (call == null) {
                continue;
            }
            try {
                dispatch(call);
            } catch (InterruptedException e) {
                logger.debug("Actor {} interrupted while handling {}", actorId, call.operation());
                break;
            }
        }
    }

    private void dispatch(Call<M> call) throws InterruptedException {
        logger.debug("Actor {} handling {}", actorId, call.operation());
        Throwable failure = null;
        try {
            CompletionStage<?> stage = processor.process(call);
            if (stage != null) {
                stage.toCompletableFuture().get();
            }
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
        } catch (InterruptedException e) {
            abandon(call, "Actor " + actorId + " stopped while handling " + call.operation());
            throw e;
        } catch (Throwable e) {
            failure = e;
        }

        if (failure == null) {
            abandon(call, "Handler of " + call.operation() + " completed without replying");
        } else {
            abandon(call, "Handler of " + call.operation() + " failed: " + failure);
            handleFailure(call, failure);
        }
    }

    private void handleFailure(Call<M> call, Throwable failure) {
        logger.error("Actor {} error processing {}: {}", actorId, call.operation(), call.message(), failure);
        if (supervisionStrategy == SupervisionStrategy.STOP) {
            logger.info("Actor {} stopping after handler failure", actorId);
            running = false;
            mailbox.close();
        }
    }

    private void abandon(Call<M> call, String reason) {
        call.resp().ifPresent(slot -> {
            if (slot.abandon(reason)) {
                logger.debug("Actor {} abandoned reply: {}", actorId, reason);
            }
        });
    }

    private void terminate(boolean processorStarted) {
        running = false;
        mailbox.close();
        int abandoned = 0;
        while (!mailbox.isDrained()) {
            Call<M> call = mailbox.poll();
            if (call == null) {
                Thread.onSpinWait();
                continue;
            }
            abandon(call, "Actor " + actorId + " stopped before handling " + call.operation());
            abandoned++;
        }
        if (abandoned > 0) {
            logger.debug("Actor {} dropped {} queued calls", actorId, abandoned);
        }
        if (processorStarted) {
            try {
                processor.postStop();
            } catch (RuntimeException e) {
                logger.error("Actor {} postStop failed", actorId, e);
            }
        }
        thread = null;
        terminated.countDown();
        logger.info("Actor {} terminated", actorId);
        terminationCallback.accept(actorId);
    }

    /**
     * Stops the worker. Queued calls are abandoned and the call being handled, if any, is interrupted.
     */
    void stop() {
        if (!running) {
            return;
        }
        running = false;
        logger.debug("Stopping actor {}", actorId);
        mailbox.close();
        Thread current = thread;
        if (current != null && current != Thread.currentThread()) {
            current.interrupt();
        }
    }

    /**
     * Waits for the worker to finish.
     *
     * @return true if it finished within the timeout
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean isAlive() {
        return terminated.getCount() > 0;
    }

    String actorId() {
        return actorId;
    }
}
