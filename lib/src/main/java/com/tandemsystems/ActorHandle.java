package com.tandemsystems;

import com.tandemsystems.mailbox.Mailbox;
import com.tandemsystems.synthesis.CallForm;
import com.tandemsystems.synthesis.HandleDefinition;
import com.tandemsystems.synthesis.OperationDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The caller's view of a running actor. Operations are addressed by their derived names:
 * {@code handle.call("msg_one", message)} waits for the reply, {@code handle.call("msg_one_no_wait", message)}
 * returns once the call is enqueued.
 *
 * <p>Handles are safe to use from many threads. {@link #share()} returns another handle to the same
 * actor; the mailbox closes when the last open handle is closed, after which the worker processes
 * what is queued and ends.
 *
 * <p>A call never throws for a call-time condition: failures come back inside the {@link Result}.
 *
 * @param <M> The type of messages the actor accepts
 */
public final class ActorHandle<M> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ActorHandle.class);

    private final String actorId;
    private final HandleDefinition definition;
    private final Mailbox<Call<M>> mailbox;
    private final VariantResolver<M> variantResolver;
    private final Map<String, Class<?>> replyTypes;
    private final ActorWorker<M> worker;
    private final long sendRetryMillis;
    private final AtomicInteger openHandles;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ActorHandle(String actorId,
                HandleDefinition definition,
                Mailbox<Call<M>> mailbox,
                VariantResolver<M> variantResolver,
                Map<String, Class<?>> replyTypes,
                ActorWorker<M> worker,
                long sendRetryMillis) {
        this(actorId, definition, mailbox, variantResolver, replyTypes, worker, sendRetryMillis, new AtomicInteger(1));
    }

    private ActorHandle(String actorId,
                        HandleDefinition definition,
                        Mailbox<Call<M>> mailbox,
                        VariantResolver<M> variantResolver,
                        Map<String, Class<?>> replyTypes,
                        ActorWorker<M> worker,
                        long sendRetryMillis,
                        AtomicInteger openHandles) {
        this.actorId = actorId;
        this.definition = definition;
        this.mailbox = mailbox;
        this.variantResolver = variantResolver;
        this.replyTypes = replyTypes;
        this.worker = worker;
        this.sendRetryMillis = sendRetryMillis;
        this.openHandles = openHandles;
    }

    /**
     * Sends the message through the named operation and blocks until it completes.
     * For a no-wait operation this returns as soon as the call is enqueued, with a null value.
     *
     * @param operation the operation name
     * @param message   the message, which must be of the operation's variant
     * @param <T>       the reply type of the operation
     * @return the reply, or the failure
     */
    public <T> Result<T> call(String operation, M message) {
        return this.<T>callAsync(operation, message).await();
    }

    /**
     * Sends the message through the named operation without blocking for the reply.
     * Validation and enqueueing happen before this method returns.
     *
     * @param operationName the operation name
     * @param message       the message, which must be of the operation's variant
     * @param <T>           the reply type of the operation
     * @return the pending reply; already completed for no-wait operations and for failures
     */
    public <T> Reply<T> callAsync(String operationName, M message) {
        Optional<OperationDefinition> found = definition.operation(operationName);
        if (found.isEmpty()) {
            return Reply.failed(new OperationException(OperationError.UNKNOWN_OPERATION,
                    definition.name() + " has no operation " + operationName));
        }
        OperationDefinition operation = found.get();

        if (message == null) {
            return Reply.failed(new OperationException(OperationError.WRONG_VARIANT,
                    operationName + " expects " + operation.variantName() + " but got null"));
        }
        String variant = variantResolver.variantOf(message);
        if (!operation.variantName().equals(variant)) {
            return Reply.failed(new OperationException(OperationError.WRONG_VARIANT,
                    operationName + " expects " + operation.variantName() + " but got " + variant));
        }

        if (closed.get()) {
            return Reply.failed(new OperationException(OperationError.SEND_FAILED,
                    "Handle to " + actorId + " is closed"));
        }

        if (operation.form() == CallForm.WAIT) {
            ResponseSlot<Object> slot = new ResponseSlot<>(replyTypes.getOrDefault(operationName, Object.class));
            if (!enqueue(new Call.Wait<>(operationName, message, slot))) {
                return sendFailed(operationName);
            }
            return slot.reply();
        }
        if (!enqueue(new Call.Fire<>(operationName, message))) {
            return sendFailed(operationName);
        }
        return Reply.completed(null);
    }

    private boolean enqueue(Call<M> call) {
        if (mailbox.offer(call)) {
            return true;
        }
        // full bounded mailbox: wait for space while the actor is still accepting calls
        try {
            while (!mailbox.isClosed()) {
                if (mailbox.offer(call, sendRetryMillis, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            logger.debug("Interrupted while sending {} to actor {}", call.operation(), actorId);
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private <T> Reply<T> sendFailed(String operationName) {
        logger.debug("Send of {} to actor {} failed: mailbox closed", operationName, actorId);
        return Reply.failed(new OperationException(OperationError.SEND_FAILED,
                "Actor " + actorId + " is not accepting calls"));
    }

    /**
     * Returns a new handle to the same actor. The actor keeps accepting calls until every handle is closed.
     *
     * @throws IllegalStateException if this handle is closed
     */
    public ActorHandle<M> share() {
        if (closed.get() || openHandles.getAndUpdate(count -> count == 0 ? 0 : count + 1) == 0) {
            throw new IllegalStateException("Handle to " + actorId + " is closed");
        }
        return new ActorHandle<>(actorId, definition, mailbox, variantResolver, replyTypes, worker, sendRetryMillis,
                openHandles);
    }

    /**
     * Closes this handle. Closing the last open handle closes the mailbox; calls already queued
     * are still processed. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && openHandles.decrementAndGet() == 0) {
            logger.debug("Last handle to actor {} closed", actorId);
            mailbox.close();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return true while the worker has not terminated
     */
    public boolean isAlive() {
        return worker.isAlive();
    }

    public String actorId() {
        return actorId;
    }

    public String name() {
        return definition.name();
    }

    public List<String> operations() {
        return definition.operationNames();
    }

    @Override
    public String toString() {
        return definition.name() + "[" + actorId + "]";
    }
}
