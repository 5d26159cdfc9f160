package com.tandemsystems;

import java.util.concurrent.CompletionStage;

/**
 * The state owner of an actor. Exactly one worker thread ever touches a processor instance,
 * so implementations need no synchronization of their own.
 *
 * <p>{@link #process(Call)} is invoked once per call, strictly in mailbox order; the next call is
 * taken only after the returned stage completes. A wait-form call must be answered with
 * {@link Call#reply(Object)} before the stage completes, otherwise the caller receives
 * {@link OperationError#MAILBOX_CLOSED_OR_ABANDONED}. Replying with a value that is not of the
 * operation's reply type throws {@link ClassCastException} inside the handler.
 *
 * @param <M> the message type
 */
@FunctionalInterface
public interface Processor<M> {

    CompletionStage<?> process(Call<M> call);

    /**
     * Called on the worker thread before the first call is processed.
     */
    default void preStart() {
    }

    /**
     * Called on the worker thread after the last call was processed.
     */
    default void postStop() {
    }
}
