package com.tandemsystems;

import java.util.Objects;
import java.util.Optional;

/**
 * One message in flight through a mailbox, tagged with how the caller wants to be answered.
 * A {@link Wait} call carries the response slot of a waiting caller; a {@link Fire} call carries none.
 *
 * @param <M> the message type
 */
public sealed interface Call<M> permits Call.Wait, Call.Fire {

    /**
     * @return the operation the call was made through
     */
    String operation();

    M message();

    /**
     * @return the response slot when the caller waits for a reply
     */
    Optional<ResponseSlot<Object>> resp();

    default boolean wantsReply() {
        return resp().isPresent();
    }

    /**
     * Sends the reply to the waiting caller. Does nothing for a no-wait call.
     *
     * @param value the reply
     * @return true if a waiting caller received it
     * @throws ClassCastException if the value is not of the operation's reply type
     */
    default boolean reply(Object value) {
        return resp().map(slot -> slot.send(value)).orElse(false);
    }

    record Wait<M>(String operation, M message, ResponseSlot<Object> slot) implements Call<M> {
        public Wait {
            Objects.requireNonNull(operation, "operation cannot be null");
            Objects.requireNonNull(message, "message cannot be null");
            Objects.requireNonNull(slot, "slot cannot be null");
        }

        @Override
        public Optional<ResponseSlot<Object>> resp() {
            return Optional.of(slot);
        }
    }

    record Fire<M>(String operation, M message) implements Call<M> {
        public Fire {
            Objects.requireNonNull(operation, "operation cannot be null");
            Objects.requireNonNull(message, "message cannot be null");
        }

        @Override
        public Optional<ResponseSlot<Object>> resp() {
            return Optional.empty();
        }
    }
}
