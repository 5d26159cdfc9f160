package com.tandemsystems.synthesis;

import java.util.Objects;

/**
 * Everything synthesized for one processor: the handle, the worker and the mailbox between them.
 * A blueprint is pure data; {@link com.tandemsystems.ActorRuntime} turns it into a running actor and
 * {@link ActorSourceRenderer} turns it into Java source.
 */
public record ActorBlueprint(String processorName,
                             String messageTypeName,
                             MailboxWiring mailbox,
                             WorkerDefinition worker,
                             HandleDefinition handle) {

    public ActorBlueprint {
        Objects.requireNonNull(processorName, "processorName cannot be null");
        Objects.requireNonNull(messageTypeName, "messageTypeName cannot be null");
        Objects.requireNonNull(mailbox, "mailbox cannot be null");
        Objects.requireNonNull(worker, "worker cannot be null");
        Objects.requireNonNull(handle, "handle cannot be null");
    }
}
