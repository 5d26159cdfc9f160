package com.tandemsystems.builder;

import com.tandemsystems.ActorHandle;
import com.tandemsystems.ActorRuntime;
import com.tandemsystems.Processor;
import com.tandemsystems.SupervisionStrategy;
import com.tandemsystems.VariantResolver;
import com.tandemsystems.mailbox.config.MailboxConfig;
import com.tandemsystems.synthesis.ActorBlueprint;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Builder for spawning actors with a fluent API.
 *
 * @param <M> The type of messages this actor processes
 */
public class ActorBuilder<M> {

    private static final Map<String, AtomicLong> SEQUENCES = new ConcurrentHashMap<>();

    private final ActorRuntime runtime;
    private final ActorBlueprint blueprint;
    private final Supplier<? extends Processor<M>> processorFactory;
    private String id;
    private MailboxConfig mailboxConfig;
    private VariantResolver<M> variantResolver = VariantResolver.simpleClassName();
    private SupervisionStrategy supervisionStrategy = SupervisionStrategy.STOP;

    /**
     * Creates a new ActorBuilder.
     *
     * @param runtime          The runtime that will run the actor
     * @param blueprint        The synthesized actor
     * @param processorFactory Creates the processor instance
     */
    public ActorBuilder(ActorRuntime runtime, ActorBlueprint blueprint, Supplier<? extends Processor<M>> processorFactory) {
        this.runtime = Objects.requireNonNull(runtime, "runtime cannot be null");
        this.blueprint = Objects.requireNonNull(blueprint, "blueprint cannot be null");
        this.processorFactory = Objects.requireNonNull(processorFactory, "processorFactory cannot be null");
    }

    /**
     * Sets the ID for the actor. Defaults to {@code <processor name>:<sequence>}.
     *
     * @param id The ID for the actor
     * @return This builder for method chaining
     */
    public ActorBuilder<M> withId(String id) {
        this.id = id;
        return this;
    }

    /**
     * Sets the mailbox configuration for the actor. Defaults to the runtime's configuration.
     *
     * @param mailboxConfig The mailbox configuration
     * @return This builder for method chaining
     */
    public ActorBuilder<M> withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = mailboxConfig;
        return this;
    }

    /**
     * Sets how the handle reads the variant of a message. Defaults to the message's simple class name.
     *
     * @param variantResolver The variant resolver
     * @return This builder for method chaining
     */
    public ActorBuilder<M> withVariantResolver(VariantResolver<M> variantResolver) {
        this.variantResolver = Objects.requireNonNull(variantResolver, "variantResolver cannot be null");
        return this;
    }

    /**
     * Sets what the worker does when the handler fails. Defaults to {@link SupervisionStrategy#STOP}.
     *
     * @param supervisionStrategy The supervision strategy
     * @return This builder for method chaining
     */
    public ActorBuilder<M> withSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = Objects.requireNonNull(supervisionStrategy, "supervisionStrategy cannot be null");
        return this;
    }

    /**
     * Creates the processor, starts the worker and returns the first handle.
     *
     * @return The handle to the new actor
     * @throws IllegalStateException if the id is already in use or the runtime is shut down
     */
    public ActorHandle<M> spawn() {
        String actorId = id != null ? id : nextId(blueprint.processorName());
        Processor<M> processor = Objects.requireNonNull(processorFactory.get(), "processorFactory returned null");
        return runtime.spawn(blueprint, actorId, processor, mailboxConfig, variantResolver, supervisionStrategy);
    }

    private static String nextId(String processorName) {
        long seq = SEQUENCES.computeIfAbsent(processorName, name -> new AtomicLong()).incrementAndGet();
        return processorName + ":" + seq;
    }
}
