package com.tandemsystems;

import com.tandemsystems.builder.ActorBuilder;
import com.tandemsystems.config.ThreadPoolFactory;
import com.tandemsystems.mailbox.Mailbox;
import com.tandemsystems.mailbox.config.DefaultMailboxProvider;
import com.tandemsystems.mailbox.config.MailboxConfig;
import com.tandemsystems.mailbox.config.MailboxProvider;
import com.tandemsystems.synthesis.ActorBlueprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs synthesized actors. Owns the executor the workers run on and a registry of live actors by id.
 *
 * <p>Typical use:
 * <pre>{@code
 * ActorBlueprint blueprint = new ActorGenerator().generate(declarations);
 * try (ActorRuntime runtime = new ActorRuntime()) {
 *     ActorHandle<CalcMsg> calc = runtime.actorOf(blueprint, CalcMsg.class, CalcProcessor::new).spawn();
 *     Result<Integer> sum = calc.call("add", new CalcMsg.Add(1, 2));
 * }
 * }</pre>
 */
public class ActorRuntime implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ActorRuntime.class);

    private final ThreadPoolFactory threadPoolFactory;
    private final MailboxConfig mailboxConfig;
    private final MailboxProvider<?> mailboxProvider;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, ActorWorker<?>> workers = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    /**
     * Creates a new ActorRuntime with the default configuration.
     */
    public ActorRuntime() {
        this(new ThreadPoolFactory(), new MailboxConfig(), new DefaultMailboxProvider<>());
    }

    /**
     * Creates a new ActorRuntime with the specified thread pool configuration.
     *
     * @param threadPoolFactory The thread pool configuration
     */
    public ActorRuntime(ThreadPoolFactory threadPoolFactory) {
        this(threadPoolFactory, new MailboxConfig(), new DefaultMailboxProvider<>());
    }

    /**
     * Creates a new ActorRuntime with the specified thread pool and default mailbox configuration.
     *
     * @param threadPoolFactory The thread pool configuration
     * @param mailboxConfig     The mailbox configuration used when an actor does not set its own
     */
    public ActorRuntime(ThreadPoolFactory threadPoolFactory, MailboxConfig mailboxConfig) {
        this(threadPoolFactory, mailboxConfig, new DefaultMailboxProvider<>());
    }

    /**
     * Primary constructor for ActorRuntime.
     *
     * @param threadPoolFactory The thread pool configuration
     * @param mailboxConfig     The mailbox configuration used when an actor does not set its own
     * @param mailboxProvider   The mailbox provider implementation
     */
    public ActorRuntime(ThreadPoolFactory threadPoolFactory,
                        MailboxConfig mailboxConfig,
                        MailboxProvider<?> mailboxProvider) {
        this.threadPoolFactory = threadPoolFactory != null ? threadPoolFactory : new ThreadPoolFactory();
        this.mailboxConfig = mailboxConfig != null ? mailboxConfig : new MailboxConfig();
        this.mailboxProvider = mailboxProvider != null ? mailboxProvider : new DefaultMailboxProvider<>();
        this.executor = this.threadPoolFactory.createExecutorService("actor");
        logger.debug("ActorRuntime created, thread pool type: {}, mailbox: {}",
                this.threadPoolFactory.getExecutorType(), this.mailboxConfig);
    }

    /**
     * Starts building an actor from a blueprint.
     *
     * @param blueprint        the synthesized actor
     * @param messageType      the runtime class of the blueprint's message type
     * @param processorFactory creates the processor the worker will own
     * @throws IllegalArgumentException if the message type does not match the blueprint
     */
    public <M> ActorBuilder<M> actorOf(ActorBlueprint blueprint,
                                       Class<M> messageType,
                                       Supplier<? extends Processor<M>> processorFactory) {
        Objects.requireNonNull(blueprint, "blueprint cannot be null");
        Objects.requireNonNull(messageType, "messageType cannot be null");
        Objects.requireNonNull(processorFactory, "processorFactory cannot be null");
        if (!namesMessageType(blueprint.messageTypeName(), messageType)) {
            throw new IllegalArgumentException("Blueprint " + blueprint.handle().name() + " expects "
                    + blueprint.messageTypeName() + " but got " + messageType.getName());
        }
        return new ActorBuilder<>(this, blueprint, processorFactory);
    }

    // blueprints read from classes carry the canonical name, hand-written ones may carry the simple name
    private static boolean namesMessageType(String messageTypeName, Class<?> messageType) {
        return messageTypeName.indexOf('.') < 0
                ? messageTypeName.equals(messageType.getSimpleName())
                : messageTypeName.equals(messageType.getCanonicalName());
    }

    /**
     * Creates the mailbox, registers and schedules the worker, and returns the first handle.
     * Does not wait for the worker to start. Called by {@link ActorBuilder#spawn()}.
     *
     * @throws IllegalStateException if the id is taken or the runtime is shut down
     */
    public <M> ActorHandle<M> spawn(ActorBlueprint blueprint,
                                    String actorId,
                                    Processor<M> processor,
                                    MailboxConfig actorMailboxConfig,
                                    VariantResolver<M> variantResolver,
                                    SupervisionStrategy supervisionStrategy) {
        if (shutdown) {
            throw new IllegalStateException("ActorRuntime is shut down");
        }
        Objects.requireNonNull(processor, "processor cannot be null");
        Map<String, Class<?>> replyTypes = ReplyTypes.resolve(blueprint.handle(), processor.getClass().getClassLoader());
        MailboxConfig config = actorMailboxConfig != null ? actorMailboxConfig : mailboxConfig;
        MailboxProvider<Call<M>> provider = getMailboxProvider();
        Mailbox<Call<M>> mailbox = provider.createMailbox(config);

        ActorWorker<M> worker = new ActorWorker<>(actorId, mailbox, processor, supervisionStrategy,
                config.getPollTimeoutMillis(), this::deregister);
        if (workers.putIfAbsent(actorId, worker) != null) {
            throw new IllegalStateException("Actor with ID " + actorId + " already exists");
        }
        try {
            executor.execute(worker);
        } catch (RejectedExecutionException e) {
            workers.remove(actorId, worker);
            throw new IllegalStateException("Cannot schedule actor " + actorId, e);
        }
        logger.debug("Spawned actor {} ({}) with {}", actorId, blueprint.handle().name(), config);
        return new ActorHandle<>(actorId, blueprint.handle(), mailbox, variantResolver, replyTypes, worker,
                config.getPollTimeoutMillis());
    }

    /**
     * Stops an actor. Queued calls are abandoned and later calls fail with {@link OperationError#SEND_FAILED}.
     *
     * @param actorId the actor to stop
     * @return true if the actor was registered
     */
    public boolean stop(String actorId) {
        ActorWorker<?> worker = workers.get(actorId);
        if (worker == null) {
            return false;
        }
        worker.stop();
        return true;
    }

    /**
     * Stops an actor and waits for its worker to finish.
     *
     * @return true if the worker finished within the timeout, or was not registered
     */
    public boolean stopAndWait(String actorId, Duration timeout) throws InterruptedException {
        ActorWorker<?> worker = workers.get(actorId);
        if (worker == null) {
            return true;
        }
        worker.stop();
        return worker.awaitTermination(timeout);
    }

    public boolean isAlive(String actorId) {
        ActorWorker<?> worker = workers.get(actorId);
        return worker != null && worker.isAlive();
    }

    public Set<String> actorIds() {
        return Set.copyOf(workers.keySet());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    /**
     * Gets the mailbox provider for this runtime with a specific type parameter.
     * The unchecked cast is safe because providers are stateless factories.
     */
    @SuppressWarnings("unchecked")
    public <T> MailboxProvider<T> getMailboxProvider() {
        return (MailboxProvider<T>) mailboxProvider;
    }

    private void deregister(String actorId) {
        workers.computeIfPresent(actorId, (id, worker) -> worker.isAlive() ? worker : null);
        logger.debug("Actor {} deregistered", actorId);
    }

    /**
     * Stops every actor and the executor. Idempotent.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down all actors in the runtime");

        List<ActorWorker<?>> running = new ArrayList<>(workers.values());
        running.forEach(ActorWorker::stop);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(threadPoolFactory.getShutdownTimeoutSeconds());
        try {
            for (ActorWorker<?> worker : running) {
                long remaining = deadline - System.nanoTime();
                if (!worker.awaitTermination(Duration.ofNanos(Math.max(remaining, 0)))) {
                    logger.warn("Actor {} did not terminate within timeout", worker.actorId());
                }
            }
            executor.shutdown();
            if (!executor.awaitTermination(Math.max(deadline - System.nanoTime(), 0), TimeUnit.NANOSECONDS)) {
                logger.warn("Executor did not terminate within timeout, forcing shutdown");
                executor.shutdownNow();
            }
            for (ActorWorker<?> worker : running) {
                if (worker.terminateIfNotStarted()) {
                    logger.debug("Actor {} was never scheduled", worker.actorId());
                }
            }
            logger.info("Actor runtime shut down successfully");
        } catch (InterruptedException e) {
            logger.error("Actor runtime shutdown was interrupted", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
