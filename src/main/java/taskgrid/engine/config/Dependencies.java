package taskgrid.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.event.EventBus;
import taskgrid.engine.event.EventNotifier;
import taskgrid.engine.event.LoggingEventNotifier;
import taskgrid.engine.scheduler.Supervisor;
import taskgrid.engine.scheduler.TaskTimeoutReaper;
import taskgrid.engine.service.TaskOrchestrator;
import taskgrid.engine.worker.InMemoryWorkerPool;
import taskgrid.engine.worker.WorkerPool;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires the engine components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.workers().register(Worker.of("w1", "java"));
 * deps.orchestrator().addTask(task);
 * deps.startSupervisor(); // optional timeout checks
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Clock clock;
    private final EventBus eventBus;
    private final WorkerPool workerPool;
    private final TaskOrchestrator orchestrator;

    // Supervisor (lazy-initialized)
    private Supervisor supervisor;

    private Dependencies(EngineConfig config, WorkerPool workerPool, EventNotifier notifier, Clock clock) {
        this.config = config.validate();
        this.clock = clock;

        log.info("Initializing engine with config: {}", config);

        // Events: everything goes through the bus, the log sink is always subscribed
        this.eventBus = new EventBus();
        eventBus.subscribe(new LoggingEventNotifier());
        if (notifier != null) {
            eventBus.subscribe(notifier);
        }

        this.workerPool = workerPool;

        // The orchestrator owns the state machine, dependency graph and scheduler
        this.orchestrator = new TaskOrchestrator(this.config, workerPool, eventBus, clock);

        log.info("Engine initialized");
    }

    /**
     * Create the engine with an in-memory worker registry and the system clock.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, new InMemoryWorkerPool(), null, Clock.systemUTC());
    }

    /**
     * Create the engine with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    /**
     * Create the engine around host-provided collaborators.
     *
     * @param notifier extra subscriber for every event, may be null
     */
    public static Dependencies create(EngineConfig config, WorkerPool workerPool, EventNotifier notifier, Clock clock) {
        return new Dependencies(config, workerPool, notifier, clock);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    /**
     * The worker pool as the in-memory registry.
     *
     * @throws IllegalStateException if the engine was created around another pool
     */
    public InMemoryWorkerPool workers() {
        if (workerPool instanceof InMemoryWorkerPool registry) {
            return registry;
        }
        throw new IllegalStateException("Worker pool is " + workerPool.getClass().getSimpleName()
                + ", not the in-memory registry");
    }

    public TaskOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Get the supervisor (creates it if not yet created).
     */
    public synchronized Supervisor supervisor() {
        if (supervisor == null) {
            supervisor = new Supervisor(new TaskTimeoutReaper(orchestrator, config, clock), config);
        }
        return supervisor;
    }

    public void startSupervisor() {
        supervisor().start();
    }

    public synchronized void stopSupervisor() {
        if (supervisor != null) {
            supervisor.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing engine...");
        try {
            stopSupervisor();
        } catch (RuntimeException e) {
            log.warn("Error stopping supervisor: {}", e.getMessage());
        }
        log.info("Engine closed");
    }
}
