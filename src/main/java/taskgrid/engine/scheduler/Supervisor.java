package taskgrid.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskgrid.engine.config.EngineConfig;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@link TaskTimeoutReaper} periodically on a single daemon thread.
 * Nothing else in the engine depends on it being started.
 */
public class Supervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private final ScheduledExecutorService executor;
    private final TaskTimeoutReaper reaper;
    private final EngineConfig config;

    private volatile boolean running = false;

    public Supervisor(TaskTimeoutReaper reaper, EngineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "taskgrid-supervisor");
            t.setDaemon(true);
            return t;
        });
        this.reaper = reaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Supervisor already running");
            return;
        }
        running = true;

        long intervalMs = config.supervisorInterval().toMillis();
        executor.scheduleAtFixedRate(reaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Supervisor started, timeout check every {}ms", intervalMs);
    }

    /**
     * Stop the supervisor, waiting briefly for a running check to finish.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Supervisor forcefully stopped");
            } else {
                log.info("Supervisor stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public TaskTimeoutReaper reaper() {
        return reaper;
    }
}
