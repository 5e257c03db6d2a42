package com.prospect.leadengine.qualify.daemon;

import com.prospect.leadengine.config.LeadEngineProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Start/stop lifecycle for a background task that runs on one named daemon thread with a fixed delay between
 * cycles. The first cycle runs as soon as the daemon starts. A failing cycle is logged and the schedule goes on.
 */
public abstract class ScheduledDaemon {
    private final Logger log = LoggerFactory.getLogger(getClass());

    private final String name;
    private final Supplier<LeadEngineProperties.Daemon> settings;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService executor;

    protected ScheduledDaemon(String name, Supplier<LeadEngineProperties.Daemon> settings) {
        this.name = name;
        this.settings = settings;
    }

    /**
     * One unit of work. Only called while the daemon is running.
     */
    protected abstract void runOnce();

    @PostConstruct
    public void startIfEnabled() {
        if (settings.get().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            long intervalMinutes = settings.get().getPollIntervalMinutes();
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName(name);
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.scheduleWithFixedDelay(this::runCycle, 0, intervalMinutes, TimeUnit.MINUTES);
            log.info("{} started, interval {} min", name, intervalMinutes);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("{} stopped", name);
        }
    }

    public void runCycle() {
        if (!running.get()) {
            return;
        }
        try {
            runOnce();
        } catch (Exception e) {
            log.warn("{} cycle failed", name, e);
        }
    }
}
