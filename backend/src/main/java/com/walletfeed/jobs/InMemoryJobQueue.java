package com.walletfeed.jobs;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single-process queue. Delayed jobs and the registry are lost on restart;
 * the startup bootstrap re-arms the wallet refresh.
 */
@Service
@ConditionalOnProperty(
        prefix = "walletfeed.jobs",
        name = "queue-mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobQueue.class);

    static final String MODE = "in_memory";

    private final BlockingQueue<JobMessage> queue = new LinkedBlockingQueue<>();
    private final Map<String, OffsetDateTime> registry = new ConcurrentHashMap<>();
    private final Object consumerMonitor = new Object();
    private final Clock clock;

    private volatile boolean running;
    private volatile JobConsumer consumer;
    private ScheduledExecutorService timer;
    private Thread dispatcherThread;

    public InMemoryJobQueue() {
        this(Clock.systemUTC());
    }

    InMemoryJobQueue(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        running = true;
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "walletfeed-job-timer");
            thread.setDaemon(true);
            return thread;
        });
        dispatcherThread = new Thread(this::dispatchLoop, "walletfeed-job-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stop() {
        running = false;
        synchronized (consumerMonitor) {
            consumerMonitor.notifyAll();
        }
        if (timer != null) {
            timer.shutdownNow();
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
    }

    @Override
    public void enqueue(JobMessage message) {
        requireRunning();
        queue.offer(Objects.requireNonNull(message, "message is required"));
    }

    @Override
    public void schedule(JobMessage message, OffsetDateTime runAt) {
        requireRunning();
        JobMessage requiredMessage = Objects.requireNonNull(message, "message is required");
        long delayMs = Math.max(0L, Duration.between(OffsetDateTime.now(clock), runAt).toMillis());
        if (delayMs == 0L) {
            queue.offer(requiredMessage);
            return;
        }
        timer.schedule(() -> queue.offer(requiredMessage), delayMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean scheduleIfAbsent(String registryKey, JobMessage message, OffsetDateTime runAt) {
        Objects.requireNonNull(runAt, "runAt is required");
        if (registry.putIfAbsent(requireKey(registryKey), runAt) != null) {
            return false;
        }
        schedule(message, runAt);
        return true;
    }

    @Override
    public boolean isScheduled(String registryKey) {
        return registry.containsKey(requireKey(registryKey));
    }

    @Override
    public Optional<OffsetDateTime> scheduledAt(String registryKey) {
        return Optional.ofNullable(registry.get(requireKey(registryKey)));
    }

    @Override
    public void release(String registryKey) {
        registry.remove(requireKey(registryKey));
    }

    @Override
    public void setConsumer(JobConsumer consumer) {
        synchronized (consumerMonitor) {
            this.consumer = Objects.requireNonNull(consumer, "consumer is required");
            consumerMonitor.notifyAll();
        }
    }

    @Override
    public String mode() {
        return MODE;
    }

    int pendingCount() {
        return queue.size();
    }

    private void dispatchLoop() {
        while (running) {
            try {
                JobMessage message = queue.take();
                JobConsumer queueConsumer = awaitConsumer();
                if (queueConsumer == null) {
                    return;
                }
                queueConsumer.accept(message);
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException ex) {
                log.error("Job consumer failed while dispatching queued message", ex);
            }
        }
    }

    private JobConsumer awaitConsumer() throws InterruptedException {
        synchronized (consumerMonitor) {
            while (running && consumer == null) {
                consumerMonitor.wait();
            }
            return consumer;
        }
    }

    private void requireRunning() {
        if (!running) {
            throw new IllegalStateException("Job queue is not running");
        }
    }

    static String requireKey(String registryKey) {
        if (registryKey == null || registryKey.isBlank()) {
            throw new IllegalArgumentException("registryKey is required");
        }
        return registryKey.trim();
    }
}
