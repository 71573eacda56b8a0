package com.walletfeed.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.walletfeed.config.WalletFeedProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed queue shared by every application instance.
 * <p>
 * Keys under the configured prefix:
 * <ul>
 *     <li>{@code :ready} list of messages due now</li>
 *     <li>{@code :delayed} sorted set of envelopes scored by due epoch millis</li>
 *     <li>{@code :registry:<name>} run time of a named pending job, written with {@code SET NX}</li>
 * </ul>
 * While Redis is unreachable every operation is routed to an in-memory
 * fallback and Redis is retried after a short backoff.
 */
@Service
@ConditionalOnProperty(
        prefix = "walletfeed.jobs",
        name = "queue-mode",
        havingValue = "redis"
)
public class RedisJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisJobQueue.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder().build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);
    private static final int PROMOTE_BATCH_SIZE = 100;

    static final String MODE = "redis";

    private final StringRedisTemplate stringRedisTemplate;
    private final WalletFeedProperties properties;
    private final InMemoryJobQueue fallbackQueue;
    private final Clock clock;
    private final Object consumerMonitor = new Object();

    private volatile boolean running;
    private volatile JobConsumer consumer;
    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;
    private long lastPromotionNanos;
    private Thread dispatcherThread;

    @Autowired
    public RedisJobQueue(StringRedisTemplate stringRedisTemplate, WalletFeedProperties properties) {
        this(stringRedisTemplate, properties, new InMemoryJobQueue(), Clock.systemUTC());
    }

    RedisJobQueue(
            StringRedisTemplate stringRedisTemplate,
            WalletFeedProperties properties,
            InMemoryJobQueue fallbackQueue,
            Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.properties = properties;
        this.fallbackQueue = fallbackQueue;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        fallbackQueue.start();
        running = true;
        dispatcherThread = new Thread(this::dispatchLoop, "walletfeed-redis-job-dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();
    }

    @PreDestroy
    void stop() {
        running = false;
        synchronized (consumerMonitor) {
            consumerMonitor.notifyAll();
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
        }
        fallbackQueue.stop();
    }

    @Override
    public void enqueue(JobMessage message) {
        JobMessage requiredMessage = Objects.requireNonNull(message, "message is required");
        if (shouldAttemptRedis()) {
            try {
                Long depth = stringRedisTemplate.opsForList().rightPush(readyKey(), serialize(requiredMessage));
                if (depth != null) {
                    markRedisHealthy();
                    return;
                }
                log.warn("Redis ready-list push returned null, routing job to in-memory fallback queue");
                markRedisFailure(null);
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
        fallbackQueue.enqueue(requiredMessage);
    }

    @Override
    public void schedule(JobMessage message, OffsetDateTime runAt) {
        JobMessage requiredMessage = Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(runAt, "runAt is required");
        if (shouldAttemptRedis()) {
            try {
                String envelope = serializeEnvelope(new DelayedJob(UUID.randomUUID().toString(), requiredMessage));
                Boolean added = stringRedisTemplate.opsForZSet()
                        .add(delayedKey(), envelope, runAt.toInstant().toEpochMilli());
                if (added != null) {
                    markRedisHealthy();
                    return;
                }
                markRedisFailure(null);
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
        fallbackQueue.schedule(requiredMessage, runAt);
    }

    @Override
    public boolean scheduleIfAbsent(String registryKey, JobMessage message, OffsetDateTime runAt) {
        String key = InMemoryJobQueue.requireKey(registryKey);
        Objects.requireNonNull(runAt, "runAt is required");
        if (shouldAttemptRedis()) {
            try {
                Boolean registered = stringRedisTemplate.opsForValue()
                        .setIfAbsent(registryKey(key), runAt.toString(), registryTtl(runAt));
                if (registered != null) {
                    markRedisHealthy();
                    if (registered) {
                        schedule(message, runAt);
                    }
                    return registered;
                }
                markRedisFailure(null);
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
        return fallbackQueue.scheduleIfAbsent(key, message, runAt);
    }

    @Override
    public boolean isScheduled(String registryKey) {
        return scheduledAt(registryKey).isPresent();
    }

    @Override
    public Optional<OffsetDateTime> scheduledAt(String registryKey) {
        String key = InMemoryJobQueue.requireKey(registryKey);
        if (shouldAttemptRedis()) {
            try {
                String value = stringRedisTemplate.opsForValue().get(registryKey(key));
                markRedisHealthy();
                return Optional.ofNullable(value).map(RedisJobQueue::parseRunAt);
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
        return fallbackQueue.scheduledAt(key);
    }

    @Override
    public void release(String registryKey) {
        String key = InMemoryJobQueue.requireKey(registryKey);
        fallbackQueue.release(key);
        if (shouldAttemptRedis()) {
            try {
                stringRedisTemplate.delete(registryKey(key));
                markRedisHealthy();
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
            }
        }
    }

    @Override
    public void setConsumer(JobConsumer consumer) {
        JobConsumer requiredConsumer = Objects.requireNonNull(consumer, "consumer is required");
        synchronized (consumerMonitor) {
            this.consumer = requiredConsumer;
            consumerMonitor.notifyAll();
        }
        fallbackQueue.setConsumer(requiredConsumer);
    }

    @Override
    public String mode() {
        return fallbackMode ? MODE + "(fallback:" + InMemoryJobQueue.MODE + ")" : MODE;
    }

    /**
     * Moves due delayed jobs to the ready list. Removal from the sorted set
     * decides which instance promotes a job, so each is promoted once.
     *
     * @return number of jobs this call promoted
     */
    int promoteDueJobs() {
        long nowMillis = clock.millis();
        Set<String> due = stringRedisTemplate.opsForZSet()
                .rangeByScore(delayedKey(), 0, nowMillis, 0, PROMOTE_BATCH_SIZE);
        if (due == null || due.isEmpty()) {
            return 0;
        }
        int promoted = 0;
        for (String envelope : due) {
            Long removed = stringRedisTemplate.opsForZSet().remove(delayedKey(), envelope);
            if (removed == null || removed != 1L) {
                continue;
            }
            stringRedisTemplate.opsForList().rightPush(readyKey(), serialize(deserializeEnvelope(envelope).message()));
            promoted++;
        }
        if (promoted > 0) {
            log.debug("Promoted {} delayed job(s) to the ready list", promoted);
        }
        return promoted;
    }

    boolean pollOnce() throws InterruptedException {
        if (!shouldAttemptRedis()) {
            TimeUnit.MILLISECONDS.sleep(200L);
            return false;
        }

        long now = System.nanoTime();
        if (now - lastPromotionNanos >= TimeUnit.MILLISECONDS.toNanos(properties.getJobs().getPromotePollIntervalMs())) {
            lastPromotionNanos = now;
            promoteDueJobs();
        }

        String payload = stringRedisTemplate.opsForList().leftPop(
                readyKey(),
                resolveRedisPopTimeoutSeconds(),
                TimeUnit.SECONDS
        );
        if (payload == null) {
            return false;
        }
        markRedisHealthy();
        JobConsumer queueConsumer = awaitConsumer();
        if (queueConsumer == null) {
            return false;
        }
        try {
            queueConsumer.accept(deserialize(payload));
        } catch (RuntimeException ex) {
            log.error("Job consumer failed while dispatching Redis payload {}", payload, ex);
        }
        return true;
    }

    private void dispatchLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (InterruptedException ex) {
                if (!running) {
                    Thread.currentThread().interrupt();
                    return;
                }
            } catch (RuntimeException ex) {
                markRedisFailure(ex);
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

    private Duration registryTtl(OffsetDateTime runAt) {
        Duration untilRun = Duration.between(OffsetDateTime.now(clock), runAt);
        if (untilRun.isNegative()) {
            untilRun = Duration.ZERO;
        }
        return untilRun.plus(properties.getJobs().getRegistryGrace());
    }

    String readyKey() {
        return keyPrefix() + ":ready";
    }

    String delayedKey() {
        return keyPrefix() + ":delayed";
    }

    String registryKey(String name) {
        return keyPrefix() + ":registry:" + name;
    }

    private String keyPrefix() {
        String prefix = properties.getJobs().getRedisKeyPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalStateException("walletfeed.jobs.redis-key-prefix must not be blank");
        }
        return prefix.trim();
    }

    private long resolveRedisPopTimeoutSeconds() {
        long timeoutSeconds = properties.getJobs().getRedisPopTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            throw new IllegalStateException("walletfeed.jobs.redis-pop-timeout-seconds must be greater than zero");
        }
        return timeoutSeconds;
    }

    private static OffsetDateTime parseRunAt(String value) {
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException ex) {
            throw new IllegalStateException("Registry entry holds an invalid run time: " + value, ex);
        }
    }

    static String serialize(JobMessage message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize job message", ex);
        }
    }

    static JobMessage deserialize(String payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, JobMessage.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize job message", ex);
        }
    }

    private static String serializeEnvelope(DelayedJob envelope) {
        try {
            return OBJECT_MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize delayed job", ex);
        }
    }

    private static DelayedJob deserializeEnvelope(String payload) {
        try {
            return OBJECT_MAPPER.readValue(payload, DelayedJob.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to deserialize delayed job", ex);
        }
    }

    private boolean shouldAttemptRedis() {
        return System.nanoTime() >= redisRetryNotBeforeNanos;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            if (ex == null) {
                log.warn("Redis job queue is unavailable; switching to in-memory fallback mode");
            } else {
                log.warn("Redis job queue is unavailable ({}); switching to in-memory fallback mode", safeMessage(ex));
            }
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis job queue connection restored; leaving in-memory fallback mode");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private static String safeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    record DelayedJob(String id, JobMessage message) {
    }
}
