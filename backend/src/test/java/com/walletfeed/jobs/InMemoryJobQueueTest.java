package com.walletfeed.jobs;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobQueueTest {

    private static final String WALLET = "0x5555555555555555555555555555555555555555";

    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue();
        queue.start();
    }

    @AfterEach
    void tearDown() {
        queue.stop();
    }

    @Test
    void enqueueDispatchesToConsumer() throws InterruptedException {
        CountDownLatch consumed = new CountDownLatch(1);
        List<JobMessage> received = new CopyOnWriteArrayList<>();
        queue.setConsumer(message -> {
            received.add(message);
            consumed.countDown();
        });

        queue.enqueue(JobMessage.ingestWallet(WALLET));

        assertTrue(consumed.await(5, TimeUnit.SECONDS), "Timed out waiting for queue consumer callback");
        assertEquals(List.of(JobMessage.ingestWallet(WALLET)), received);
    }

    @Test
    void messagesWaitForConsumerRegistration() throws InterruptedException {
        queue.enqueue(JobMessage.refreshAllWallets());
        CountDownLatch consumed = new CountDownLatch(1);

        queue.setConsumer(message -> consumed.countDown());

        assertTrue(consumed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void scheduledMessageIsHeldUntilDue() throws InterruptedException {
        CountDownLatch consumed = new CountDownLatch(1);
        queue.setConsumer(message -> consumed.countDown());

        queue.schedule(JobMessage.refreshAllWallets(), OffsetDateTime.now().plusNanos(400_000_000L));

        assertFalse(consumed.await(100, TimeUnit.MILLISECONDS));
        assertTrue(consumed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void consumerFailureDoesNotStopDispatch() throws InterruptedException {
        CountDownLatch consumed = new CountDownLatch(2);
        queue.setConsumer(message -> {
            consumed.countDown();
            throw new IllegalStateException("boom");
        });

        queue.enqueue(JobMessage.ingestWallet(WALLET));
        queue.enqueue(JobMessage.ingestWallet(WALLET));

        assertTrue(consumed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void scheduleIfAbsentRegistersKeyOnlyOnce() {
        OffsetDateTime first = OffsetDateTime.now().plusHours(1);
        OffsetDateTime second = first.plusHours(1);

        assertTrue(queue.scheduleIfAbsent("refresh", JobMessage.refreshAllWallets(), first));
        assertFalse(queue.scheduleIfAbsent("refresh", JobMessage.refreshAllWallets(), second));

        assertTrue(queue.isScheduled("refresh"));
        assertEquals(first, queue.scheduledAt("refresh").orElseThrow());

        queue.release("refresh");

        assertFalse(queue.isScheduled("refresh"));
        assertTrue(queue.scheduleIfAbsent("refresh", JobMessage.refreshAllWallets(), second));
    }

    @Test
    void dueScheduleIsQueuedImmediately() {
        queue.schedule(JobMessage.refreshAllWallets(), OffsetDateTime.now().minusMinutes(1));

        assertEquals(1, queue.pendingCount());
    }

    @Test
    void rejectsBlankRegistryKey() {
        assertThrows(IllegalArgumentException.class, () -> queue.isScheduled(" "));
    }

    @Test
    void enqueueFailsAfterStop() {
        queue.stop();

        IllegalStateException thrown = assertThrows(
                IllegalStateException.class,
                () -> queue.enqueue(JobMessage.refreshAllWallets())
        );

        assertEquals("Job queue is not running", thrown.getMessage());
    }
}
