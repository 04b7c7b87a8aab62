package com.theatre.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MpscMailbox including:
 * - Null handling
 * - MPSC semantics (multiple producers, single consumer)
 * - Thread interruption
 * - Timeout behavior
 */
class MpscMailboxTest {

    @Test
    void testOfferRejectsNull() {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void testBasicOfferAndPoll() {
        MpscMailbox<String> mailbox = new MpscMailbox<>();

        assertTrue(mailbox.offer("message1"));
        assertTrue(mailbox.offer("message2"));

        assertEquals("message1", mailbox.poll());
        assertEquals("message2", mailbox.poll());
        assertNull(mailbox.poll());
    }

    @Test
    void testUnboundedQueue() {
        MpscMailbox<String> mailbox = new MpscMailbox<>(2);

        for (int i = 0; i < 10000; i++) {
            assertTrue(mailbox.offer("msg" + i));
        }

        assertEquals(10000, mailbox.size());
    }

    @Test
    void testChunkSizeIsRoundedToPowerOfTwo() {
        assertEquals(128, new MpscMailbox<String>().getChunkSize());
        assertEquals(2, new MpscMailbox<String>(0).getChunkSize());
        assertEquals(2, new MpscMailbox<String>(-5).getChunkSize());
        assertEquals(64, new MpscMailbox<String>(33).getChunkSize());
        assertEquals(64, new MpscMailbox<String>(64).getChunkSize());
    }

    @Test
    void testPollWithTimeout() throws InterruptedException {
        MpscMailbox<String> mailbox = new MpscMailbox<>();

        long start = System.nanoTime();
        String result = mailbox.poll(100, TimeUnit.MILLISECONDS);
        long elapsed = System.nanoTime() - start;

        assertNull(result);
        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    @Timeout(5)
    void testTakeWakesUpOnOffer() throws Exception {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        AtomicReference<String> received = new AtomicReference<>();
        CountDownLatch threadStarted = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            threadStarted.countDown();
            try {
                received.set(mailbox.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        consumer.start();
        threadStarted.await();
        Thread.sleep(50); // Give thread time to enter take()
        mailbox.offer("wake up");
        consumer.join(2000);

        assertEquals("wake up", received.get());
    }

    @Test
    @Timeout(5)
    void testTakeWithInterruption() throws Exception {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        CountDownLatch threadStarted = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);

        Thread waiter = new Thread(() -> {
            threadStarted.countDown();
            try {
                mailbox.take();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });

        waiter.start();
        threadStarted.await();
        Thread.sleep(50);
        waiter.interrupt();
        waiter.join(1000);

        assertTrue(interrupted.get(), "Thread should have been interrupted");
    }

    @Test
    void testDrainTo() {
        MpscMailbox<Integer> mailbox = new MpscMailbox<>();
        for (int i = 0; i < 10; i++) {
            mailbox.offer(i);
        }

        List<Integer> drained = new ArrayList<>();
        assertEquals(4, mailbox.drainTo(drained, 4));
        assertEquals(List.of(0, 1, 2, 3), drained);
        assertEquals(6, mailbox.size());
    }

    @Test
    void testClear() {
        MpscMailbox<String> mailbox = new MpscMailbox<>();
        mailbox.offer("a");
        mailbox.offer("b");

        mailbox.clear();

        assertTrue(mailbox.isEmpty());
        assertNull(mailbox.poll());
    }

    @Test
    @Timeout(10)
    void testMultipleProducersKeepPerProducerOrder() throws Exception {
        MpscMailbox<int[]> mailbox = new MpscMailbox<>(16);
        int producers = 4;
        int perProducer = 5000;
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();

        for (int p = 0; p < producers; p++) {
            int producer = p;
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perProducer; i++) {
                    mailbox.offer(new int[]{producer, i});
                }
            });
            threads.add(thread);
            thread.start();
        }
        start.countDown();

        int[] lastSeen = new int[producers];
        java.util.Arrays.fill(lastSeen, -1);
        int received = 0;
        while (received < producers * perProducer) {
            int[] message = mailbox.take();
            assertEquals(lastSeen[message[0]] + 1, message[1], "Producer order must be kept");
            lastSeen[message[0]] = message[1];
            received++;
        }
        for (Thread thread : threads) {
            thread.join();
        }
        assertTrue(mailbox.isEmpty());
    }
}
