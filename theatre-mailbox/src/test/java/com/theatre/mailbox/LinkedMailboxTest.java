package com.theatre.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LinkedMailboxTest {

    @Test
    void testOfferRejectsNull() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void testFifoOrder() {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        mailbox.offer("first");
        mailbox.offer("second");

        assertEquals(2, mailbox.size());
        assertEquals("first", mailbox.poll());
        assertEquals("second", mailbox.poll());
        assertNull(mailbox.poll());
        assertTrue(mailbox.isEmpty());
    }

    @Test
    @Timeout(5)
    void testTakeAndTimedPoll() throws InterruptedException {
        LinkedMailbox<String> mailbox = new LinkedMailbox<>();
        assertNull(mailbox.poll(20, TimeUnit.MILLISECONDS));

        new Thread(() -> mailbox.offer("late")).start();

        assertEquals("late", mailbox.take());
    }

    @Test
    void testDrainToAndClear() {
        LinkedMailbox<Integer> mailbox = new LinkedMailbox<>();
        for (int i = 0; i < 5; i++) {
            mailbox.offer(i);
        }

        List<Integer> drained = new ArrayList<>();
        assertEquals(2, mailbox.drainTo(drained, 2));
        assertEquals(List.of(0, 1), drained);

        mailbox.clear();
        assertEquals(0, mailbox.size());
    }
}
