package com.theatre.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MailboxChannelTest {

    private MailboxChannel<String> newChannel() {
        return new MailboxChannel<>("test-actor", new MpscMailbox<>());
    }

    @Test
    void testLettersArriveInSendOrder() throws InterruptedException {
        MailboxChannel<String> channel = newChannel();
        MailboxChannel.Sender<String> sender = channel.openSender();

        assertTrue(sender.send("a"));
        assertTrue(sender.sendStop());
        assertTrue(sender.send("b"));

        assertEquals(new Letter.Deliver<>("a"), channel.receive());
        assertInstanceOf(Letter.Stop.class, channel.receive());
        assertEquals(new Letter.Deliver<>("b"), channel.tryReceive());
        assertNull(channel.tryReceive());
    }

    @Test
    void testNullMessageIsRejected() {
        MailboxChannel.Sender<String> sender = newChannel().openSender();
        assertThrows(NullPointerException.class, () -> sender.send(null));
    }

    @Test
    void testReleasingLastStrongSenderHangsUp() throws InterruptedException {
        MailboxChannel<String> channel = newChannel();
        MailboxChannel.Sender<String> first = channel.openSender();
        MailboxChannel.Sender<String> second = first.duplicate();
        assertEquals(2, channel.strongSenderCount());

        assertTrue(first.release());
        assertFalse(first.release(), "Second release must have no effect");
        assertFalse(channel.isHungUp());
        assertEquals(1, channel.strongSenderCount());

        second.send("last words");
        assertTrue(second.release());

        assertTrue(channel.isHungUp());
        assertEquals(new Letter.Deliver<>("last words"), channel.receive());
        assertInstanceOf(Letter.Hangup.class, channel.receive());
    }

    @Test
    @Timeout(5)
    void testHangupWakesBlockedReceiver() throws Exception {
        MailboxChannel<String> channel = newChannel();
        MailboxChannel.Sender<String> sender = channel.openSender();

        CompletableFuture<Letter<String>> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        sender.release();

        assertInstanceOf(Letter.Hangup.class, received.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testSendsFailAfterHangup() {
        MailboxChannel<String> channel = newChannel();
        MailboxChannel.Sender<String> sender = channel.openSender();
        MailboxChannel.WeakSender<String> weak = sender.weaken();

        sender.release();

        assertFalse(weak.send("too late"));
        assertFalse(sender.sendStop());
        assertThrows(IllegalStateException.class, () -> sender.send("released"));
        assertThrows(IllegalStateException.class, sender::duplicate);
        assertThrows(IllegalStateException.class, channel::openSender);
    }

    @Test
    void testWeakSenderDoesNotKeepChannelOpen() {
        MailboxChannel<String> channel = newChannel();
        MailboxChannel.Sender<String> sender = channel.openSender();
        MailboxChannel.WeakSender<String> weak = channel.weakSender();

        assertTrue(weak.send("hello"));
        assertEquals(1, channel.strongSenderCount());

        sender.release();
        assertTrue(channel.isHungUp());
    }

    @Test
    void testCloseDiscardsPendingLettersAndRejectsSends() {
        MailboxChannel<String> channel = newChannel();
        MailboxChannel.Sender<String> sender = channel.openSender();
        sender.send("a");
        sender.send("b");
        sender.sendStop();

        assertEquals(3, channel.close());

        assertTrue(channel.isClosed());
        assertEquals(0, channel.pending());
        assertFalse(sender.send("c"));
        assertFalse(sender.sendStop());
    }

    @Test
    void testReleaseAfterCloseDoesNotEnqueueHangup() {
        MailboxChannel<String> channel = newChannel();
        MailboxChannel.Sender<String> sender = channel.openSender();
        channel.close();

        sender.release();

        assertTrue(channel.isHungUp());
        assertEquals(0, channel.pending());
    }
}
