package io.textimport.runtime;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class BoundedChannelTest {
    @Test
    void send_blocks_while_full_until_receiver_takes() throws Exception {
        BoundedChannel<String> ch = new BoundedChannel<>(1);
        assertTrue(ch.send("a"));
        CountDownLatch sent = new CountDownLatch(1);
        Thread t = new Thread(() -> {
            try {
                ch.send("b");
                sent.countDown();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        });
        t.start();
        assertFalse(sent.await(100, TimeUnit.MILLISECONDS), "second send should block on a full channel");
        assertEquals(Optional.of("a"), ch.receive());
        assertTrue(sent.await(2, TimeUnit.SECONDS));
        assertEquals(Optional.of("b"), ch.receive());
        t.join();
    }

    @Test
    void close_lets_receivers_drain_then_reports_end() throws Exception {
        BoundedChannel<Integer> ch = new BoundedChannel<>(4);
        ch.send(1);
        ch.send(2);
        ch.close();
        assertFalse(ch.send(3));
        assertEquals(Optional.of(1), ch.receive());
        assertEquals(Optional.of(2), ch.receive());
        assertTrue(ch.receive().isEmpty());
        assertTrue(ch.isClosed());
    }

    @Test
    void close_wakes_blocked_sender_and_receiver() throws Exception {
        BoundedChannel<Integer> full = new BoundedChannel<>(1);
        full.send(0);
        BoundedChannel<Integer> empty = new BoundedChannel<>(1);
        AtomicBoolean sendResult = new AtomicBoolean(true);
        AtomicBoolean received = new AtomicBoolean(true);
        Thread sender = new Thread(() -> {
            try { sendResult.set(full.send(1)); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
        });
        Thread receiver = new Thread(() -> {
            try { received.set(empty.receive().isPresent()); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
        });
        sender.start();
        receiver.start();
        Thread.sleep(50);
        full.close();
        empty.close();
        sender.join(2000);
        receiver.join(2000);
        assertFalse(sender.isAlive());
        assertFalse(receiver.isAlive());
        assertFalse(sendResult.get());
        assertFalse(received.get());
    }

    @Test
    void rejects_non_positive_capacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedChannel<>(0));
    }
}
