package com.eventwait.eventmanager.examples;

import com.eventwait.eventmanager.EventArgs;
import com.eventwait.eventmanager.EventManager;
import com.eventwait.eventmanager.EventStream;
import com.eventwait.eventmanager.LoopTimeoutException;
import com.eventwait.eventmanager.WaitTimeoutException;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Compact demonstrations of waiting for and looping over dispatched events.
 */
public final class Example {

    private Example() {
        // utility class
    }

    public static void main(String[] args) throws InterruptedException {
        ScheduledExecutorService gateway = Executors.newSingleThreadScheduledExecutor();
        try (EventManager events = new EventManager()) {
            waitForReady(events, gateway);
            waitForReplyThatNeverComes(events);
            collectMessages(events, gateway);
        } finally {
            gateway.shutdownNow();
        }
    }

    private static void waitForReady(EventManager events, ScheduledExecutorService gateway)
            throws InterruptedException {
        System.out.println("=== waitFor ===");
        gateway.schedule(() -> events.dispatch("on_ready", "session-1"), 100, TimeUnit.MILLISECONDS);

        EventArgs ready = events.waitFor("on_ready", Duration.ofSeconds(1));
        System.out.println("Ready: " + ready.get(0, String.class));
    }

    private static void waitForReplyThatNeverComes(EventManager events) throws InterruptedException {
        System.out.println("=== waitFor with timeout ===");
        try {
            events.waitFor("on_message", args -> "support".equals(args.get(0)), Duration.ofMillis(50));
        } catch (WaitTimeoutException e) {
            System.out.println(e.getMessage());
        }
    }

    private static void collectMessages(EventManager events, ScheduledExecutorService gateway) {
        System.out.println("=== loopFor ===");
        // Register before anything is dispatched: events are not buffered for late subscribers.
        try (EventStream messages = events.loopFor("on_message",
                args -> "general".equals(args.get(0)), Duration.ofMillis(100), Duration.ofMillis(300))) {
            for (int i = 1; i <= 3; i++) {
                String text = "message " + i;
                gateway.schedule(() -> events.dispatch("on_message", "general", text),
                    10L * i, TimeUnit.MILLISECONDS);
            }
            gateway.schedule(() -> events.dispatch("on_message", "general", "too late"),
                500, TimeUnit.MILLISECONDS);

            for (EventArgs message : messages) {
                System.out.println("Received: " + message.get(1));
            }
        } catch (LoopTimeoutException e) {
            System.out.println(e.getMessage());
        }
    }
}
