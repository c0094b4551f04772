package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.service.downstream.TranscriptSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that records deliveries and can be told to fail.
 */
public class RecordingTranscriptSink implements TranscriptSink {

    public record Delivery(String sessionId, String text, String thread) {}

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    @Override
    public void deliver(String sessionId, String text) {
        if (failure != null) {
            throw failure;
        }
        deliveries.add(new Delivery(sessionId, text, Thread.currentThread().getName()));
    }

    @Override
    public String name() {
        return "recording";
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }
}
