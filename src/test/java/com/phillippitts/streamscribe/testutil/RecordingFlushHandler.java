package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.service.transcript.FlushHandler;
import com.phillippitts.streamscribe.service.transcript.FlushTrigger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures every released transcript block.
 */
public class RecordingFlushHandler implements FlushHandler {

    public record Flush(String sessionId, String text, FlushTrigger trigger) {}

    private final List<Flush> flushes = new CopyOnWriteArrayList<>();

    @Override
    public void onFlush(String sessionId, String text, FlushTrigger trigger) {
        flushes.add(new Flush(sessionId, text, trigger));
    }

    public List<Flush> flushes() {
        return List.copyOf(flushes);
    }

    public List<String> texts() {
        return flushes.stream().map(Flush::text).toList();
    }

    public Flush last() {
        return flushes.isEmpty() ? null : flushes.get(flushes.size() - 1);
    }
}
