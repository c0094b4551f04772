package com.phillippitts.streamscribe.service.downstream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class LoggingTranscriptSinkTest {

    @Test
    void acceptsLongBlocks() {
        LoggingTranscriptSink sink = new LoggingTranscriptSink();

        assertThatCode(() -> sink.deliver("s1", "word ".repeat(500))).doesNotThrowAnyException();
        assertThat(sink.name()).isEqualTo("log");
    }
}
