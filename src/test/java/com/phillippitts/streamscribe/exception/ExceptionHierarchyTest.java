package com.phillippitts.streamscribe.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void streamScribeExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        StreamScribeException ex = new StreamScribeException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void upstreamConnectionExceptionShouldIncludeSession() {
        UpstreamConnectionException ex = new UpstreamConnectionException("handshake refused", "device-1");

        assertThat(ex.getMessage()).contains("handshake refused").contains("device-1");
        assertThat(ex.getSessionId()).isEqualTo("device-1");
        assertThat(ex).isInstanceOf(StreamScribeException.class);
    }

    @Test
    void upstreamConnectionExceptionDefaultsToUnknownSession() {
        assertThat(new UpstreamConnectionException("boom").getSessionId()).isEqualTo("unknown");
    }

    @Test
    void invalidAudioExceptionShouldExposePacketSizeAndReason() {
        InvalidAudioException ex = new InvalidAudioException(2048, "packet exceeds 1024 bytes");

        assertThat(ex.getMessage()).contains("2048").contains("packet exceeds 1024 bytes");
        assertThat(ex.getPacketBytes()).isEqualTo(2048);
        assertThat(ex.getReason()).isEqualTo("packet exceeds 1024 bytes");
    }

    @Test
    void sessionExceptionsShouldExposeIdentifiers() {
        SessionNotFoundException notFound = new SessionNotFoundException("ghost");
        SessionTerminatedException terminated = new SessionTerminatedException("s1", "TERMINATED");

        assertThat(notFound.getSessionId()).isEqualTo("ghost");
        assertThat(notFound.getMessage()).contains("ghost");
        assertThat(terminated.getSessionId()).isEqualTo("s1");
        assertThat(terminated.getState()).isEqualTo("TERMINATED");
    }

    @Test
    void audioDecodeExceptionShouldIncludeCodecAndSize() {
        AudioDecodeException ex = new AudioDecodeException("opus", 12, "corrupted stream");

        assertThat(ex.getMessage()).contains("opus").contains("12 bytes").contains("corrupted stream");
        assertThat(ex.getCodec()).isEqualTo("opus");
        assertThat(ex.getPacketSize()).isEqualTo(12);
    }
}
