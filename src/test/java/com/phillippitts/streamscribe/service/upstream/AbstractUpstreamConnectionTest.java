package com.phillippitts.streamscribe.service.upstream;

import com.phillippitts.streamscribe.domain.TranscriptFragment;
import com.phillippitts.streamscribe.exception.UpstreamConnectionException;
import com.phillippitts.streamscribe.testutil.FakeUpstreamConnection;
import com.phillippitts.streamscribe.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractUpstreamConnectionTest {

    private final List<String> events = new ArrayList<>();
    private MutableClock clock;
    private FakeUpstreamConnection connection;

    private final UpstreamListener listener = new UpstreamListener() {
        @Override
        public void onTranscript(UpstreamConnection c, TranscriptFragment fragment) {
            events.add("transcript:" + fragment.text());
        }

        @Override
        public void onProviderError(UpstreamConnection c, String message) {
            events.add("error:" + message);
        }

        @Override
        public void onClosed(UpstreamConnection c, int code, String reason) {
            events.add("closed:" + code);
        }

        @Override
        public void onTransportError(UpstreamConnection c, Throwable error) {
            events.add("transport:" + error.getMessage());
        }
    };

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        connection = new FakeUpstreamConnection("s1", clock, listener);
    }

    @Test
    void startsConnectingAndRejectsWritesUntilOpen() {
        assertThat(connection.state()).isEqualTo(UpstreamState.CONNECTING);

        assertThatThrownBy(() -> connection.sendAudio(new byte[2]))
                .isInstanceOf(UpstreamConnectionException.class)
                .hasMessageContaining("state=CONNECTING");
    }

    @Test
    void openConnectionForwardsAudioAndUpdatesActivity() {
        connection.open();
        clock.advance(Duration.ofSeconds(5));

        connection.sendAudio(new byte[] {1, 2});

        assertThat(connection.sentAudio()).hasSize(1);
        assertThat(connection.lastActivity()).isEqualTo(clock.instant());
    }

    @Test
    void failedWriteMovesToFailedAndWrapsCause() {
        connection.open();
        connection.failNextSends(1);

        assertThatThrownBy(() -> connection.sendAudio(new byte[4]))
                .isInstanceOf(UpstreamConnectionException.class)
                .hasRootCauseMessage("simulated write failure");
        assertThat(connection.state()).isEqualTo(UpstreamState.FAILED);
        assertThatThrownBy(() -> connection.sendAudio(new byte[4]))
                .isInstanceOf(UpstreamConnectionException.class);
    }

    @Test
    void keepAliveUsesRequestedMode() {
        connection.open();

        connection.sendKeepAlive(KeepAliveMode.BOTH);

        assertThat(connection.keepAlives()).containsExactly(KeepAliveMode.BOTH);
    }

    @Test
    void closeIsGracefulOnlyWhenOpenAndIdempotent() {
        connection.open();

        connection.close();
        connection.close();
        connection.abort();

        assertThat(connection.state()).isEqualTo(UpstreamState.CLOSED);
        assertThat(connection.closedGracefully()).isTrue();
        assertThat(connection.aborted()).isFalse();
    }

    @Test
    void closeBeforeOpenIsNotGraceful() {
        connection.close();

        assertThat(connection.closeCalled()).isTrue();
        assertThat(connection.closedGracefully()).isFalse();
        assertThat(connection.open()).isFalse();
    }

    @Test
    void remoteCloseAfterLocalCloseIsNotReported() {
        connection.open();
        connection.close();

        connection.simulateRemoteClose(1000, "bye");

        assertThat(events).isEmpty();
    }

    @Test
    void remoteCloseIsReportedOnce() {
        connection.open();

        connection.simulateRemoteClose(1011, "server error");
        connection.simulateTransportError(new IllegalStateException("late"));

        assertThat(events).containsExactly("closed:1011");
        assertThat(connection.state()).isEqualTo(UpstreamState.FAILED);
    }

    @Test
    void keepAliveModeFlags() {
        assertThat(KeepAliveMode.SILENCE.sendsSilence()).isTrue();
        assertThat(KeepAliveMode.SILENCE.sendsControl()).isFalse();
        assertThat(KeepAliveMode.CONTROL.sendsControl()).isTrue();
        assertThat(KeepAliveMode.CONTROL.sendsSilence()).isFalse();
        assertThat(KeepAliveMode.BOTH.sendsSilence()).isTrue();
        assertThat(KeepAliveMode.BOTH.sendsControl()).isTrue();
    }
}
