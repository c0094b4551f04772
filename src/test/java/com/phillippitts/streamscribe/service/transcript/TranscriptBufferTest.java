package com.phillippitts.streamscribe.service.transcript;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptBufferTest {

    @Test
    void singleSpeakerRendersPlainText() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("hello there", 0);
        buffer.append("how are you", 0);

        assertThat(buffer.render()).isEqualTo("hello there how are you");
        assertThat(buffer.turnCount()).isEqualTo(1);
    }

    @Test
    void unlabeledFragmentsRenderPlainText() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("first", null);
        buffer.append("second", null);

        assertThat(buffer.render()).isEqualTo("first second");
    }

    @Test
    void secondSpeakerLabelsEveryTurn() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("I'll take the lead", 0);
        buffer.append("sounds good", 1);

        assertThat(buffer.render())
                .isEqualTo("Speaker 0: I'll take the lead\n\nSpeaker 1: sounds good");
    }

    @Test
    void firstTurnGainsLabelOnlyOnceSecondSpeakerJoins() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("let's begin", 2);

        assertThat(buffer.render()).isEqualTo("let's begin");

        buffer.append("ready", 5);

        assertThat(buffer.render()).isEqualTo("Speaker 2: let's begin\n\nSpeaker 5: ready");
    }

    @Test
    void returningSpeakerStartsNewTurn() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("a", 0);
        buffer.append("b", 1);
        buffer.append("c", 0);

        assertThat(buffer.turnCount()).isEqualTo(3);
        assertThat(buffer.render()).isEqualTo("Speaker 0: a\n\nSpeaker 1: b\n\nSpeaker 0: c");
    }

    @Test
    void unlabeledFragmentContinuesLastSpeakersTurn() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("hi", 1);
        buffer.append("there", null);

        assertThat(buffer.turnCount()).isEqualTo(1);
        assertThat(buffer.render()).isEqualTo("hi there");
    }

    @Test
    void drainClearsTextButKeepsLastSpeaker() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("before flush", 2);

        assertThat(buffer.drain()).isEqualTo("before flush");
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.characters()).isZero();
        assertThat(buffer.words()).isZero();
        assertThat(buffer.lastSpeaker()).isEqualTo(2);

        buffer.append("after flush", null);
        buffer.append("still speaker two", 2);
        assertThat(buffer.turnCount()).isEqualTo(1);
    }

    @Test
    void countsCharactersAndWords() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append("one two", 0);
        buffer.append("three", 1);

        assertThat(buffer.characters()).isEqualTo(12);
        assertThat(buffer.words()).isEqualTo(3);
    }

    @Test
    void emptyBufferRendersEmptyString() {
        assertThat(new TranscriptBuffer().render()).isEmpty();
    }
}
