package com.phillippitts.streamscribe.service.audio.decode;

import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioFrameDecoderFactoryTest {

    @Test
    void createsOpusDecoderByDefault() {
        AudioFrameDecoderFactory factory = new AudioFrameDecoderFactory(new AudioStreamProperties());

        assertThat(factory.create()).isInstanceOf(OpusFrameDecoder.class);
    }

    @Test
    void createsPassthroughForPcm() {
        AudioStreamProperties props = new AudioStreamProperties();
        props.setCodec(AudioCodec.PCM);

        AudioFrameDecoderFactory factory = new AudioFrameDecoderFactory(props);

        assertThat(factory.create()).isInstanceOf(PcmPassthroughDecoder.class);
        assertThat(factory.outputFormat().sampleRate()).isEqualTo(16_000);
    }

    @Test
    void eachSessionGetsItsOwnDecoder() {
        AudioFrameDecoderFactory factory = new AudioFrameDecoderFactory(new AudioStreamProperties());

        assertThat(factory.create()).isNotSameAs(factory.create());
    }
}
