package com.phillippitts.streamscribe.service.audio.decode;

import com.phillippitts.streamscribe.config.properties.AudioStreamProperties;
import com.phillippitts.streamscribe.service.audio.AudioFormat;

import java.util.Objects;

/**
 * Creates one decoder per session according to {@code stream.audio.codec}.
 */
public class AudioFrameDecoderFactory {

    private final AudioStreamProperties props;
    private final AudioFormat format;

    public AudioFrameDecoderFactory(AudioStreamProperties props) {
        this.props = Objects.requireNonNull(props, "props");
        this.format = props.toAudioFormat();
    }

    public AudioFrameDecoder create() {
        return switch (props.getCodec()) {
            case OPUS -> new OpusFrameDecoder(format, props.getPacketHeaderBytes(),
                    props.getOpusFrameSamples(), props.getMaxConsecutiveDecodeErrors());
            case PCM -> new PcmPassthroughDecoder(format, props.getMaxConsecutiveDecodeErrors());
        };
    }

    public AudioFormat outputFormat() {
        return format;
    }
}
