package com.phillippitts.streamscribe.service.audio.decode;

/**
 * Compressed formats accepted on the inbound audio boundary.
 */
public enum AudioCodec {
    /** Opus packets with a device header, as sent by the BLE pendant. */
    OPUS,
    /** Raw little-endian PCM already in the provider format. */
    PCM
}
