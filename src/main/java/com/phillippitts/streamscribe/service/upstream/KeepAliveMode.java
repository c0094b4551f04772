package com.phillippitts.streamscribe.service.upstream;

/**
 * How an idle upstream socket is kept open.
 */
public enum KeepAliveMode {
    /** Send a short frame of digital silence as audio. */
    SILENCE,
    /** Send the provider's JSON keep-alive control message. */
    CONTROL,
    /** Send both. */
    BOTH;

    public boolean sendsSilence() {
        return this == SILENCE || this == BOTH;
    }

    public boolean sendsControl() {
        return this == CONTROL || this == BOTH;
    }
}
