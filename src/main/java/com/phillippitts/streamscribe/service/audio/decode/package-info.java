/**
 * Per-session packet decoders that turn device audio into provider-ready PCM.
 */
package com.phillippitts.streamscribe.service.audio.decode;
