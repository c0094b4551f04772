/**
 * Audio format handling, decoding of compressed device packets and local archival.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code decode} - per-session stateful packet decoders producing linear PCM</li>
 *   <li>{@code segment} - fixed-duration segmentation and the archival sink</li>
 * </ul>
 *
 * @see com.phillippitts.streamscribe.service.audio.AudioFormat
 * @since 1.0
 */
package com.phillippitts.streamscribe.service.audio;
