/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.streamscribe.exception.StreamScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.InvalidAudioException} - Malformed inbound
 *       audio request (HTTP 400)</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.AudioDecodeException} - One packet failed to
 *       decode; always recovered locally by dropping the packet</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.UpstreamConnectionException} - Transient
 *       provider connection error, recovered by reconnect-with-backoff</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.SessionTerminatedException} - Session closed
 *       or out of reconnect budget (HTTP 410)</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.SessionNotFoundException} - Unknown session
 *       id (HTTP 404)</li>
 * </ul>
 *
 * @see com.phillippitts.streamscribe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.streamscribe.exception;
