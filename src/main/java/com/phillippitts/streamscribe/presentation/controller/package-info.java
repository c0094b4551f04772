/**
 * REST controllers.
 *
 * <p>{@link com.phillippitts.streamscribe.presentation.controller.StreamController} exposes audio
 * ingestion, explicit connect and disconnect, forced flush and session status under {@code /stream}.
 * Errors are rendered by {@code GlobalExceptionHandler}.
 */
package com.phillippitts.streamscribe.presentation.controller;
