/**
 * WebSocket endpoint for streamed device audio.
 */
package com.phillippitts.streamscribe.presentation.websocket;
