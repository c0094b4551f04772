/**
 * Inbound boundary: REST controllers, the audio WebSocket handler and error mapping.
 */
package com.phillippitts.streamscribe.presentation;
