/**
 * Transcript buffering: near-duplicate suppression, speaker turns and dwell-based flushing.
 */
package com.phillippitts.streamscribe.service.transcript;
