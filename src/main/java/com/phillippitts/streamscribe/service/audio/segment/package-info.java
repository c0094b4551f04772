/**
 * Fixed-length segmentation of decoded audio and the archives segments are written to.
 */
package com.phillippitts.streamscribe.service.audio.segment;
