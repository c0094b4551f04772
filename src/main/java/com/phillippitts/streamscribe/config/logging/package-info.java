/**
 * Logging configuration: request and session correlation ids in Log4j2's ThreadContext.
 */
package com.phillippitts.streamscribe.config.logging;
