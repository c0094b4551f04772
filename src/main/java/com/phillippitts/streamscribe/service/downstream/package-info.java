/**
 * Hand-off of flushed transcript blocks to the downstream analysis service.
 */
package com.phillippitts.streamscribe.service.downstream;
