/**
 * Spring configuration: thread pools, bean wiring per service area and typed properties.
 */
package com.phillippitts.streamscribe.config;
