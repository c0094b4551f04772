/**
 * Immutable domain types shared across the session manager.
 *
 * @since 1.0
 */
package com.phillippitts.streamscribe.domain;
