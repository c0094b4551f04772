/**
 * Maps the {@code StreamScribeException} hierarchy to HTTP responses.
 */
package com.phillippitts.streamscribe.presentation.exception;
