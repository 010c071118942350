/**
 * REST error mapping. {@link com.phillippitts.talkbox.presentation.exception.GlobalExceptionHandler}
 * turns exceptions into a uniform error body.
 */
package com.phillippitts.talkbox.presentation.exception;
