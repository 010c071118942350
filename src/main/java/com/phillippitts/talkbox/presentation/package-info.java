/**
 * HTTP presentation layer: controllers and the error mapping that backs them.
 */
package com.phillippitts.talkbox.presentation;
