/**
 * Typed, validated configuration properties bound from {@code talkbox.*} keys.
 *
 * <p>Each property object is constructed once by Spring and passed into the constructors of the
 * components that need it. Invalid values fail context startup before any background task runs.
 */
package com.phillippitts.talkbox.config.properties;
