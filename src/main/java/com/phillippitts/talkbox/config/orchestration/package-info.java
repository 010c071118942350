/**
 * Bean wiring for the orchestration core.
 */
package com.phillippitts.talkbox.config.orchestration;
