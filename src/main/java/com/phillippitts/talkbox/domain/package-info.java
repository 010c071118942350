/**
 * Domain records shared by producers, the queue and the response pipeline.
 *
 * <p>All types here are immutable. {@link com.phillippitts.talkbox.domain.QueueItem} is the only
 * record that crosses the producer/consumer boundary; producers submit
 * {@link com.phillippitts.talkbox.domain.IncomingEvent} and the queue manager stamps the rest.
 */
package com.phillippitts.talkbox.domain;
