/**
 * Seams between the core and interactive hosts.
 *
 * <p>Adapters receive an {@link com.phillippitts.talkbox.service.adapter.InboundEventHandler} when
 * they are built and run under a
 * {@link com.phillippitts.talkbox.service.supervisor.ConnectionSupervisor}. They never touch the
 * queue or pipeline directly.
 */
package com.phillippitts.talkbox.service.adapter;
