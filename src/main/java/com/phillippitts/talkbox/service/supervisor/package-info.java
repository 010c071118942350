/**
 * Connection supervision for interactive adapters.
 *
 * <p>Each adapter runs inside a {@link com.phillippitts.talkbox.service.supervisor.ConnectionSupervisor}
 * on its own background task. State changes are published as
 * {@link com.phillippitts.talkbox.service.supervisor.event.ConnectionStateChangedEvent} and feed
 * the health indicator and metrics.
 */
package com.phillippitts.talkbox.service.supervisor;
