package com.phillippitts.talkbox.service.avatar;

/**
 * Contract for the avatar host (e.g. a VTube Studio plugin connection).
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #connect()} once at startup; failure is tolerated and the system runs without avatar</li>
 *   <li>{@link #setTalking(boolean)} around each playback, from the pipeline thread only</li>
 *   <li>{@link #idleTick()} from the idle animation loop while connected</li>
 *   <li>{@link #disconnect()} once during shutdown, only if connect succeeded</li>
 * </ol>
 *
 * <p>{@link #idleTick()} runs on the animation thread and may overlap {@link #setTalking(boolean)}
 * from the pipeline thread; implementations must tolerate that.
 */
public interface AvatarController {

    /**
     * Opens the connection to the avatar host.
     *
     * @throws Exception if the host cannot be reached or refuses authentication
     */
    void connect() throws Exception;

    void disconnect() throws Exception;

    /** Toggles the mouth/talking animation. Best-effort; failures are logged by the caller. */
    void setTalking(boolean talking);

    /** Advances idle animation by one frame. No-op by default. */
    default void idleTick() {
    }
}
