/**
 * Audio output.
 *
 * <p>{@link com.phillippitts.talkbox.service.audio.playback.PlaybackSink} is the seam the pipeline
 * plays through; {@link com.phillippitts.talkbox.service.audio.playback.JavaSoundPlaybackSink} is the
 * default implementation.
 */
package com.phillippitts.talkbox.service.audio.playback;
