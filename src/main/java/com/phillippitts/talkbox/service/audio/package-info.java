/**
 * Audio utilities shared by the response pipeline.
 *
 * <p>{@link com.phillippitts.talkbox.service.audio.AudioPostProcessor} normalizes synthesized speech;
 * the {@code playback} subpackage writes it to an output device.
 */
package com.phillippitts.talkbox.service.audio;
