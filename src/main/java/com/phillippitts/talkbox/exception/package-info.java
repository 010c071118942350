/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.talkbox.exception.TalkBoxException} - Base exception</li>
 *   <li>{@link com.phillippitts.talkbox.exception.InvalidAudioException} - Audio buffer rejected by
 *       post-processing (non-finite samples, bad sample rate)</li>
 *   <li>{@link com.phillippitts.talkbox.exception.SpeechSynthesisException} - Speech synthesis failed</li>
 *   <li>{@link com.phillippitts.talkbox.exception.PlaybackException} - Playback sink failed</li>
 *   <li>{@link com.phillippitts.talkbox.exception.ReplyGenerationException} - Reply generation failed</li>
 * </ul>
 *
 * <p>None of these are fatal: the response pipeline aborts the current item and continues. Queue
 * capacity rejections are not exceptions at all; see
 * {@link com.phillippitts.talkbox.service.queue.EnqueueResult}.
 *
 * @see com.phillippitts.talkbox.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.talkbox.exception;
