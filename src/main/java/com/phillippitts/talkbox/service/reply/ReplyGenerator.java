package com.phillippitts.talkbox.service.reply;

import com.phillippitts.talkbox.domain.ReplyResult;
import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.exception.ReplyGenerationException;

/**
 * Contract for reply generation (typically a hosted language model behind an HTTP client).
 *
 * <p>Implementations decide whether to answer at all. A policy decision not to answer (filtered
 * content, rate limits of the model provider, persona rules) is returned as
 * {@link ReplyResult#suppressed(String)}; only genuine failures throw.
 *
 * <p>Called only from the response pipeline thread, one item at a time.
 */
public interface ReplyGenerator {

    /**
     * Produces the reply for one queued item.
     *
     * @param text user text (already transcribed for voice input)
     * @param userName display name of the originator
     * @param source where the text came from, so replies can be tailored per channel
     * @return reply text or a suppression with its reason
     * @throws ReplyGenerationException if the backend call fails or times out
     */
    ReplyResult generate(String text, String userName, Source source);
}
