package com.phillippitts.talkbox.service.pipeline;

import com.phillippitts.talkbox.service.audio.AudioPostProcessor;
import com.phillippitts.talkbox.service.audio.playback.PlaybackSink;
import com.phillippitts.talkbox.service.avatar.AvatarController;
import com.phillippitts.talkbox.service.reply.ReplyGenerator;
import com.phillippitts.talkbox.service.tts.SpeechSynthesizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Groups the external collaborators the pipeline drives.
 *
 * <p>Every collaborator except the post-processor is optional: an application may run without an
 * avatar, and a missing generator, synthesizer or sink aborts items instead of failing startup.
 */
public final class PipelineCollaborators {

    private final ReplyGenerator replyGenerator;
    private final SpeechSynthesizer speechSynthesizer;
    private final AudioPostProcessor postProcessor;
    private final PlaybackSink playbackSink;
    private final AvatarController avatarController;

    public PipelineCollaborators(ReplyGenerator replyGenerator,
                                 SpeechSynthesizer speechSynthesizer,
                                 AudioPostProcessor postProcessor,
                                 PlaybackSink playbackSink,
                                 AvatarController avatarController) {
        this.replyGenerator = replyGenerator;
        this.speechSynthesizer = speechSynthesizer;
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
        this.playbackSink = playbackSink;
        this.avatarController = avatarController;
    }

    public Optional<ReplyGenerator> replyGenerator() {
        return Optional.ofNullable(replyGenerator);
    }

    public Optional<SpeechSynthesizer> speechSynthesizer() {
        return Optional.ofNullable(speechSynthesizer);
    }

    public AudioPostProcessor postProcessor() {
        return postProcessor;
    }

    public Optional<PlaybackSink> playbackSink() {
        return Optional.ofNullable(playbackSink);
    }

    public Optional<AvatarController> avatarController() {
        return Optional.ofNullable(avatarController);
    }
}
