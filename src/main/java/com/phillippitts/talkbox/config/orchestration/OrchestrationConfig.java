package com.phillippitts.talkbox.config.orchestration;

import com.phillippitts.talkbox.config.properties.LifecycleProperties;
import com.phillippitts.talkbox.config.properties.PipelineProperties;
import com.phillippitts.talkbox.config.properties.PlaybackProperties;
import com.phillippitts.talkbox.config.properties.QueueProperties;
import com.phillippitts.talkbox.config.properties.SupervisorProperties;
import com.phillippitts.talkbox.service.adapter.InteractiveAdapter;
import com.phillippitts.talkbox.service.admin.AdminCommandHandler;
import com.phillippitts.talkbox.service.audio.AudioPostProcessor;
import com.phillippitts.talkbox.service.audio.playback.JavaSoundPlaybackSink;
import com.phillippitts.talkbox.service.audio.playback.PlaybackSink;
import com.phillippitts.talkbox.service.avatar.AvatarController;
import com.phillippitts.talkbox.service.ingest.EventIngestionService;
import com.phillippitts.talkbox.service.lifecycle.LifecycleCoordinator;
import com.phillippitts.talkbox.service.lifecycle.StopSignal;
import com.phillippitts.talkbox.service.lifecycle.TaskGroup;
import com.phillippitts.talkbox.service.metrics.PipelineMetrics;
import com.phillippitts.talkbox.service.pipeline.PipelineCollaborators;
import com.phillippitts.talkbox.service.pipeline.ResponsePipeline;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.reply.ReplyGenerator;
import com.phillippitts.talkbox.service.stt.SpeechRecognizer;
import com.phillippitts.talkbox.service.supervisor.ConnectionStatusRegistry;
import com.phillippitts.talkbox.service.tts.SpeechSynthesizer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the orchestration core: queue, pipeline, ingestion and lifecycle.
 *
 * <p>External collaborators (reply generator, synthesizer, recognizer, avatar, adapters) are
 * contributed by the application as beans and are all optional here. Missing ones are resolved to
 * null and the core degrades: items abort, voice input is ignored, or no adapter runs.
 */
@Configuration
public class OrchestrationConfig {

    private final QueueProperties queueProperties;
    private final PipelineProperties pipelineProperties;
    private final SupervisorProperties supervisorProperties;
    private final LifecycleProperties lifecycleProperties;
    private final ApplicationEventPublisher publisher;

    public OrchestrationConfig(QueueProperties queueProperties,
                               PipelineProperties pipelineProperties,
                               SupervisorProperties supervisorProperties,
                               LifecycleProperties lifecycleProperties,
                               ApplicationEventPublisher publisher) {
        this.queueProperties = queueProperties;
        this.pipelineProperties = pipelineProperties;
        this.supervisorProperties = supervisorProperties;
        this.lifecycleProperties = lifecycleProperties;
        this.publisher = publisher;
    }

    @Bean
    public QueueManager queueManager() {
        return new QueueManager(queueProperties.getMaxSize(), queueProperties.getAdminIds());
    }

    /** System-wide stop flag. Only the lifecycle coordinator trips it. */
    @Bean
    public StopSignal stopSignal() {
        return new StopSignal();
    }

    @Bean
    public TaskGroup taskGroup() {
        return new TaskGroup();
    }

    @Bean
    public AudioPostProcessor audioPostProcessor() {
        return new AudioPostProcessor();
    }

    /**
     * Default playback through Java Sound. Replaced by any other PlaybackSink bean.
     */
    @Bean
    @ConditionalOnMissingBean(PlaybackSink.class)
    @ConditionalOnProperty(prefix = "talkbox.playback", name = "enabled", havingValue = "true", matchIfMissing = true)
    public JavaSoundPlaybackSink javaSoundPlaybackSink(PlaybackProperties playbackProperties) {
        return new JavaSoundPlaybackSink(playbackProperties);
    }

    @Bean
    public ResponsePipeline responsePipeline(QueueManager queueManager,
                                             AudioPostProcessor audioPostProcessor,
                                             ObjectProvider<ReplyGenerator> replyGenerator,
                                             ObjectProvider<SpeechSynthesizer> speechSynthesizer,
                                             ObjectProvider<PlaybackSink> playbackSink,
                                             ObjectProvider<AvatarController> avatarController,
                                             StopSignal stopSignal,
                                             PipelineMetrics metrics) {
        PipelineCollaborators collaborators = new PipelineCollaborators(
                replyGenerator.getIfAvailable(),
                speechSynthesizer.getIfAvailable(),
                audioPostProcessor,
                playbackSink.getIfAvailable(),
                avatarController.getIfAvailable());
        return new ResponsePipeline(queueManager, collaborators, pipelineProperties, stopSignal, metrics, publisher);
    }

    @Bean
    public AdminCommandHandler adminCommandHandler(QueueManager queueManager,
                                                   ResponsePipeline responsePipeline,
                                                   ConnectionStatusRegistry connectionStatusRegistry) {
        return new AdminCommandHandler(queueManager, responsePipeline, connectionStatusRegistry);
    }

    /**
     * The {@link com.phillippitts.talkbox.service.adapter.InboundEventHandler} adapters are built with.
     */
    @Bean
    public EventIngestionService eventIngestionService(QueueManager queueManager,
                                                       ObjectProvider<SpeechRecognizer> speechRecognizer,
                                                       AdminCommandHandler adminCommandHandler,
                                                       PipelineMetrics metrics) {
        return new EventIngestionService(queueManager, speechRecognizer.getIfAvailable(),
                adminCommandHandler, metrics, publisher);
    }

    @Bean
    public LifecycleCoordinator lifecycleCoordinator(QueueManager queueManager,
                                                     ResponsePipeline responsePipeline,
                                                     ObjectProvider<InteractiveAdapter> adapters,
                                                     ObjectProvider<AvatarController> avatarController,
                                                     StopSignal stopSignal,
                                                     TaskGroup taskGroup) {
        return new LifecycleCoordinator(queueManager, responsePipeline, adapters.orderedStream().toList(),
                avatarController.getIfAvailable(), stopSignal, taskGroup,
                lifecycleProperties, supervisorProperties, publisher);
    }
}
