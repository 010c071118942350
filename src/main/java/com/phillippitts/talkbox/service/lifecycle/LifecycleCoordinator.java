package com.phillippitts.talkbox.service.lifecycle;

import com.phillippitts.talkbox.config.properties.LifecycleProperties;
import com.phillippitts.talkbox.config.properties.SupervisorProperties;
import com.phillippitts.talkbox.service.adapter.InteractiveAdapter;
import com.phillippitts.talkbox.service.avatar.AvatarController;
import com.phillippitts.talkbox.service.pipeline.ResponsePipeline;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.supervisor.ConnectionSupervisor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts every subsystem in dependency order and shuts them down in a fixed, idempotent order.
 *
 * <p><b>Startup:</b>
 * <ol>
 *   <li>Connect the avatar (best-effort; the system runs without it on failure)</li>
 *   <li>Spawn the response pipeline loop</li>
 *   <li>Spawn one connection supervisor per interactive adapter</li>
 *   <li>Spawn the idle animation loop when the avatar connected and animation is enabled</li>
 * </ol>
 *
 * <p><b>Shutdown:</b> trips the stop signal, then
 * <ol>
 *   <li>Stop every adapter</li>
 *   <li>Disconnect the avatar, if it connected</li>
 *   <li>Stop the queue</li>
 *   <li>Cancel background tasks: grace period, then interrupt</li>
 * </ol>
 * Each step is best-effort: failures are logged at DEBUG, recorded in the {@link ShutdownReport}
 * and never stop later steps. Only the first call does anything; later calls return an
 * "already stopping" report without touching any collaborator.
 *
 * <p>Runs as a Spring {@link SmartLifecycle}, so the container starts it after all beans are ready
 * and stops it before they are destroyed.
 */
public class LifecycleCoordinator implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(LifecycleCoordinator.class);

    private final QueueManager queue;
    private final ResponsePipeline pipeline;
    private final List<InteractiveAdapter> adapters;
    private final AvatarController avatar;
    private final StopSignal stopSignal;
    private final TaskGroup taskGroup;
    private final LifecycleProperties lifecycleProps;
    private final SupervisorProperties supervisorProps;
    private final ApplicationEventPublisher publisher;

    private final List<ConnectionSupervisor> supervisors = new CopyOnWriteArrayList<>();
    // Held by start() and by the entry of shutdown(), so spawning never overlaps task cancellation.
    private final Object lifecycleMonitor = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile boolean running;
    private volatile boolean avatarConnected;

    /**
     * @param avatar avatar controller, or null when the application has none
     */
    public LifecycleCoordinator(QueueManager queue,
                                ResponsePipeline pipeline,
                                List<InteractiveAdapter> adapters,
                                AvatarController avatar,
                                StopSignal stopSignal,
                                TaskGroup taskGroup,
                                LifecycleProperties lifecycleProps,
                                SupervisorProperties supervisorProps,
                                ApplicationEventPublisher publisher) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.adapters = List.copyOf(Objects.requireNonNull(adapters, "adapters"));
        this.avatar = avatar;
        this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal");
        this.taskGroup = Objects.requireNonNull(taskGroup, "taskGroup");
        this.lifecycleProps = Objects.requireNonNull(lifecycleProps, "lifecycleProps");
        this.supervisorProps = Objects.requireNonNull(supervisorProps, "supervisorProps");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (stopping.get() || !started.compareAndSet(false, true)) {
                return;
            }
            LOG.info("Starting TalkBox: {} adapter(s), avatar={}", adapters.size(), avatar != null);

            connectAvatar();

            taskGroup.spawn("pipeline", pipeline::run);

            for (InteractiveAdapter adapter : adapters) {
                ConnectionSupervisor supervisor = new ConnectionSupervisor(adapter.name(), adapter::start,
                        supervisorProps.getBackoffInterval(), stopSignal, publisher);
                supervisors.add(supervisor);
                taskGroup.spawn("supervisor-" + adapter.name(), supervisor::run);
            }

            if (avatarConnected && lifecycleProps.isAnimationEnabled()) {
                IdleAnimationLoop loop = new IdleAnimationLoop(avatar,
                        lifecycleProps.getAnimationFrameInterval(), stopSignal);
                taskGroup.spawn("idle-animation", loop::run);
            }

            running = true;
            LOG.info("TalkBox started");
        }
    }

    /** Spring stop callback; delegates to {@link #shutdown()}. */
    @Override
    public void stop() {
        shutdown();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Stops everything in order. Safe to call from any thread, any number of times.
     *
     * @return step results for the first call; an "already stopping" report afterwards
     */
    public ShutdownReport shutdown() {
        synchronized (lifecycleMonitor) {
            if (!stopping.compareAndSet(false, true)) {
                LOG.debug("Shutdown already in progress; ignoring repeated request");
                return ShutdownReport.alreadyStoppingReport();
            }
            stopSignal.trip();
        }
        long t0 = System.nanoTime();
        LOG.info("Shutting down TalkBox");

        List<StepResult> steps = new ArrayList<>();
        for (ConnectionSupervisor supervisor : supervisors) {
            supervisor.requestStop();
        }
        for (InteractiveAdapter adapter : adapters) {
            steps.add(runStep("stop-adapter:" + adapter.name(), adapter::stop));
        }
        if (avatarConnected) {
            pipeline.setAvatarConnected(false);
            steps.add(runStep("disconnect-avatar", avatar::disconnect));
            avatarConnected = false;
        } else {
            steps.add(StepResult.skipped("disconnect-avatar"));
        }
        steps.add(runStep("stop-queue", queue::stop));
        steps.add(cancelTasks());

        running = false;
        ShutdownReport report = new ShutdownReport(false, steps, Duration.ofNanos(System.nanoTime() - t0));
        if (report.allSucceeded()) {
            LOG.info("TalkBox stopped in {}ms", report.elapsed().toMillis());
        } else {
            LOG.info("TalkBox stopped in {}ms with {} failed step(s): {}", report.elapsed().toMillis(),
                    report.failures().size(), report.failures());
        }
        return report;
    }

    public boolean isStopping() {
        return stopping.get();
    }

    public boolean isAvatarConnected() {
        return avatarConnected;
    }

    Optional<ConnectionSupervisor> supervisor(String adapterName) {
        return supervisors.stream().filter(s -> s.getName().equals(adapterName)).findFirst();
    }

    private void connectAvatar() {
        if (avatar == null) {
            LOG.info("No avatar controller configured; running without avatar");
            return;
        }
        try {
            avatar.connect();
            avatarConnected = true;
            pipeline.setAvatarConnected(true);
            LOG.info("Avatar connected");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while connecting avatar; continuing without avatar");
        } catch (Exception e) {
            LOG.warn("Avatar connection failed: {}; continuing without avatar", e.toString());
        }
    }

    private StepResult cancelTasks() {
        String name = "cancel-tasks";
        try {
            TaskGroup.CancelSummary summary = taskGroup.cancelAll(lifecycleProps.getShutdownGrace());
            if (summary.isClean()) {
                return StepResult.ok(name);
            }
            String error = "unresponsive tasks: " + summary.unresponsive();
            LOG.debug("Step {} failed: {}", name, error);
            return StepResult.failed(name, error);
        } catch (RuntimeException e) {
            LOG.debug("Step {} failed: {}", name, e.toString());
            return StepResult.failed(name, e.toString());
        }
    }

    private StepResult runStep(String name, ShutdownAction action) {
        try {
            action.run();
            return StepResult.ok(name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Step {} interrupted", name);
            return StepResult.failed(name, "interrupted");
        } catch (Exception e) {
            LOG.debug("Step {} failed: {}", name, e.toString());
            return StepResult.failed(name, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    @FunctionalInterface
    private interface ShutdownAction {
        void run() throws Exception;
    }
}
