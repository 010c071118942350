package com.phillippitts.talkbox.service.admin;

import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.pipeline.PipelineStats;
import com.phillippitts.talkbox.service.pipeline.ResponsePipeline;
import com.phillippitts.talkbox.service.queue.QueueManager;
import com.phillippitts.talkbox.service.queue.QueueSnapshot;
import com.phillippitts.talkbox.service.supervisor.ConnectionStatus;
import com.phillippitts.talkbox.service.supervisor.ConnectionStatusRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Executes "!" commands sent by admins.
 *
 * <p>Supported commands:
 * <ul>
 *   <li>{@code !status} - queue, pipeline and connection summary</li>
 *   <li>{@code !queue clear} - drop all pending items</li>
 *   <li>{@code !pause} / {@code !resume} - stop or restart accepting and processing items</li>
 *   <li>{@code !source <voice|text|live-chat> <on|off>} - enable or disable a source</li>
 *   <li>{@code !skip} - cancel the item in flight at its next stage</li>
 * </ul>
 *
 * <p>Messages from non-admins, and admin messages without the prefix, are not commands and flow
 * into the queue as ordinary text.
 */
public class AdminCommandHandler {

    private static final Logger LOG = LogManager.getLogger(AdminCommandHandler.class);

    static final String PREFIX = "!";
    static final String HELP = "Commands: !status, !queue clear, !pause, !resume, "
            + "!source <voice|text|live-chat> <on|off>, !skip";

    private final QueueManager queue;
    private final ResponsePipeline pipeline;
    private final ConnectionStatusRegistry connections;

    public AdminCommandHandler(QueueManager queue, ResponsePipeline pipeline, ConnectionStatusRegistry connections) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.connections = Objects.requireNonNull(connections, "connections");
    }

    /**
     * Runs {@code text} as a command if it is one.
     *
     * @return the reply for the admin, or empty when the text is not an admin command
     */
    public Optional<String> handle(String userId, String text) {
        if (text == null || !text.strip().startsWith(PREFIX) || !queue.isAdmin(userId)) {
            return Optional.empty();
        }
        String[] parts = text.strip().substring(PREFIX.length()).strip().toLowerCase(Locale.ROOT).split("\\s+");
        LOG.info("Admin command from {}: {}", userId, String.join(" ", parts));
        String reply = switch (parts[0]) {
            case "status" -> status();
            case "queue" -> queueCommand(parts);
            case "pause" -> {
                queue.pause();
                yield "Queue paused";
            }
            case "resume" -> {
                queue.resume();
                yield "Queue resumed";
            }
            case "source" -> sourceCommand(parts);
            case "skip" -> pipeline.cancelCurrent()
                    .map(id -> "Skipping " + id)
                    .orElse("Nothing is playing");
            default -> "Unknown command. " + HELP;
        };
        return Optional.of(reply);
    }

    private String queueCommand(String[] parts) {
        if (parts.length == 2 && parts[1].equals("clear")) {
            return "Cleared " + queue.clear() + " item(s)";
        }
        return "Usage: !queue clear";
    }

    private String sourceCommand(String[] parts) {
        if (parts.length != 3) {
            return "Usage: !source <voice|text|live-chat> <on|off>";
        }
        Source source;
        try {
            source = Source.fromWireName(parts[1]);
        } catch (IllegalArgumentException e) {
            return "Unknown source '" + parts[1] + "'. Use voice, text or live-chat";
        }
        switch (parts[2]) {
            case "on" -> queue.enableSource(source);
            case "off" -> queue.disableSource(source);
            default -> {
                return "Usage: !source <voice|text|live-chat> <on|off>";
            }
        }
        return "Source " + source + " " + ("on".equals(parts[2]) ? "enabled" : "disabled");
    }

    private String status() {
        QueueSnapshot q = queue.snapshot();
        PipelineStats p = pipeline.stats();
        List<ConnectionStatus> conns = connections.statuses();

        StringBuilder sb = new StringBuilder();
        sb.append("Queue ").append(q.size()).append('/').append(q.capacity())
                .append(" (admin ").append(q.adminCount()).append(", normal ").append(q.normalCount()).append(')');
        if (q.paused()) {
            sb.append(", paused");
        }
        if (!q.disabledSources().isEmpty()) {
            sb.append(", disabled: ").append(q.disabledSources().stream()
                    .map(Source::wireName).sorted().collect(Collectors.joining(",")));
        }
        sb.append(" | Processed ").append(p.processed())
                .append(" (completed ").append(p.completed())
                .append(", aborted ").append(p.aborted()).append(')');
        p.currentItem().ifPresent(id -> sb.append(", now ").append(id));
        if (!conns.isEmpty()) {
            sb.append(" | ").append(conns.stream()
                    .map(c -> c.name() + "=" + c.state())
                    .collect(Collectors.joining(", ")));
        }
        return sb.toString();
    }
}
