package com.wordwatch.bot.listener;

import com.wordwatch.bot.config.MonitorConfig;
import com.wordwatch.bot.service.DecisionExecutor;
import com.wordwatch.bot.service.ModerationOrchestrator;
import com.wordwatch.bot.service.ModerationOutcome;
import java.time.Instant;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MessageModerationListener extends ListenerAdapter {
    private static final Logger log = LoggerFactory.getLogger(MessageModerationListener.class);
    private static final int PREVIEW_LENGTH = 100;

    private final MonitorConfig config;
    private final ModerationOrchestrator orchestrator;
    private final DecisionExecutor executor;

    public MessageModerationListener(MonitorConfig config, ModerationOrchestrator orchestrator, DecisionExecutor executor) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.executor = executor;
    }

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (!event.isFromGuild()) {
            return;
        }
        Message message = event.getMessage();
        if (message.getAuthor().isBot() || event.isWebhookMessage()) {
            return;
        }
        Member member = event.getMember();
        if (member == null) {
            return;
        }

        DiscordModerationEvent moderationEvent = new DiscordModerationEvent(message, member, config.staffRoleId());
        orchestrator.submit(moderationEvent.toInboundMessage()).whenComplete((outcome, error) -> {
            if (error != null) {
                log.warn("Moderation of message {} did not finish: {}", message.getId(), error.toString());
                return;
            }
            if (outcome.isViolation()) {
                act(event.getChannel(), moderationEvent, outcome.decision());
            }
        });
    }

    private void act(MessageChannel origin, DiscordModerationEvent moderationEvent, ModerationOutcome.Decision decision) {
        DecisionExecutor.ExecutionReport report = executor.apply(moderationEvent, decision);
        sendNotice(origin, moderationEvent.member(), decision, report);
        logModerationAction(origin, moderationEvent.member(), decision, report);
    }

    private void sendNotice(
            MessageChannel origin,
            Member member,
            ModerationOutcome.Decision decision,
            DecisionExecutor.ExecutionReport report
    ) {
        StringBuilder notice = new StringBuilder(member.getAsMention())
                .append(" your message contained blocked terms (violation #")
                .append(decision.tier())
                .append(" today).");
        if (report.banned()) {
            notice.append(" You have been timed out for ").append(formatDuration(decision.banDurationSeconds())).append('.');
        }
        origin.sendMessage(notice.toString()).queue();
    }

    private void logModerationAction(
            MessageChannel origin,
            Member member,
            ModerationOutcome.Decision decision,
            DecisionExecutor.ExecutionReport report
    ) {
        MessageChannel modChannel = resolveModLogChannel(origin);
        if (modChannel == null) {
            return;
        }
        EmbedBuilder builder = new EmbedBuilder()
                .setTitle(decision.severe() ? "Repeat offender: violation #" + decision.tier() : "Auto-moderation action")
                .addField("Member", member.getUser().getName() + " (" + member.getId() + ")", true)
                .addField("Channel", origin.getAsMention(), true)
                .addField("Source", decision.source().name(), true)
                .addField("Matched words", String.join(", ", decision.matchedWords()), false)
                .addField("Content", preview(decision.sourceText()), false)
                .addField("Violation day", decision.violationDay().toString(), true)
                .addField("Timeout", report.banned() ? formatDuration(decision.banDurationSeconds())
                        : report.exempt() ? "exempt role" : "none", true)
                .addField("Message removed", String.valueOf(report.deleted()), true)
                .setTimestamp(Instant.now())
                .setColor(decision.severe() ? 0xE11D48 : 0xEF4444);
        modChannel.sendMessageEmbeds(builder.build()).queue();
    }

    private MessageChannel resolveModLogChannel(MessageChannel origin) {
        if (config.modLogChannelId() == null) {
            return null;
        }
        return origin.getJDA().getChannelById(MessageChannel.class, config.modLogChannelId());
    }

    static String formatDuration(long seconds) {
        if (seconds >= 3600) {
            return (seconds / 3600) + " hour(s)";
        }
        if (seconds >= 60) {
            return (seconds / 60) + " minute(s)";
        }
        return seconds + " second(s)";
    }

    private static String preview(String content) {
        if (content == null || content.isBlank()) {
            return "n/a";
        }
        String normalized = content.trim().replaceAll("\\s+", " ");
        if (normalized.length() <= PREVIEW_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, PREVIEW_LENGTH - 3) + "...";
    }
}
