package com.wordwatch.bot.listener;

import com.wordwatch.bot.service.ModerationEvent;
import java.time.Duration;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discord side of {@link ModerationEvent}. The actions block on the REST call,
 * so they must run off the gateway thread.
 */
public class DiscordModerationEvent implements ModerationEvent {
    private static final Logger log = LoggerFactory.getLogger(DiscordModerationEvent.class);
    // Discord rejects timeouts longer than 28 days.
    private static final Duration MAX_TIMEOUT = Duration.ofDays(28);

    private final Message message;
    private final Member member;
    private final String staffRoleId;

    public DiscordModerationEvent(Message message, Member member, String staffRoleId) {
        this.message = message;
        this.member = member;
        this.staffRoleId = staffRoleId;
    }

    @Override
    public String getGroupId() {
        return message.getGuild().getId();
    }

    @Override
    public String getUserId() {
        return member.getId();
    }

    @Override
    public String getUserName() {
        return member.getEffectiveName();
    }

    @Override
    public String getText() {
        return message.getContentDisplay();
    }

    @Override
    public String getRole() {
        if (member.isOwner()) {
            return "owner";
        }
        if (member.hasPermission(Permission.ADMINISTRATOR)) {
            return "admin";
        }
        if (staffRoleId != null && member.getRoles().stream().map(Role::getId).anyMatch(staffRoleId::equals)) {
            return "staff";
        }
        return null;
    }

    @Override
    public boolean deleteMessage() {
        try {
            message.delete().complete();
            return true;
        } catch (RuntimeException error) {
            log.warn("Could not delete message {}: {}", message.getId(), error.getMessage());
            return false;
        }
    }

    @Override
    public boolean setBan(long durationSeconds) {
        Duration duration = Duration.ofSeconds(durationSeconds);
        if (duration.compareTo(MAX_TIMEOUT) > 0) {
            duration = MAX_TIMEOUT;
        }
        try {
            member.timeoutFor(duration).complete();
            return true;
        } catch (RuntimeException error) {
            log.warn("Could not time out {}: {}", member.getId(), error.getMessage());
            return false;
        }
    }

    Member member() {
        return member;
    }
}
