package com.wordwatch.bot.service;

/**
 * What the chat platform must provide for one inbound message. The core reads
 * the identifiers and text and never touches a concrete platform type; the two
 * actions are only invoked by {@link DecisionExecutor}.
 */
public interface ModerationEvent {
    String getGroupId();

    String getUserId();

    String getUserName();

    String getText();

    /**
     * @return platform role label such as {@code owner} or {@code admin}, or null
     */
    String getRole();

    boolean deleteMessage();

    boolean setBan(long durationSeconds);

    default InboundMessage toInboundMessage() {
        return new InboundMessage(getGroupId(), getUserId(), getUserName(), getText());
    }
}
