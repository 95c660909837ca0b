package com.wordwatch.bot.service;

public record InboundMessage(String groupId, String userId, String userName, String text) {}
