package dev.univer.fintrack.bot;

/** A text message from a contributor, stripped of transport details. */
public record InboundMessage(long chatId, long contributorId, String displayName, String text) {}
