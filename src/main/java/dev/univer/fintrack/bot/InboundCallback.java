package dev.univer.fintrack.bot;

/** A pressed inline button; {@code token} is the callback data of the chosen option. */
public record InboundCallback(long chatId, long contributorId, String displayName, String queryId, String token) {}
