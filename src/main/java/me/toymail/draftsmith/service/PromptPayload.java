package me.toymail.draftsmith.service;

/**
 * What is sent to the responder: the system text on its own channel,
 * everything else as user content.
 */
public record PromptPayload(String systemText, String userContent) {}
