package me.toymail.draftsmith.responder;

/**
 * Generation parameters passed with every request.
 */
public record ModelConfig(String modelName, int maxTokens, double temperature) {}
