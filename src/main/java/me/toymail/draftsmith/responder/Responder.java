package me.toymail.draftsmith.responder;

import me.toymail.draftsmith.ResponderException;

/**
 * Text-generation backend.
 *
 * <p>Implementations return their best-effort text even when it is a weak answer;
 * they throw only when the backend itself could not be reached or refused the request.
 */
public interface Responder {

    /**
     * @param systemPrompt instruction channel, kept apart from the user content
     * @param userContent  examples, history and the message being answered
     * @param modelConfig  model name and sampling limits
     * @return the generated reply text
     * @throws ResponderException on quota, authentication or network failures
     */
    String generate(String systemPrompt, String userContent, ModelConfig modelConfig) throws ResponderException;

    /**
     * Short backend name for logs, e.g. "anthropic".
     */
    String providerId();
}
