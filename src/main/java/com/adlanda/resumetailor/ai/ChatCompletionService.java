package com.adlanda.resumetailor.ai;

/**
 * Sends a single-turn prompt to a chat model and returns the raw text answer.
 */
public interface ChatCompletionService {

    String complete(String model, double temperature, String prompt);
}
