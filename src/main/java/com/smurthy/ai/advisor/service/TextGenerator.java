package com.smurthy.ai.advisor.service;

/**
 * External text-generation capability, used for both intent classification and answer synthesis.
 */
public interface TextGenerator {

    /**
     * @param prompt      fully rendered prompt
     * @param temperature sampling temperature
     * @param maxTokens   cap on generated tokens
     * @return generated text, never null
     */
    String generate(String prompt, double temperature, int maxTokens);
}
