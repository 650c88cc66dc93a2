package com.smarttodo.ai;

/**
 * One prompt for the reasoning capability.
 *
 * @param instruction role-style system instruction
 * @param prompt      task-specific user prompt carrying the data
 * @param temperature sampling temperature
 * @param maxTokens   output token budget
 */
public record ReasoningRequest(String instruction, String prompt, double temperature, int maxTokens) {
}
