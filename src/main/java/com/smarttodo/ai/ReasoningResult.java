package com.smarttodo.ai;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.function.Function;

/**
 * Outcome of one call to the reasoning capability: either the JSON object it returned
 * or the reason there is nothing to use.
 */
public sealed interface ReasoningResult permits ReasoningResult.Success, ReasoningResult.Failure {

    enum FailureKind {
        /** Network error, HTTP error or timeout while calling the model. */
        TRANSPORT,
        /** The call succeeded but produced no text. */
        EMPTY_RESPONSE,
        /** The text was not a single JSON object. */
        MALFORMED_RESPONSE
    }

    record Success(ObjectNode payload) implements ReasoningResult {
    }

    record Failure(FailureKind kind, String detail) implements ReasoningResult {
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default <T> T fold(Function<ObjectNode, ? extends T> onSuccess, Function<Failure, ? extends T> onFailure) {
        if (this instanceof Success success) {
            return onSuccess.apply(success.payload());
        }
        return onFailure.apply((Failure) this);
    }
}
