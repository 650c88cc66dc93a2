package com.smarttodo.exception;

public class RecommendationStateException extends RuntimeException {

    public RecommendationStateException(String message) {
        super(message);
    }
}
