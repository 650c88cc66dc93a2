package com.smarttodo.dto;

public record TaskInput(String title, String description, int priority) {
}
