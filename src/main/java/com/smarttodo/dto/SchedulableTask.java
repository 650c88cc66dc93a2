package com.smarttodo.dto;

import java.time.Duration;
import java.util.UUID;

public record SchedulableTask(UUID id, String title, int priority, Duration estimatedDuration) {
}
