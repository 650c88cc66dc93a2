package com.smarttodo.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record TimeBlockCandidate(UUID taskId, LocalDateTime start, LocalDateTime end, String reasoning) {
}
