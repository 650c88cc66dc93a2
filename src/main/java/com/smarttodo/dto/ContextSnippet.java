package com.smarttodo.dto;

import java.time.LocalDate;
import java.util.UUID;

/**
 * The part of a context entry that is shown to the model.
 */
public record ContextSnippet(UUID id, String entryType, LocalDate entryDate, String content) {
}
