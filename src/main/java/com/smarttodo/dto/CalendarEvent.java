package com.smarttodo.dto;

import java.time.LocalDateTime;

/**
 * An already committed calendar event the schedule must work around.
 */
public record CalendarEvent(String title, LocalDateTime start, LocalDateTime end) {
}
