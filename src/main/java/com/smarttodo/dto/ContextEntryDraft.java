package com.smarttodo.dto;

import com.smarttodo.enums.EntryType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextEntryDraft {
    private String content;
    private EntryType entryType;
    private LocalDate entryDate;
    private String source;
}
