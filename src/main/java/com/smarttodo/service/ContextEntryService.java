package com.smarttodo.service;

import com.smarttodo.dto.ContextEntryDraft;
import com.smarttodo.entity.ContextEntry;

import java.util.UUID;

public interface ContextEntryService {

    /**
     * Stores the entry and queues its analysis to run after the insert commits.
     */
    ContextEntry createEntry(Long userId, ContextEntryDraft draft);

    /**
     * Queues a fresh analysis; the previous extracted fields are replaced when it finishes.
     */
    void requestAnalysis(Long userId, UUID entryId);

    ContextEntry getEntry(Long userId, UUID entryId);
}
