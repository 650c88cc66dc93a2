package com.smarttodo.service.impl;

import com.smarttodo.dto.ContextEntryDraft;
import com.smarttodo.entity.ContextEntry;
import com.smarttodo.event.ContextAnalysisRequestedEvent;
import com.smarttodo.exception.ResourceNotFoundException;
import com.smarttodo.repository.ContextEntryRepository;
import com.smarttodo.service.ContextEntryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContextEntryServiceImpl implements ContextEntryService {

    private final ContextEntryRepository contextEntryRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public ContextEntry createEntry(Long userId, ContextEntryDraft draft) {
        if (draft.getContent() == null || draft.getContent().isBlank()) {
            throw new IllegalArgumentException("Context entry content is required");
        }
        if (draft.getEntryType() == null) {
            throw new IllegalArgumentException("Context entry type is required");
        }
        ContextEntry entry = new ContextEntry();
        entry.setUserId(userId);
        entry.setContent(draft.getContent());
        entry.setEntryType(draft.getEntryType());
        entry.setEntryDate(draft.getEntryDate() != null ? draft.getEntryDate() : LocalDate.now(clock));
        entry.setSource(draft.getSource() == null ? "" : draft.getSource());

        ContextEntry saved = contextEntryRepository.save(entry);
        log.info("Created context entry {} ({}) for user {}", saved.getId(), saved.getEntryType(), userId);

        eventPublisher.publishEvent(new ContextAnalysisRequestedEvent(this, saved.getId()));
        return saved;
    }

    @Override
    public void requestAnalysis(Long userId, UUID entryId) {
        ContextEntry entry = getEntry(userId, entryId);
        eventPublisher.publishEvent(new ContextAnalysisRequestedEvent(this, entry.getId()));
    }

    @Override
    @Transactional(readOnly = true)
    public ContextEntry getEntry(Long userId, UUID entryId) {
        return contextEntryRepository.findById(entryId)
                .filter(entry -> entry.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Context entry", entryId));
    }
}
