package com.smarttodo.service.impl;

import com.smarttodo.PipelineTestConfig;
import com.smarttodo.dto.ContextEntryDraft;
import com.smarttodo.entity.ContextEntry;
import com.smarttodo.enums.EntryType;
import com.smarttodo.event.ContextAnalysisRequestedEvent;
import com.smarttodo.exception.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@RecordApplicationEvents
@Import(PipelineTestConfig.class)
class ContextEntryServiceImplTest {

    @MockitoBean
    private ChatModel chatModel;

    @Autowired
    private ContextEntryServiceImpl contextEntryService;
    @Autowired
    private ApplicationEvents events;

    @Test
    void createEntryDefaultsDateAndRequestsAnalysis() {
        ContextEntry entry = contextEntryService.createEntry(1L, ContextEntryDraft.builder()
                .content("Alice: budget review moved to Friday")
                .entryType(EntryType.EMAIL)
                .build());

        assertThat(entry.getEntryDate()).isEqualTo(LocalDate.of(2025, 6, 2));
        assertThat(entry.getSource()).isEmpty();
        assertThat(entry.getImportanceScore()).isEqualTo(0.5);
        assertThat(entry.getSummary()).isNull();
        assertThat(events.stream(ContextAnalysisRequestedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.getEntryId()).isEqualTo(entry.getId()));
    }

    @Test
    void reanalysisCanBeRequestedByTheOwnerOnly() {
        ContextEntry entry = contextEntryService.createEntry(1L, ContextEntryDraft.builder()
                .content("Standup notes").entryType(EntryType.MEETING).entryDate(LocalDate.of(2025, 5, 30)).build());

        contextEntryService.requestAnalysis(1L, entry.getId());
        assertThat(events.stream(ContextAnalysisRequestedEvent.class)).hasSize(2);

        assertThatThrownBy(() -> contextEntryService.requestAnalysis(2L, entry.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void blankContentIsRejected() {
        assertThatThrownBy(() -> contextEntryService.createEntry(1L,
                ContextEntryDraft.builder().content(" ").entryType(EntryType.NOTE).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(events.stream(ContextAnalysisRequestedEvent.class)).isEmpty();
    }
}
