package com.example.SmartDairy.service;

import com.example.SmartDairy.model.ChatRequest;
import com.example.SmartDairy.model.QueryLog;
import com.example.SmartDairy.model.StrategyLabel;
import com.example.SmartDairy.repository.QueryLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QueryLogServiceTest {

    private QueryLogService service;

    @BeforeEach
    void setUp() {
        QueryLogRepository repository = mock(QueryLogRepository.class);
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        service = new QueryLogService(repository, new ObjectMapper());
    }

    @Test
    void recordsSelectionAndFirstDataFile() {
        ChatRequest request = new ChatRequest("average milk yield", "session-1",
                List.of("doc-1", "doc-2"), List.of("file-1", "file-2"));

        QueryLog log = service.recordQuery(request, StrategyLabel.TABULAR_ANALYSIS);

        assertEquals("session-1", log.getSessionId());
        assertEquals(StrategyLabel.TABULAR_ANALYSIS, log.getQueryType());
        assertEquals("[\"doc-1\",\"doc-2\"]", log.getDocumentsJson());
        assertEquals("file-1", log.getCsvFile());
        assertFalse(log.isTriggeredWebSearch());
    }

    @Test
    void webStrategiesAreFlagged() {
        ChatRequest request = new ChatRequest("latest regulations", "session-1", null, null);

        assertTrue(service.recordQuery(request, StrategyLabel.WEB_LOOKUP).isTriggeredWebSearch());
        assertTrue(service.recordQuery(request, StrategyLabel.HYBRID).isTriggeredWebSearch());
        assertNull(service.recordQuery(request, StrategyLabel.GENERAL).getCsvFile());
        assertEquals("[]", service.recordQuery(request, StrategyLabel.GENERAL).getDocumentsJson());
    }
}
