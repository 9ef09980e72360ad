package com.example.SmartDairy.service;

import com.example.SmartDairy.model.ChatRequest;
import com.example.SmartDairy.model.QueryLog;
import com.example.SmartDairy.model.StrategyLabel;
import com.example.SmartDairy.repository.QueryLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class QueryLogService {

    private static final Logger log = LoggerFactory.getLogger(QueryLogService.class);

    private final QueryLogRepository queryLogRepository;
    private final ObjectMapper objectMapper;

    public QueryLog recordQuery(ChatRequest request, StrategyLabel strategy) {
        QueryLog queryLog = new QueryLog();
        queryLog.setSessionId(request.sessionId());
        queryLog.setQuery(request.message());
        queryLog.setQueryType(strategy);
        queryLog.setDocumentsJson(serializeIds(request.documents()));
        queryLog.setCsvFile(request.csvFiles().isEmpty() ? null : request.csvFiles().get(0));
        queryLog.setTriggeredWebSearch(strategy.triggersWebSearch());

        return queryLogRepository.save(queryLog);
    }

    private String serializeIds(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize document ids for query log", e);
            return "[]";
        }
    }
}
