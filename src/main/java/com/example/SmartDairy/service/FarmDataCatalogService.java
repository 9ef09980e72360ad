package com.example.SmartDairy.service;

import com.example.SmartDairy.exception.ResourceNotFoundException;
import com.example.SmartDairy.model.FarmDataFile;
import com.example.SmartDairy.model.FarmDataFileSummary;
import com.example.SmartDairy.repository.FarmDataFileRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class FarmDataCatalogService {

    private static final Logger log = LoggerFactory.getLogger(FarmDataCatalogService.class);

    private static final TypeReference<List<String>> COLUMN_LIST = new TypeReference<>() {};

    private final FarmDataFileRepository farmDataFileRepository;
    private final ObjectMapper objectMapper;

    public List<FarmDataFileSummary> listFiles() {
        return farmDataFileRepository.findAllByOrderByUploadedAtDesc().stream()
                .map(file -> new FarmDataFileSummary(
                        file.getId(),
                        file.getFileName(),
                        file.getFileType(),
                        file.getRowCount(),
                        parseColumns(file),
                        file.getUploadedAt()
                ))
                .toList();
    }

    public void deleteFile(String fileId) {
        if (!farmDataFileRepository.existsById(fileId)) {
            throw new ResourceNotFoundException("Farm data file not found: " + fileId);
        }
        farmDataFileRepository.deleteById(fileId);
    }

    private List<String> parseColumns(FarmDataFile file) {
        if (file.getColumnsJson() == null || file.getColumnsJson().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(file.getColumnsJson(), COLUMN_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable column list for farm data file {}", file.getId(), e);
            return List.of();
        }
    }
}
