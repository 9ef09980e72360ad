package com.example.SmartDairy.service;

import com.example.SmartDairy.exception.ResourceNotFoundException;
import com.example.SmartDairy.model.FarmDataFile;
import com.example.SmartDairy.model.FarmDataFileSummary;
import com.example.SmartDairy.repository.FarmDataFileRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FarmDataCatalogServiceTest {

    private FarmDataFileRepository repository;
    private FarmDataCatalogService service;

    @BeforeEach
    void setUp() {
        repository = mock(FarmDataFileRepository.class);
        service = new FarmDataCatalogService(repository, new ObjectMapper());
    }

    @Test
    void listsFilesWithParsedColumns() {
        FarmDataFile good = file("file-b", "[\"cow_id\",\"date\",\"milk_yield\"]");
        FarmDataFile broken = file("file-a", "cow_id,date");
        when(repository.findAllByOrderByUploadedAtDesc()).thenReturn(List.of(good, broken));

        List<FarmDataFileSummary> files = service.listFiles();

        assertEquals(List.of("cow_id", "date", "milk_yield"), files.get(0).columns());
        assertEquals(List.of(), files.get(1).columns());
    }

    @Test
    void deletingUnknownFileFails() {
        when(repository.existsById("missing")).thenReturn(false);

        assertThrows(ResourceNotFoundException.class, () -> service.deleteFile("missing"));
        verify(repository, never()).deleteById(anyString());
    }

    private static FarmDataFile file(String id, String columnsJson) {
        FarmDataFile file = new FarmDataFile();
        file.setId(id);
        file.setFileName(id + ".csv");
        file.setColumnsJson(columnsJson);
        return file;
    }
}
