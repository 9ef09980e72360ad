package com.example.SmartDairy.service;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.client.PromptMessage;
import com.example.SmartDairy.client.TabularExecutor;
import com.example.SmartDairy.exception.TabularExecutionException;
import com.example.SmartDairy.model.AgentAnswer;
import com.example.SmartDairy.model.FarmDataFile;
import com.example.SmartDairy.model.SourceReference;
import com.example.SmartDairy.repository.FarmDataFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FarmDataAnalysisServiceTest {

    private static final String SUMMARY = """
            Dataset: 120 rows
            milk_yield mean 31.4
            milk_yield std 4.2""";

    private FarmDataFileRepository repository;
    private TabularExecutor tabularExecutor;
    private CompletionClient completionClient;
    private FarmDataAnalysisService service;

    @BeforeEach
    void setUp() {
        repository = mock(FarmDataFileRepository.class);
        tabularExecutor = mock(TabularExecutor.class);
        completionClient = mock(CompletionClient.class);
        service = new FarmDataAnalysisService(repository, tabularExecutor, completionClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyzesNewestSelectedFileAndCitesIt() {
        FarmDataFile file = file("herd_2024.csv", "/data/uploads/herd_2024.csv");
        when(repository.findFirstByIdInOrderByUploadedAtDesc(List.of("file-a", "file-b"))).thenReturn(Optional.of(file));
        when(tabularExecutor.analyze(Path.of("/data/uploads/herd_2024.csv"), "What is the average milk yield?"))
                .thenReturn(SUMMARY);
        when(completionClient.complete(anyList())).thenReturn("Your herd averages about 31 litres per cow per day.");

        AgentAnswer answer = service.analyze("What is the average milk yield?", List.of("file-a", "file-b"));

        assertEquals("Your herd averages about 31 litres per cow per day.", answer.text());
        assertEquals(List.of(SourceReference.tabular("herd_2024.csv")), answer.sources());

        ArgumentCaptor<List<PromptMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(completionClient).complete(captor.capture());
        String prompt = captor.getValue().get(1).content();
        assertTrue(prompt.contains("What is the average milk yield?"));
        assertTrue(prompt.contains(SUMMARY));
    }

    @Test
    void noSelectedFileGivesGuidanceWithoutRunningAnything() {
        AgentAnswer answer = service.analyze("What is the average milk yield?", List.of());

        assertEquals(FarmDataAnalysisService.NO_FILE_MESSAGE, answer.text());
        assertTrue(answer.sources().isEmpty());
        verifyNoInteractions(repository, tabularExecutor, completionClient);
    }

    @Test
    void unknownFileIdsGiveGuidance() {
        when(repository.findFirstByIdInOrderByUploadedAtDesc(anyCollection())).thenReturn(Optional.empty());

        AgentAnswer answer = service.analyze("herd size?", List.of("gone"));

        assertEquals(FarmDataAnalysisService.NO_FILE_MESSAGE, answer.text());
        verifyNoInteractions(tabularExecutor);
    }

    @Test
    void executorFailureIsReportedWithDetail() {
        when(repository.findFirstByIdInOrderByUploadedAtDesc(anyCollection()))
                .thenReturn(Optional.of(file("broken.csv", "/data/uploads/broken.csv")));
        when(tabularExecutor.analyze(any(Path.class), any()))
                .thenThrow(new TabularExecutionException("Error tokenizing data"));

        AgentAnswer answer = service.analyze("average milk", List.of("file-a"));

        assertEquals("I encountered an error analyzing your farm data: Error tokenizing data. "
                + "Please check that the file is properly formatted.", answer.text());
        assertTrue(answer.sources().isEmpty());
        verify(completionClient, never()).complete(anyList());
    }

    @Test
    void blankNarrativeFallsBackToRawSummary() {
        when(repository.findFirstByIdInOrderByUploadedAtDesc(anyCollection()))
                .thenReturn(Optional.of(file("herd.csv", "/data/uploads/herd.csv")));
        when(tabularExecutor.analyze(any(Path.class), any())).thenReturn(SUMMARY);
        when(completionClient.complete(anyList())).thenReturn("");

        AgentAnswer answer = service.analyze("average milk", List.of("file-a"));

        assertEquals(SUMMARY, answer.text());
        assertEquals(1, answer.sources().size());
    }

    private static FarmDataFile file(String name, String path) {
        FarmDataFile file = new FarmDataFile();
        file.setId(name);
        file.setFileName(name);
        file.setFilePath(path);
        file.setFileType("csv");
        file.setRowCount(120);
        file.setColumnsJson("[\"cow_id\",\"date\",\"milk_yield\"]");
        return file;
    }
}
