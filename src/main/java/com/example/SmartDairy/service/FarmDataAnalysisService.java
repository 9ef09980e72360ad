package com.example.SmartDairy.service;

import com.example.SmartDairy.client.CompletionClient;
import com.example.SmartDairy.client.PromptMessage;
import com.example.SmartDairy.client.TabularExecutor;
import com.example.SmartDairy.model.AgentAnswer;
import com.example.SmartDairy.model.FarmDataFile;
import com.example.SmartDairy.model.SourceReference;
import com.example.SmartDairy.repository.FarmDataFileRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Tabular analysis path: picks the newest selected farm data file, has the
 * {@link TabularExecutor} summarise it for the question, then turns the summary into
 * plain guidance for the farmer.
 */
@Service
@RequiredArgsConstructor
public class FarmDataAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FarmDataAnalysisService.class);

    static final String NO_FILE_MESSAGE = "I don't have any farm data files to analyze. "
            + "Please upload CSV or Excel files from your herd management software.";

    private static final String SYSTEM_PROMPT = """
            You are a dairy farm data analyst. Interpret the data analysis results and provide clear, \
            actionable insights for dairy producers. Avoid statistical jargon.""";

    private final FarmDataFileRepository farmDataFileRepository;
    private final TabularExecutor tabularExecutor;
    private final CompletionClient completionClient;

    public AgentAnswer analyze(String query, List<String> fileIds) {
        try {
            Optional<FarmDataFile> selected = selectLatest(fileIds);
            if (selected.isEmpty()) {
                return AgentAnswer.withoutSources(NO_FILE_MESSAGE);
            }
            FarmDataFile file = selected.get();
            log.debug("Analyzing farm data file {} ({} rows)", file.getFileName(), file.getRowCount());

            String summary = tabularExecutor.analyze(Path.of(file.getFilePath()), query);

            String narrative = completionClient.complete(List.of(
                    PromptMessage.system(SYSTEM_PROMPT),
                    PromptMessage.user("User Query: " + query
                            + "\n\nData Analysis Results:\n" + summary
                            + "\n\nPlease explain these results in clear, practical terms for a dairy farmer.")
            ));

            return new AgentAnswer(
                    narrative == null || narrative.isBlank() ? summary : narrative,
                    List.of(SourceReference.tabular(file.getFileName()))
            );
        } catch (RuntimeException e) {
            log.warn("Farm data analysis failed: {}", e.getMessage());
            return AgentAnswer.withoutSources("I encountered an error analyzing your farm data: "
                    + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage())
                    + ". Please check that the file is properly formatted.");
        }
    }

    private Optional<FarmDataFile> selectLatest(List<String> fileIds) {
        if (fileIds == null || fileIds.isEmpty()) {
            return Optional.empty();
        }
        return farmDataFileRepository.findFirstByIdInOrderByUploadedAtDesc(fileIds);
    }
}
