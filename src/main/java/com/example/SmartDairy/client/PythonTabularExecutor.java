package com.example.SmartDairy.client;

import com.example.SmartDairy.config.SmartDairyProperties;
import com.example.SmartDairy.exception.TabularExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the bundled pandas script against a farm data file.
 *
 * <p>The script body, the file path and the user's query are passed as separate process
 * arguments ({@code python3 -c <script> <file> <query>}); nothing is concatenated into
 * executable text, so query content cannot change what runs.</p>
 */
@Component
public class PythonTabularExecutor implements TabularExecutor {

    private static final Logger log = LoggerFactory.getLogger(PythonTabularExecutor.class);

    private static final int MAX_ERROR_SNIPPET = 500;

    private final String pythonCommand;
    private final Duration timeout;
    private final String script;

    public PythonTabularExecutor(SmartDairyProperties properties) {
        SmartDairyProperties.Tabular tabular = properties.getTabular();
        this.pythonCommand = tabular.getPythonCommand();
        this.timeout = tabular.getTimeout();
        this.script = loadScript(tabular.getScript());
    }

    @Override
    public String analyze(Path filePath, String query) {
        List<String> command = List.of(pythonCommand, "-c", script, filePath.toString(), query == null ? "" : query);

        Path output = null;
        try {
            output = Files.createTempFile("farm-data-analysis", ".txt");
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TabularExecutionException("analysis timed out after " + timeout.toSeconds() + "s");
            }

            String text = Files.readString(output, StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0) {
                throw new TabularExecutionException(snippet(text.isEmpty()
                        ? "analysis exited with code " + process.exitValue()
                        : text));
            }
            log.debug("Tabular analysis of {} produced {} chars", filePath.getFileName(), text.length());
            return text;
        } catch (IOException e) {
            throw new TabularExecutionException("could not run " + pythonCommand + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TabularExecutionException("analysis interrupted", e);
        } finally {
            deleteQuietly(output);
        }
    }

    private static String loadScript(String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Tabular analysis script not found on classpath: " + location, e);
        }
    }

    private static String snippet(String text) {
        return text.length() <= MAX_ERROR_SNIPPET ? text : text.substring(0, MAX_ERROR_SNIPPET) + "...";
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temporary analysis output {}", file, e);
        }
    }
}
