package com.example.SmartDairy.client;

import com.example.SmartDairy.config.SmartDairyProperties;
import com.example.SmartDairy.exception.TabularExecutionException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonTabularExecutorTest {

    private static final String HOSTILE_QUERY = "avg\"; import os; os.system('touch /tmp/owned') #";

    @Test
    void passesFileAndQueryAsSeparateArguments() {
        assumeTrue(pythonAvailable(), "python3 not installed");
        PythonTabularExecutor executor = new PythonTabularExecutor(properties("tabular/echo_arguments.py"));

        String output = executor.analyze(Path.of("/data/herd.csv"), HOSTILE_QUERY);

        assertEquals("/data/herd.csv\n" + HOSTILE_QUERY, output);
    }

    @Test
    void nonZeroExitCarriesScriptOutput() {
        assumeTrue(pythonAvailable(), "python3 not installed");
        PythonTabularExecutor executor = new PythonTabularExecutor(properties("tabular/failing_analysis.py"));

        TabularExecutionException e = assertThrows(TabularExecutionException.class,
                () -> executor.analyze(Path.of("/data/herd.csv"), "average milk yield"));

        assertEquals("Error tokenizing data: expected 3 fields in line 7, saw 5", e.getMessage());
    }

    @Test
    void missingInterpreterIsReportedAsExecutionFailure() {
        SmartDairyProperties properties = new SmartDairyProperties();
        properties.getTabular().setPythonCommand("smartdairy-no-such-python");
        PythonTabularExecutor executor = new PythonTabularExecutor(properties);

        TabularExecutionException e = assertThrows(TabularExecutionException.class,
                () -> executor.analyze(Path.of("herd.csv"), "average milk yield"));

        assertTrue(e.getMessage().startsWith("could not run smartdairy-no-such-python"), e.getMessage());
    }

    @Test
    void missingScriptFailsAtStartup() {
        SmartDairyProperties properties = new SmartDairyProperties();
        properties.getTabular().setScript("tabular/not_there.py");

        assertThrows(RuntimeException.class, () -> new PythonTabularExecutor(properties));
    }

    private static SmartDairyProperties properties(String script) {
        SmartDairyProperties properties = new SmartDairyProperties();
        properties.getTabular().setScript(script);
        return properties;
    }

    private static boolean pythonAvailable() {
        try {
            Process process = new ProcessBuilder("python3", "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
