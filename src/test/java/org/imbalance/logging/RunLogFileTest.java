package org.imbalance.logging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunLogFileTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Log lines go to a timestamped file, without colors, while the file is open")
    void redirectsToFile() throws Exception {
        Path file;
        try (RunLogFile logFile = RunLogFile.open(tempDir, "Sampling", false)) {
            assertThat(logFile.isActive()).isTrue();
            Printer.printlnGreen("Encode and Scale...");
            CollectLogger.getInstance().getLogger().info("Finished");
            file = logFile.getFile();
        }

        assertThat(file.getFileName().toString()).matches("Sampling_\\d{8}-\\d{6}_stdout\\.txt");
        String content = Files.readString(file);
        assertThat(content).contains("Encode and Scale...").contains("Finished").doesNotContain("\u001B[");
    }

    @Test
    @DisplayName("Console handlers are back after close, also when the run fails")
    void restoresHandlers() throws Exception {
        Logger logger = Printer.getInstance().getLogger();
        Handler[] before = logger.getHandlers();

        assertThatThrownBy(() -> {
            try (RunLogFile ignored = RunLogFile.open(tempDir, "Sampling", false)) {
                assertThat(logger.getHandlers()).doesNotContain(before);
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(logger.getHandlers()).containsExactlyInAnyOrder(before);
    }

    @Test
    @DisplayName("With a debugger attached the output stays on the console")
    void debuggerAttached() throws Exception {
        try (RunLogFile logFile = RunLogFile.open(tempDir, "Sampling", true)) {
            assertThat(logFile.isActive()).isFalse();
            assertThat(logFile.getFile()).isNull();
        }
        assertThat(tempDir).isEmptyDirectory();
    }

    @Test
    @DisplayName("The phase timer reports elapsed seconds")
    void phaseTimer() {
        try (PhaseTimer timer = PhaseTimer.start("Loading dataset")) {
            assertThat(timer.elapsedSeconds()).isGreaterThanOrEqualTo(0);
        }
        assertThat(Printer.stripColors("\u001B[32mdone\u001B[0m")).isEqualTo("done");
    }
}
