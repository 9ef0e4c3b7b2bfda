package com.phillippitts.streamscribe.service.transcription.whisper;

import com.phillippitts.streamscribe.config.properties.WhisperConfig;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.process.ExternalProcessRunner;
import com.phillippitts.streamscribe.testutil.FakeProcesses.ProcessBehavior;
import com.phillippitts.streamscribe.testutil.FakeProcesses.StubProcessFactory;
import com.phillippitts.streamscribe.testutil.FakeProcesses.TestProcess;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Hermetic tests: the stub factory stands in for whisper.cpp and, where needed, writes the
 * JSON file the real binary would leave next to its input.
 */
class WhisperProcessManagerTest {

    private static final String JSON = "{\"transcription\":[{\"text\":\" hi there\"}]}";

    @TempDir
    Path dir;

    private static WhisperConfig cfg(int timeoutSeconds) {
        return new WhisperConfig("/usr/local/bin/whisper", "/models/ggml-base.bin", timeoutSeconds, 2, 4096);
    }

    private static void writeJsonFor(List<String> command, String json) {
        String base = command.get(command.indexOf("-of") + 1);
        try {
            Files.writeString(Path.of(base + ".json"), json);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void shouldBuildJsonModeCommandWithSessionLanguage() {
        WhisperProcessManager manager = new WhisperProcessManager(new ExternalProcessRunner());
        Path wav = dir.resolve("batch.wav");

        List<String> cmd = manager.buildCommand(cfg(5), wav, "fr", dir.resolve("batch"));

        assertThat(cmd).containsExactly("/usr/local/bin/whisper", "-m", "/models/ggml-base.bin",
                "-f", wav.toAbsolutePath().toString(), "-l", "fr", "-t", "2", "-np", "-oj",
                "-of", dir.resolve("batch").toAbsolutePath().toString());
    }

    @Test
    void shouldUseAutoWhenLanguageMissing() {
        WhisperProcessManager manager = new WhisperProcessManager(new ExternalProcessRunner());

        List<String> cmd = manager.buildCommand(cfg(5), dir.resolve("a.wav"), null, dir.resolve("a"));

        assertThat(cmd.get(cmd.indexOf("-l") + 1)).isEqualTo("auto");
    }

    @Test
    void shouldReturnJsonAndDeleteOutputFile() throws Exception {
        // Arrange
        Path wav = Files.write(dir.resolve("batch.wav"), new byte[] {1, 2});
        StubProcessFactory factory = new StubProcessFactory(
                new TestProcess(ProcessBehavior.success("")), command -> writeJsonFor(command, JSON));
        WhisperProcessManager manager = new WhisperProcessManager(new ExternalProcessRunner(factory));

        // Act
        String json = manager.transcribe(wav, "en", cfg(5));

        // Assert
        assertThat(json).isEqualTo(JSON);
        assertThat(dir.resolve("batch.json")).doesNotExist();
        assertThat(factory.commands()).hasSize(1);
    }

    @Test
    void shouldReportExitCodeAndStderrOnFailure() throws Exception {
        Path wav = Files.write(dir.resolve("batch.wav"), new byte[] {1, 2});
        StubProcessFactory factory = new StubProcessFactory(
                new TestProcess(ProcessBehavior.failure(3, "error: failed to load model")));
        WhisperProcessManager manager = new WhisperProcessManager(new ExternalProcessRunner(factory));

        assertThatThrownBy(() -> manager.transcribe(wav, "en", cfg(5)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Non-zero exit: 3")
                .hasMessageContaining("exitCode=3")
                .hasMessageContaining("failed to load model")
                .extracting(e -> ((TranscriptionException) e).getEngineName())
                .isEqualTo("whisper");
    }

    @Test
    void shouldFailWhenNoJsonProduced() throws Exception {
        Path wav = Files.write(dir.resolve("batch.wav"), new byte[] {1, 2});
        StubProcessFactory factory = new StubProcessFactory(new TestProcess(ProcessBehavior.success("")));
        WhisperProcessManager manager = new WhisperProcessManager(new ExternalProcessRunner(factory));

        assertThatThrownBy(() -> manager.transcribe(wav, "en", cfg(5)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("No JSON output produced");
    }

    @Test
    void shouldDestroyProcessOnTimeout() throws Exception {
        Path wav = Files.write(dir.resolve("batch.wav"), new byte[] {1, 2});
        TestProcess hanging = new TestProcess(ProcessBehavior.hanging());
        WhisperProcessManager manager = new WhisperProcessManager(
                new ExternalProcessRunner(new StubProcessFactory(hanging)));

        assertThatThrownBy(() -> manager.transcribe(wav, "en", cfg(1)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Timeout after 1s");
        assertThat(hanging.wasDestroyCalled()).isTrue();
    }
}
