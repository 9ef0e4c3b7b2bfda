package com.phillippitts.streamscribe.service.process;

import com.phillippitts.streamscribe.testutil.FakeProcesses.ProcessBehavior;
import com.phillippitts.streamscribe.testutil.FakeProcesses.StubProcessFactory;
import com.phillippitts.streamscribe.testutil.FakeProcesses.TestProcess;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalProcessRunnerTest {

    private static final List<String> COMMAND = List.of("/usr/bin/tool", "--flag");

    @Test
    void shouldCaptureStdoutAndExitCode() throws Exception {
        // Arrange
        TestProcess process = new TestProcess(ProcessBehavior.success("hello"));
        StubProcessFactory factory = new StubProcessFactory(process);
        ExternalProcessRunner runner = new ExternalProcessRunner(factory);

        // Act
        ProcessOutput out = runner.run(COMMAND, null, Duration.ofSeconds(2), 1024);

        // Assert
        assertThat(out.succeeded()).isTrue();
        assertThat(out.stdoutAsString()).isEqualTo("hello");
        assertThat(out.timedOut()).isFalse();
        assertThat(factory.commands()).containsExactly(COMMAND);
    }

    @Test
    void shouldReportNonZeroExitWithStderr() throws Exception {
        TestProcess process = new TestProcess(ProcessBehavior.failure(3, "bad input"));
        ExternalProcessRunner runner = new ExternalProcessRunner(new StubProcessFactory(process));

        ProcessOutput out = runner.run(COMMAND, null, Duration.ofSeconds(2), 1024);

        assertThat(out.succeeded()).isFalse();
        assertThat(out.exitCode()).isEqualTo(3);
        assertThat(out.stderr()).isEqualTo("bad input");
    }

    @Test
    void shouldCapCapturedStdout() throws Exception {
        TestProcess process = new TestProcess(ProcessBehavior.success(new byte[10_000]));
        ExternalProcessRunner runner = new ExternalProcessRunner(new StubProcessFactory(process));

        ProcessOutput out = runner.run(COMMAND, null, Duration.ofSeconds(2), 4096);

        assertThat(out.stdout()).hasSize(4096);
        assertThat(out.stdoutTruncated()).isTrue();
        assertThat(out.succeeded()).isTrue();
    }

    @Test
    void shouldNotFlagStdoutThatFitsTheCap() throws Exception {
        TestProcess process = new TestProcess(ProcessBehavior.success(new byte[4096]));
        ExternalProcessRunner runner = new ExternalProcessRunner(new StubProcessFactory(process));

        ProcessOutput out = runner.run(COMMAND, null, Duration.ofSeconds(2), 4096);

        assertThat(out.stdout()).hasSize(4096);
        assertThat(out.stdoutTruncated()).isFalse();
    }

    @Test
    void shouldKillProcessOnTimeout() throws Exception {
        TestProcess process = new TestProcess(ProcessBehavior.hanging());
        ExternalProcessRunner runner = new ExternalProcessRunner(new StubProcessFactory(process));

        long start = System.nanoTime();
        ProcessOutput out = runner.run(COMMAND, null, Duration.ofMillis(200), 1024);
        long durationMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(out.timedOut()).isTrue();
        assertThat(out.exitCode()).isEqualTo(-1);
        assertThat(out.succeeded()).isFalse();
        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(durationMs).isLessThan(5000);
    }
}
