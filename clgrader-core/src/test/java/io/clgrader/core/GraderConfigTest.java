package io.clgrader.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GraderConfigTest {

    @Test
    void shouldUseDefaults() {
        GraderConfig config = new GraderConfig();

        assertThat(config.getWorkerPoolSize()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getMaxCaptureBytes()).isEqualTo(1024 * 1024);
        assertThat(config.getWorkspaceRoot()).isNull();
        assertThat(config.getShell()).containsExactly("/bin/sh", "-c");
        assertThat(config.isKeepWorkspaces()).isFalse();
        assertThat(config.isRegisterShutdownHook()).isTrue();
    }

    @Test
    void shouldReadSettings() {
        GraderConfig config =
                GraderConfig.fromProperties(
                        Map.of(
                                GraderConfig.WORKER_POOL_SIZE, "3",
                                GraderConfig.DEFAULT_TIMEOUT_MS, " 2500 ",
                                GraderConfig.MAX_CAPTURE_BYTES, "512",
                                GraderConfig.WORKSPACE_ROOT, "/var/tmp/grading",
                                GraderConfig.POLL_INTERVAL_MS, "25",
                                GraderConfig.KEEP_WORKSPACES, "true",
                                GraderConfig.REGISTER_SHUTDOWN_HOOK, "false"));

        assertThat(config.getWorkerPoolSize()).isEqualTo(3);
        assertThat(config.getDefaultTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.getMaxCaptureBytes()).isEqualTo(512);
        assertThat(config.getWorkspaceRoot()).isEqualTo(Path.of("/var/tmp/grading"));
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(25));
        assertThat(config.isKeepWorkspaces()).isTrue();
        assertThat(config.isRegisterShutdownHook()).isFalse();
    }

    @Test
    void shouldIgnoreBlankWorkspaceRoot() {
        assertThat(GraderConfig.fromProperties(Map.of(GraderConfig.WORKSPACE_ROOT, " ")).getWorkspaceRoot())
                .isNull();
    }

    @Test
    void shouldRejectMalformedNumbers() {
        assertThatThrownBy(() -> GraderConfig.fromProperties(Map.of(GraderConfig.WORKER_POOL_SIZE, "many")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid integer for clgrader.worker-pool-size: many");
    }

    @Test
    void shouldRejectNonPositivePoolSize() {
        assertThatThrownBy(() -> GraderConfig.builder().workerPoolSize(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Worker pool size must be positive");
    }

    @Test
    void shouldBuildFluently() {
        GraderConfig config =
                GraderConfig.builder()
                        .workerPoolSize(1)
                        .shell(List.of("/bin/bash", "-c"))
                        .keepWorkspaces(true)
                        .build();

        assertThat(config.getWorkerPoolSize()).isEqualTo(1);
        assertThat(config.getShell()).containsExactly("/bin/bash", "-c");
        assertThat(config.isKeepWorkspaces()).isTrue();
    }
}
