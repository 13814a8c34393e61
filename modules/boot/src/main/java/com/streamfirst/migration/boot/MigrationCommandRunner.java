package com.streamfirst.migration.boot;

import com.streamfirst.migration.application.ExitCode;
import com.streamfirst.migration.application.MigrationService;
import com.streamfirst.migration.domain.AuditEvent;
import com.streamfirst.migration.domain.MigrationError;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationRequest;
import com.streamfirst.migration.domain.MigrationState;
import com.streamfirst.migration.domain.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Starts the configured migration and blocks until it finishes. On context shutdown, for
 * example after SIGTERM, active runs are aborted and rolled back before the service's
 * threads are stopped.
 */
@Slf4j
@RequiredArgsConstructor
public class MigrationCommandRunner implements CommandLineRunner, ExitCodeGenerator, DisposableBean {

    private static final Duration AWAIT_SLICE = Duration.ofMinutes(1);

    private final MigrationService migrationService;
    private final MigrationProperties properties;
    private volatile ExitCode exitCode = ExitCode.SUCCESS;

    @Override
    public void run(String... args) throws InterruptedException {
        Result<MigrationRequest> request = properties.toRequest();
        if (request.isFailure()) {
            fail("Invalid migration configuration", request.getError().orElseThrow());
            return;
        }
        MigrationId id = request.orElseThrow().migrationId();

        Result<MigrationState> started = migrationService.start(request.orElseThrow());
        if (started.isFailure()) {
            fail("Migration " + id + " not started", started.getError().orElseThrow());
            return;
        }

        Optional<ExitCode> finished = Optional.empty();
        while (finished.isEmpty()) {
            finished = migrationService.awaitTermination(id, AWAIT_SLICE);
            if (finished.isEmpty()) {
                migrationService.status(id).ifPresent(state -> log.info("{} in {} at {}, {} healthy polls",
                        id, state.getPhase(), state.getCurrentWeight(), state.getConsecutiveGoodPolls()));
            }
        }
        exitCode = finished.get();
        summarize(id);
    }

    @Override
    public int getExitCode() {
        return exitCode.getCode();
    }

    /**
     * Rolls back whatever is still running before the service is closed.
     */
    @Override
    public void destroy() throws InterruptedException {
        List<MigrationId> aborted = migrationService.abortAll();
        for (MigrationId id : aborted) {
            log.warn("Shutdown requested, rolling back {}", id);
            Optional<ExitCode> result = migrationService.awaitTermination(id, properties.getShutdownTimeout());
            if (result.isEmpty()) {
                log.error("{} did not finish its rollback within {}s, traffic split needs checking", id,
                        properties.getShutdownTimeout().toSeconds());
            }
        }
    }

    private void fail(String what, MigrationError error) {
        log.error("{}: {}", what, error);
        exitCode = ExitCode.INVALID_CONFIGURATION;
    }

    private void summarize(MigrationId id) {
        List<AuditEvent> history = migrationService.history(id);
        long weightChanges = history.stream().filter(AuditEvent::changedWeight).count();
        long errors = history.stream().filter(AuditEvent::isError).count();
        Optional<MigrationState> last = migrationService.status(id);
        log.info("Migration {} exited {} ({}): {} audit events, {} weight changes, {} errors, final state {}",
                id, exitCode, exitCode.getCode(), history.size(), weightChanges, errors,
                last.map(MigrationState::toString).orElse("unknown"));
    }
}
