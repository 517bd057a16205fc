package com.newsinsight.reliability.worker;

import com.newsinsight.reliability.exception.WorkerAbortedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerCommandLineRunnerTest {

    @Mock
    private ReliabilityWorker worker;

    private WorkerCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new WorkerCommandLineRunner(worker);
    }

    private static WorkerReport report(int errored) {
        return new WorkerReport(LocalDate.of(2024, 1, 15), 10, 0, errored,
                List.of("oncology"), List.of(), false, Instant.EPOCH, Instant.EPOCH);
    }

    @Test
    @DisplayName("Parses date, repeated domains and force")
    void parsesArguments() throws Exception {
        when(worker.run(any())).thenReturn(report(0));

        runner.run(new DefaultApplicationArguments("--date=2024-01-15", "--domain=oncology", "--domain=neurology", "--force"));

        ArgumentCaptor<WorkerRequest> request = ArgumentCaptor.forClass(WorkerRequest.class);
        verify(worker).run(request.capture());
        assertThat(request.getValue().targetDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(request.getValue().domains()).containsExactly("oncology", "neurology");
        assertThat(request.getValue().force()).isTrue();
        assertThat(runner.getExitCode()).isEqualTo(WorkerCommandLineRunner.EXIT_OK);
    }

    @Test
    @DisplayName("Item errors still exit 0")
    void itemErrorsExitZero() throws Exception {
        when(worker.run(any())).thenReturn(report(3));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Unparseable date exits 2 without running")
    void invalidDate() throws Exception {
        runner.run(new DefaultApplicationArguments("--date=15/01/2024"));

        assertThat(runner.getExitCode()).isEqualTo(WorkerCommandLineRunner.EXIT_INVALID_DATE);
        verifyNoInteractions(worker);
    }

    @Test
    @DisplayName("Fatal abort exits 1")
    void fatalAbort() throws Exception {
        when(worker.run(any())).thenThrow(new WorkerAbortedException("database unavailable",
                List.of("oncology"), report(0), new IllegalStateException("down")));

        runner.run(new DefaultApplicationArguments("--domain=oncology"));

        assertThat(runner.getExitCode()).isEqualTo(WorkerCommandLineRunner.EXIT_FATAL);
    }
}
