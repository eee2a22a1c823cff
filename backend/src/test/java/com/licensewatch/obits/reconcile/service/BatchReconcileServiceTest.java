package com.licensewatch.obits.reconcile.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.licensewatch.obits.config.ReconcilerProperties;
import com.licensewatch.obits.reconcile.match.NameMatcher;
import com.licensewatch.obits.reconcile.model.Candidate;
import com.licensewatch.obits.reconcile.model.FetchFailureKind;
import com.licensewatch.obits.reconcile.model.FetchOutcome;
import com.licensewatch.obits.reconcile.model.LicenseFile;
import com.licensewatch.obits.reconcile.model.PartitionedRow;
import com.licensewatch.obits.reconcile.model.ProgressState;
import com.licensewatch.obits.reconcile.model.ReconcileRequest;
import com.licensewatch.obits.reconcile.model.RunStatus;
import com.licensewatch.obits.reconcile.model.RunSummary;
import com.licensewatch.obits.reconcile.persistence.PartitionSink;
import com.licensewatch.obits.reconcile.persistence.ProgressCheckpointRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.licensewatch.obits.reconcile.service.TestCandidates.candidate;
import static com.licensewatch.obits.reconcile.service.TestCandidates.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchReconcileServiceTest {
    private static final List<String> HEADERS = List.of("First Name", "Last Name", "Expiration Date", "License Number");
    private static final String[][] PEOPLE = {
        {"Alice", "Walker"},
        {"Brian", "Cole"},
        {"Carla", "Diaz"},
        {"Derek", "Moss"},
        {"Elena", "Park"},
        {"Frank", "Hale"}
    };

    @Mock
    private ObituaryFetcher obituaryFetcher;

    @TempDir
    Path tempDir;

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private ReconcilerProperties properties;
    private ProgressCheckpointRepository checkpointRepository;
    private BatchReconcileService service;

    @BeforeEach
    void setUp() {
        properties = new ReconcilerProperties();
        properties.setConcurrency(4);
        properties.getBatch().setSize(2);
        properties.getBatch().setPauseMs(0);
        properties.getCheckpoint().setDirectory(tempDir.toString());

        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        checkpointRepository = new ProgressCheckpointRepository(properties, mapper);
        service = new BatchReconcileService(
            properties,
            new LicenseFileReader(),
            obituaryFetcher,
            new ResultPartitioner(new NameMatcher(), mapper),
            checkpointRepository,
            executor
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void writesBatchInInputOrderRegardlessOfCompletionOrder() {
        properties.getBatch().setSize(4);
        LicenseFile file = licenseFile(4);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> {
            Candidate candidate = invocation.getArgument(0);
            Thread.sleep((3 - candidate.sourceIndex()) * 60L);
            return matching(candidate);
        });
        RecordingSink sink = new RecordingSink();

        RunSummary summary = service.process(file, ProgressState.initial(file.path()), sink);

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(sink.kept).extracting(PartitionedRow::sourceIndex).containsExactly(0, 1, 2, 3);
        assertThat(sink.removed).isEmpty();
        ProgressState saved = checkpointRepository.load(file.path());
        assertThat(saved.completed()).isTrue();
        assertThat(saved.lastProcessedIndex()).isEqualTo(3);
        assertThat(saved.totalFound()).isEqualTo(4);
        assertThat(saved.totalProcessed()).isEqualTo(4);
    }

    @Test
    void softFailureIsRemovedAsNoResultsAndRunContinues() {
        LicenseFile file = licenseFile(4);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> {
            Candidate candidate = invocation.getArgument(0);
            if (candidate.sourceIndex() == 1) {
                return FetchOutcome.softFailure(candidate, "HTTP_5XX");
            }
            return matching(candidate);
        });
        RecordingSink sink = new RecordingSink();

        RunSummary summary = service.process(file, ProgressState.initial(file.path()), sink);

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(summary.batchesCompleted()).isEqualTo(2);
        assertThat(sink.kept).extracting(PartitionedRow::sourceIndex).containsExactly(0, 2, 3);
        assertThat(sink.removed).singleElement().satisfies(row -> {
            assertThat(row.sourceIndex()).isEqualTo(1);
            assertThat(row.reason()).isEqualTo(ResultPartitioner.REASON_NO_RESULTS);
        });
        ProgressState saved = checkpointRepository.load(file.path());
        assertThat(saved.totalProcessed()).isEqualTo(4);
        assertThat(saved.totalFound()).isEqualTo(3);
        assertThat(saved.lastError()).isNull();
    }

    @Test
    void blockedFetchHaltsRunAndKeepsLastCompletedBatch() throws Exception {
        LicenseFile file = licenseFile(6);
        CountDownLatch siblingStarted = new CountDownLatch(1);
        CountDownLatch siblingInterrupted = new CountDownLatch(1);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> {
            Candidate candidate = invocation.getArgument(0);
            if (candidate.sourceIndex() == 2) {
                siblingStarted.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    siblingInterrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return FetchOutcome.softFailure(candidate, "INTERRUPTED");
            }
            if (candidate.sourceIndex() == 3) {
                siblingStarted.await(5, TimeUnit.SECONDS);
                return FetchOutcome.hardFailure(candidate, FetchFailureKind.BLOCKED, "HTTP_403_BLOCKED: blocked by server");
            }
            return matching(candidate);
        });
        RecordingSink sink = new RecordingSink();

        RunSummary summary = service.process(file, ProgressState.initial(file.path()), sink);

        assertThat(summary.status()).isEqualTo(RunStatus.ABORTED);
        assertThat(summary.error()).contains("HTTP_403_BLOCKED");
        assertThat(summary.batchesCompleted()).isEqualTo(1);
        assertThat(sink.kept).extracting(PartitionedRow::sourceIndex).containsExactly(0, 1);
        assertThat(sink.removed).isEmpty();
        assertThat(siblingInterrupted.await(5, TimeUnit.SECONDS)).isTrue();

        ProgressState saved = checkpointRepository.load(file.path());
        assertThat(saved.lastProcessedIndex()).isEqualTo(1);
        assertThat(saved.totalProcessed()).isEqualTo(2);
        assertThat(saved.totalFound()).isEqualTo(2);
        assertThat(saved.completed()).isFalse();
        assertThat(saved.lastError()).contains("HTTP_403_BLOCKED");
        verify(obituaryFetcher, never()).fetch(argThat(candidate -> candidate.sourceIndex() >= 4));
    }

    @Test
    void resumesFromCheckpointWithoutRefetchingEarlierRows() {
        LicenseFile file = licenseFile(6);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> matching(invocation.getArgument(0)));
        ProgressState checkpoint = new ProgressState(3, Instant.now(), file.path(), 2, 3, false, "HTTP_403_BLOCKED");
        RecordingSink sink = new RecordingSink();

        RunSummary summary = service.process(file, checkpoint, sink);

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(sink.kept).extracting(PartitionedRow::sourceIndex).containsExactly(3, 4, 5);
        verify(obituaryFetcher, never()).fetch(argThat(candidate -> candidate.sourceIndex() < 3));
        ProgressState saved = checkpointRepository.load(file.path());
        assertThat(saved.lastProcessedIndex()).isEqualTo(5);
        assertThat(saved.totalFound()).isEqualTo(5);
        assertThat(saved.totalProcessed()).isEqualTo(6);
        assertThat(saved.lastError()).isNull();
    }

    @Test
    void countsOnlyEligibleRowsThatReceivedAnOutcome() {
        List<Candidate> rows = new ArrayList<>();
        rows.add(candidate(0, "Alice", "Walker", "06/30/2025"));
        rows.add(candidate(1, "Brian", "Cole", "06/30/2021"));
        rows.add(candidate(2, "C", "Diaz", "06/30/2025"));
        rows.add(candidate(3, "Derek", "Moss", "2024-03-01"));
        rows.add(candidate(4, "Elena", "Park", ""));
        rows.add(candidate(5, "Frank", "Hale", "06/30/2025"));
        LicenseFile file = new LicenseFile(tempDir.resolve("mixed.csv").toString(), HEADERS, rows);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> {
            Candidate candidate = invocation.getArgument(0);
            if (candidate.sourceIndex() == 3) {
                return FetchOutcome.success(candidate, List.of(entry("z", "Dennis", "Moss")));
            }
            return matching(candidate);
        });
        RecordingSink sink = new RecordingSink();

        RunSummary summary = service.process(file, ProgressState.initial(file.path()), sink);

        assertThat(summary.rowsProcessed()).isEqualTo(3);
        assertThat(sink.kept).extracting(PartitionedRow::sourceIndex).containsExactly(0, 5);
        assertThat(sink.removed).extracting(PartitionedRow::reason).containsExactly(ResultPartitioner.REASON_NO_MATCHING_NAME);
        ProgressState saved = checkpointRepository.load(file.path());
        assertThat(saved.totalProcessed()).isEqualTo(3);
        assertThat(saved.totalFound()).isEqualTo(2);
        assertThat(saved.totalFound()).isLessThanOrEqualTo(saved.totalProcessed());
    }

    @Test
    void rowLimitStopsEarlyWithoutMarkingCompleted() {
        properties.getBatch().setMaxRows(3);
        LicenseFile file = licenseFile(5);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> matching(invocation.getArgument(0)));
        RecordingSink sink = new RecordingSink();

        RunSummary summary = service.process(file, ProgressState.initial(file.path()), sink);

        assertThat(summary.status()).isEqualTo(RunStatus.LIMIT_REACHED);
        assertThat(summary.rowsProcessed()).isEqualTo(3);
        ProgressState saved = checkpointRepository.load(file.path());
        assertThat(saved.completed()).isFalse();
        assertThat(saved.lastProcessedIndex()).isEqualTo(2);
    }

    @Test
    void runWritesCsvOutputsAndSkipsCompletedInputs() throws Exception {
        Path input = tempDir.resolve("nursing-licenses.csv");
        Files.write(input, List.of(
            "First Name,Last Name,Expiration Date,License Number",
            "Mary,Jones,06/30/2025,RN1",
            "Old,Record,06/30/2020,RN2",
            "Ana,Diaz,2024-02-01,RN3"
        ), StandardCharsets.UTF_8);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> {
            Candidate candidate = invocation.getArgument(0);
            if (candidate.firstName().equals("Mary")) {
                return matching(candidate);
            }
            return FetchOutcome.success(candidate, List.of());
        });
        Path kept = tempDir.resolve("out/kept.csv");
        Path removed = tempDir.resolve("out/removed.csv");
        ReconcileRequest request = new ReconcileRequest(input.toString(), kept.toString(), removed.toString(), false);

        RunSummary first = service.run(request);
        RunSummary second = service.run(request);

        assertThat(first.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(first.keptCount()).isEqualTo(1);
        assertThat(first.removedCount()).isEqualTo(1);
        assertThat(second.status()).isEqualTo(RunStatus.ALREADY_COMPLETED);
        verify(obituaryFetcher, times(2)).fetch(any());

        List<String> keptLines = Files.readAllLines(kept, StandardCharsets.UTF_8);
        assertThat(keptLines.get(0))
            .isEqualTo("First Name,Last Name,Expiration Date,License Number,matched_obituaries,total_matches,total_obituaries_found");
        assertThat(keptLines).hasSize(2);
        assertThat(keptLines.get(1)).startsWith("Mary,Jones,06/30/2025,RN1,");

        List<String> removedLines = Files.readAllLines(removed, StandardCharsets.UTF_8);
        assertThat(removedLines.get(0))
            .isEqualTo("First Name,Last Name,Expiration Date,License Number,removal_reason,matched_obituaries,total_obituaries_found");
        assertThat(removedLines).containsExactly(removedLines.get(0), "Ana,Diaz,2024-02-01,RN3,no results,[],0");
        assertThat(Files.exists(checkpointRepository.checkpointPath(input.toString()))).isTrue();
    }

    @Test
    void checkpointWriteFailureDoesNotStopTheRun() throws Exception {
        Path notADirectory = Files.createFile(tempDir.resolve("blocked"));
        properties.getCheckpoint().setDirectory(notADirectory.toString());
        LicenseFile file = licenseFile(3);
        when(obituaryFetcher.fetch(any())).thenAnswer(invocation -> matching(invocation.getArgument(0)));
        RecordingSink sink = new RecordingSink();

        RunSummary summary = service.process(file, ProgressState.initial(file.path()), sink);

        assertThat(summary.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(sink.kept).hasSize(3);
    }

    private LicenseFile licenseFile(int count) {
        List<Candidate> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(candidate(i, PEOPLE[i][0], PEOPLE[i][1]));
        }
        return new LicenseFile(tempDir.resolve("licenses.csv").toString(), HEADERS, rows);
    }

    private static FetchOutcome matching(Candidate candidate) {
        return FetchOutcome.success(
            candidate,
            List.of(entry("obit-" + candidate.sourceIndex(), candidate.firstName(), candidate.lastName()))
        );
    }

    private static final class RecordingSink implements PartitionSink {
        private final List<PartitionedRow> kept = Collections.synchronizedList(new ArrayList<>());
        private final List<PartitionedRow> removed = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void writeKept(List<PartitionedRow> rows) {
            kept.addAll(rows);
        }

        @Override
        public void writeRemoved(List<PartitionedRow> rows) {
            removed.addAll(rows);
        }

        @Override
        public void close() {
        }
    }
}
