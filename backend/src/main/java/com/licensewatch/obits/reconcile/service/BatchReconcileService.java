package com.licensewatch.obits.reconcile.service;

import com.licensewatch.obits.config.ReconcilerProperties;
import com.licensewatch.obits.reconcile.model.Candidate;
import com.licensewatch.obits.reconcile.model.FetchOutcome;
import com.licensewatch.obits.reconcile.model.LicenseFile;
import com.licensewatch.obits.reconcile.model.PartitionedRow;
import com.licensewatch.obits.reconcile.model.ProgressState;
import com.licensewatch.obits.reconcile.model.ReconcileRequest;
import com.licensewatch.obits.reconcile.model.RunStatus;
import com.licensewatch.obits.reconcile.model.RunSummary;
import com.licensewatch.obits.reconcile.model.SearchOutcome;
import com.licensewatch.obits.reconcile.persistence.CsvPartitionWriter;
import com.licensewatch.obits.reconcile.persistence.PartitionSink;
import com.licensewatch.obits.reconcile.persistence.ProgressCheckpointRepository;
import com.licensewatch.obits.reconcile.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives one input file through search, matching and partitioning, one batch at a time.
 *
 * <p>Within a batch every row is fetched concurrently, but only the calling thread touches
 * counters, output and the checkpoint: it drains completions from a completion queue and
 * writes the batch in input order once every row has an outcome. A hard fetch failure
 * cancels the rest of the batch and ends the run with the previous batch's checkpoint.
 */
@Service
public class BatchReconcileService {
    private static final Logger log = LoggerFactory.getLogger(BatchReconcileService.class);

    private final ReconcilerProperties properties;
    private final LicenseFileReader licenseFileReader;
    private final ObituaryFetcher obituaryFetcher;
    private final ResultPartitioner resultPartitioner;
    private final ProgressCheckpointRepository checkpointRepository;
    private final ExecutorService fetchExecutor;

    public BatchReconcileService(
        ReconcilerProperties properties,
        LicenseFileReader licenseFileReader,
        ObituaryFetcher obituaryFetcher,
        ResultPartitioner resultPartitioner,
        ProgressCheckpointRepository checkpointRepository,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor
    ) {
        this.properties = properties;
        this.licenseFileReader = licenseFileReader;
        this.obituaryFetcher = obituaryFetcher;
        this.resultPartitioner = resultPartitioner;
        this.checkpointRepository = checkpointRepository;
        this.fetchExecutor = fetchExecutor;
    }

    public RunSummary run(ReconcileRequest request) {
        ProgressState progress = checkpointRepository.load(request.inputPath());
        if (progress.completed()) {
            log.info(
                "{} already completed (found {}/{}); clear its checkpoint to process it again",
                request.inputPath(),
                progress.totalFound(),
                progress.totalProcessed()
            );
            return new RunSummary(request.inputPath(), RunStatus.ALREADY_COMPLETED, 0, 0, 0, 0, progress, null);
        }

        LicenseFile file = licenseFileReader.read(Paths.get(request.inputPath()));
        List<String> keptHeader = withColumns(file.headers(), ResultPartitioner.KEPT_COLUMNS);
        List<String> removedHeader = withColumns(file.headers(), ResultPartitioner.REMOVED_COLUMNS);
        try (PartitionSink sink = new CsvPartitionWriter(
            Paths.get(request.keptPath()),
            keptHeader,
            Paths.get(request.removedPath()),
            removedHeader,
            request.append()
        )) {
            return process(file, progress, sink);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close output files for " + request.inputPath(), e);
        }
    }

    public RunSummary process(LicenseFile file, ProgressState initial, PartitionSink sink) {
        int minYear = properties.getEligibility().getMinExpirationYear();
        List<Candidate> eligible = CandidateSelector.eligible(file.candidates(), minYear);
        List<Candidate> pending = CandidateSelector.resumable(eligible, initial);
        int maxRows = properties.getBatch().getMaxRows();
        boolean limited = maxRows > 0 && pending.size() > maxRows;
        if (limited) {
            pending = pending.subList(0, maxRows);
        }

        int batchSize = properties.getBatch().getSize();
        int totalBatches = (pending.size() + batchSize - 1) / batchSize;
        log.info(
            "Starting {}: eligible={}, pending={}, resumeFrom={}, batchSize={}, concurrency={}",
            file.path(),
            eligible.size(),
            pending.size(),
            initial.lastProcessedIndex(),
            batchSize,
            properties.getConcurrency()
        );

        ProgressState progress = initial;
        int batchesCompleted = 0;
        int rowsProcessed = 0;
        int keptCount = 0;
        int removedCount = 0;
        try {
            for (int start = 0; start < pending.size(); start += batchSize) {
                List<Candidate> batch = pending.subList(start, Math.min(start + batchSize, pending.size()));
                int lastIndex = batch.get(batch.size() - 1).sourceIndex();
                log.info(
                    "Processing batch {}/{} (rows {} to {})",
                    batchesCompleted + 1,
                    totalBatches,
                    batch.get(0).sourceIndex(),
                    lastIndex
                );
                Instant batchStarted = Instant.now();

                List<FetchOutcome> outcomes = fetchBatch(batch);
                List<PartitionedRow> keptRows = new ArrayList<>();
                List<PartitionedRow> removedRows = new ArrayList<>();
                for (FetchOutcome outcome : outcomes) {
                    SearchOutcome searchOutcome = resultPartitioner.evaluate(outcome.candidate(), outcome.entries());
                    PartitionedRow row = resultPartitioner.partition(searchOutcome);
                    if (row.kept()) {
                        keptRows.add(row);
                    } else {
                        removedRows.add(row);
                    }
                    logOutcome(outcome, searchOutcome, progress.totalFound() + keptRows.size(), progress.totalProcessed() + keptRows.size() + removedRows.size());
                }
                sink.writeKept(keptRows);
                sink.writeRemoved(removedRows);

                progress = progress.withBatchCompleted(lastIndex, keptRows.size(), outcomes.size(), Instant.now());
                checkpointRepository.save(progress);
                batchesCompleted++;
                rowsProcessed += outcomes.size();
                keptCount += keptRows.size();
                removedCount += removedRows.size();
                log.info(
                    "Batch completed in {}ms; total found so far {}/{}",
                    Duration.between(batchStarted, Instant.now()).toMillis(),
                    progress.totalFound(),
                    progress.totalProcessed()
                );

                if (start + batchSize < pending.size()) {
                    pause(properties.getBatch().getPauseMs());
                }
            }
        } catch (RunAbortedException e) {
            progress = progress.withError(e.getMessage(), Instant.now());
            checkpointRepository.save(progress);
            log.warn(
                "Run for {} aborted after {} batches: {}; checkpoint kept at index {}",
                file.path(),
                batchesCompleted,
                e.getMessage(),
                progress.lastProcessedIndex()
            );
            return new RunSummary(
                file.path(),
                RunStatus.ABORTED,
                batchesCompleted,
                rowsProcessed,
                keptCount,
                removedCount,
                progress,
                e.getMessage()
            );
        }

        RunStatus status;
        if (limited) {
            status = RunStatus.LIMIT_REACHED;
            log.info("Row limit {} reached for {}; run again to continue", maxRows, file.path());
        } else {
            status = RunStatus.COMPLETED;
            progress = progress.withCompleted(Instant.now());
            checkpointRepository.save(progress);
        }
        log.info(
            "Finished {} with status {}: found {}/{} overall, kept={} removed={} this run",
            file.path(),
            status,
            progress.totalFound(),
            progress.totalProcessed(),
            keptCount,
            removedCount
        );
        return new RunSummary(
            file.path(),
            status,
            batchesCompleted,
            rowsProcessed,
            keptCount,
            removedCount,
            progress,
            null
        );
    }

    private List<FetchOutcome> fetchBatch(List<Candidate> batch) {
        CompletionService<FetchOutcome> completion = new ExecutorCompletionService<>(fetchExecutor);
        Map<Future<FetchOutcome>, Integer> positions = new IdentityHashMap<>();
        List<Future<FetchOutcome>> futures = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Candidate candidate = batch.get(i);
            Future<FetchOutcome> future = completion.submit(() -> fetchSafely(candidate));
            positions.put(future, i);
            futures.add(future);
        }

        FetchOutcome[] slots = new FetchOutcome[batch.size()];
        try {
            for (int received = 0; received < batch.size(); received++) {
                Future<FetchOutcome> future = completion.take();
                FetchOutcome outcome = future.get();
                if (outcome.isHardFailure()) {
                    cancelAll(futures);
                    throw new SessionBlockedException(outcome.failureKind(), outcome.reason());
                }
                slots[positions.get(future)] = outcome;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new RunAbortedException("interrupted while waiting for batch results");
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw new IllegalStateException("Search task failed unexpectedly", e.getCause());
        }
        return Arrays.asList(slots);
    }

    private FetchOutcome fetchSafely(Candidate candidate) {
        try {
            return obituaryFetcher.fetch(candidate);
        } catch (RuntimeException e) {
            log.warn("Search failed for {} (row {}); treating as not found", candidate.displayName(), candidate.sourceIndex(), e);
            return FetchOutcome.softFailure(candidate, ReasonCodeClassifier.UNKNOWN);
        }
    }

    private void cancelAll(List<Future<FetchOutcome>> futures) {
        for (Future<FetchOutcome> future : futures) {
            future.cancel(true);
        }
    }

    private void logOutcome(FetchOutcome outcome, SearchOutcome searchOutcome, int found, int processed) {
        Candidate candidate = outcome.candidate();
        if (searchOutcome.hasMatches()) {
            log.info(
                "FOUND: {} (row {}) {}/{} obituaries matched ({}/{})",
                candidate.displayName(),
                candidate.sourceIndex(),
                searchOutcome.matched().size(),
                searchOutcome.entries().size(),
                found,
                processed
            );
        } else if (outcome.status() == FetchOutcome.Status.SOFT_FAILURE) {
            log.info("Not found: {} (row {}) after fetch failure {} ({}/{})", candidate.displayName(), candidate.sourceIndex(), outcome.reason(), found, processed);
        } else {
            log.info("Not found: {} (row {}) {} obituaries, none matched ({}/{})", candidate.displayName(), candidate.sourceIndex(), searchOutcome.entries().size(), found, processed);
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunAbortedException("interrupted between batches");
        }
    }

    private static List<String> withColumns(List<String> headers, List<String> extra) {
        List<String> out = new ArrayList<>(headers);
        for (String column : extra) {
            if (!out.contains(column)) {
                out.add(column);
            }
        }
        return out;
    }
}
