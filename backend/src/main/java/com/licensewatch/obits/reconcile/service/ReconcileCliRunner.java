package com.licensewatch.obits.reconcile.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.licensewatch.obits.config.ReconcilerProperties;
import com.licensewatch.obits.reconcile.model.ProgressState;
import com.licensewatch.obits.reconcile.model.ReconcileRequest;
import com.licensewatch.obits.reconcile.model.RunSummary;
import com.licensewatch.obits.reconcile.persistence.ProgressCheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class ReconcileCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ReconcileCliRunner.class);

    static final String ACTION_RUN = "run";
    static final String ACTION_SHOW_PROGRESS = "show-progress";
    static final String ACTION_CLEAR_PROGRESS = "clear-progress";
    static final int EXIT_ABORTED = 2;

    private final ReconcilerProperties properties;
    private final BatchReconcileService batchReconcileService;
    private final ProgressCheckpointRepository checkpointRepository;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public ReconcileCliRunner(
        ReconcilerProperties properties,
        BatchReconcileService batchReconcileService,
        ProgressCheckpointRepository checkpointRepository,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.batchReconcileService = batchReconcileService;
        this.checkpointRepository = checkpointRepository;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String action = properties.getCli().getAction() == null
            ? ACTION_RUN
            : properties.getCli().getAction().trim().toLowerCase(Locale.ROOT);
        int exitCode = 0;
        switch (action) {
            case ACTION_SHOW_PROGRESS -> showProgress();
            case ACTION_CLEAR_PROGRESS -> clearProgress();
            case ACTION_RUN -> {
                List<RunSummary> summaries = runAll();
                boolean aborted = summaries.stream().anyMatch(RunSummary::isAborted);
                exitCode = aborted ? EXIT_ABORTED : 0;
            }
            default -> {
                log.warn("Unknown action '{}'; expected one of {}, {}, {}", action, ACTION_RUN, ACTION_SHOW_PROGRESS, ACTION_CLEAR_PROGRESS);
                exitCode = 1;
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            int code = SpringApplication.exit(applicationContext, () -> finalExitCode);
            System.exit(code);
        }
    }

    /**
     * Processes each configured input in order and stops at the first aborted run. Only the
     * first input honours the overwrite setting; later inputs append to the same outputs.
     */
    List<RunSummary> runAll() {
        List<RunSummary> summaries = new ArrayList<>();
        boolean append = properties.getOutput().isAppend();
        for (String input : properties.getInputs()) {
            if (input == null || input.isBlank()) {
                continue;
            }
            if (!Files.exists(Paths.get(input))) {
                log.warn("Input file {} not found; skipping", input);
                continue;
            }
            ReconcileRequest request = new ReconcileRequest(
                input,
                properties.getOutput().getKeptPath(),
                properties.getOutput().getRemovedPath(),
                append
            );
            RunSummary summary = batchReconcileService.run(request);
            summaries.add(summary);
            log.info(
                "Summary {}: status={}, batches={}, processed={}, kept={}, removed={}, error={}",
                summary.inputPath(),
                summary.status(),
                summary.batchesCompleted(),
                summary.rowsProcessed(),
                summary.keptCount(),
                summary.removedCount(),
                summary.error()
            );
            append = true;
            if (summary.isAborted()) {
                log.warn("Stopping after {}; re-run to resume from the saved checkpoint", input);
                break;
            }
        }
        if (summaries.isEmpty()) {
            log.info("No input files processed");
        }
        return summaries;
    }

    void showProgress() {
        for (String input : properties.getInputs()) {
            Optional<ProgressState> state = checkpointRepository.find(input);
            if (state.isEmpty()) {
                log.info("No progress file found for {} ({})", input, checkpointRepository.checkpointPath(input));
                continue;
            }
            try {
                log.info(
                    "Progress file contents ({}):\n{}",
                    checkpointRepository.checkpointPath(input),
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state.get())
                );
            } catch (JsonProcessingException e) {
                log.warn("Could not render progress for {}", input, e);
            }
        }
    }

    void clearProgress() {
        for (String input : properties.getInputs()) {
            if (!checkpointRepository.clear(input)) {
                log.info("No progress file to remove for {}", input);
            }
        }
    }
}
