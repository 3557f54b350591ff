package com.di.loannova.runner;

import com.di.loannova.config.PipelineProperties;
import com.di.loannova.orchestrator.PipelineOrchestrator;
import com.di.loannova.orchestrator.RunRequest;
import com.di.loannova.orchestrator.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

/**
 * Runs the pipeline once at startup when {@code loannova.pipeline.run-on-startup} is set.
 * Otherwise runs are driven through {@code POST /api/pipeline/run}.
 *
 * <p>Command-line overrides: {@code --force}, {@code --user=<name>}, {@code --action=<label>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineRunnerService implements ApplicationRunner {

    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("[RUNNER] run-on-startup disabled; waiting for API trigger");
            return;
        }
        RunSummary summary = runPipeline(toRequest(args));
        log.info("[RUNNER] startup run {} -> {}", summary.getRunId(), summary.getStatus().code());
    }

    public RunSummary runPipeline(RunRequest request) {
        return orchestrator.run(request);
    }

    static RunRequest toRequest(ApplicationArguments args) {
        Boolean force = args.containsOption("force") ? Boolean.TRUE : null;
        return new RunRequest(force, single(args, "user"), single(args, "action"));
    }

    private static String single(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) return null;
        var values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
