package com.irisplatform.analysis.service;

import com.irisplatform.analysis.dto.ClassificationRequest;
import com.irisplatform.analysis.dto.ClassificationResponseDTO;
import com.irisplatform.analysis.dto.RubricDTO;
import com.irisplatform.analysis.dto.SampleClassificationRequest;
import com.irisplatform.common.classifier.PatternAnalysis;
import com.irisplatform.common.classifier.PatternClassifier;
import com.irisplatform.common.exception.InvalidInputException;
import com.irisplatform.common.model.WindowStats;
import com.irisplatform.common.scoring.PatternRubrics;
import com.irisplatform.common.stats.WindowStatsCalculator;
import com.irisplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs classification requests through the {@link PatternClassifier} off the event
 * loop. Every request is an independent batch; nothing is shared between calls.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    private final PatternClassifier classifier;
    private final int maxWindows;
    private final String defaultSource;

    public ClassificationService(PatternClassifier classifier,
                                 @Value("${iris.classification.max-windows:500}") int maxWindows,
                                 @Value("${iris.classification.default-source:unspecified}") String defaultSource) {
        this.classifier = classifier;
        this.maxWindows = maxWindows;
        this.defaultSource = defaultSource;
    }

    public Mono<ClassificationResponseDTO> classify(ClassificationRequest request) {
        String source = sourceOf(request.source());
        return run(source, request.traceId(), () -> {
            checkWindowCount(request.windows());
            return request.windows();
        });
    }

    public Mono<ClassificationResponseDTO> classifySamples(SampleClassificationRequest request) {
        String source = sourceOf(request.source());
        return run(source, request.traceId(), () -> {
            checkWindowCount(request.windows());
            return WindowStatsCalculator.computeAll(request.windows());
        });
    }

    public RubricDTO rubric() {
        return RubricDTO.from(PatternRubrics.RUBRIC_VERSION, PatternRubrics.DEFAULT);
    }

    private Mono<ClassificationResponseDTO> run(String source, String requestedTraceId,
                                                Callable<List<WindowStats>> windowsSupplier) {
        String traceId = TraceContextUtil.resolve(requestedTraceId);
        Mono<ClassificationResponseDTO> pipeline = Mono.deferContextual(ctx -> {
            String tid = TraceContextUtil.getTraceId(ctx);
            return Mono.fromCallable(() -> analyze(source, windowsSupplier.call(), tid))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(InvalidInputException.class, e -> TraceContextUtil.withMdc(tid, () ->
                    log.warn("Rejected classification input. source={} stage={} reason={}",
                        source, e.getStage(), e.getMessage())))
                .doOnError(e -> !(e instanceof InvalidInputException), e -> TraceContextUtil.withMdc(tid, () ->
                    log.error("Classification failed. source={}", source, e)));
        });
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    private ClassificationResponseDTO analyze(String source, List<WindowStats> windows, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("Classifying source={} windows={}", source, windows == null ? 0 : windows.size()));

        PatternAnalysis analysis = classifier.analyze(windows);

        TraceContextUtil.withMdc(traceId, () ->
            log.info("Classification complete. source={} label={} confidence={} ranking={}",
                source, analysis.result().label(), analysis.result().confidence(), analysis.result().ranking()));

        return ClassificationResponseDTO.from(source, analysis, PatternRubrics.RUBRIC_VERSION,
            traceId, Instant.now());
    }

    private void checkWindowCount(List<?> windows) {
        if (windows != null && windows.size() > maxWindows) {
            throw InvalidInputException.invalidValue("ClassificationService", "window count",
                windows.size(), "at most " + maxWindows);
        }
    }

    private String sourceOf(String requested) {
        return requested == null || requested.isBlank() ? defaultSource : requested;
    }
}
