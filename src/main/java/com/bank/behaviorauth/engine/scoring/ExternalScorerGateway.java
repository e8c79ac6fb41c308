package com.bank.behaviorauth.engine.scoring;

import com.bank.behaviorauth.config.MetricsConfig;
import com.bank.behaviorauth.exception.ScorerUnavailableException;
import com.bank.behaviorauth.model.SignalScore;
import com.bank.behaviorauth.model.SignalSource;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs signal producers on the model and local pools under a shared latency budget.
 * A producer that times out, throws or cannot be scheduled yields a degraded
 * neutral signal instead; the failure is logged, counted and reflected in the
 * component health flags. The returned futures never complete exceptionally.
 */
@Component
public class ExternalScorerGateway {

    private static final Logger log = LoggerFactory.getLogger(ExternalScorerGateway.class);

    private final Map<SignalSource, ExternalScorer> scorers;
    private final ExecutorService modelExecutor;
    private final ExecutorService localExecutor;
    private final ComponentHealthRegistry health;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public ExternalScorerGateway(List<ExternalScorer> externalScorers,
                                 @Qualifier("scorerExecutor") ExecutorService modelExecutor,
                                 @Qualifier("localSignalExecutor") ExecutorService localExecutor,
                                 ComponentHealthRegistry health,
                                 Tracer tracer, MetricsConfig metricsConfig) {
        this.scorers = new EnumMap<>(SignalSource.class);
        this.modelExecutor = modelExecutor;
        this.localExecutor = localExecutor;
        this.health = health;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (ExternalScorer scorer : externalScorers) {
            scorers.put(scorer.source(), scorer);
            log.info("Registered external scorer: {} -> {}", scorer.source(), scorer.getClass().getSimpleName());
        }
    }

    /**
     * Start every registered external scorer for the request.
     */
    public Map<SignalSource, CompletableFuture<SignalScore>> scoreExternal(ScoringFeatures features, long timeoutMs) {
        Map<SignalSource, CompletableFuture<SignalScore>> futures = new EnumMap<>(SignalSource.class);
        for (Map.Entry<SignalSource, ExternalScorer> entry : scorers.entrySet()) {
            ExternalScorer scorer = entry.getValue();
            futures.put(entry.getKey(), submit(entry.getKey(), features.getUserId(),
                    () -> scorer.score(features), timeoutMs));
        }
        return futures;
    }

    public boolean hasScorer(SignalSource source) {
        return scorers.containsKey(source);
    }

    /**
     * Run one signal producer, bounded by {@code timeoutMs}. Sources backed by a
     * registered external scorer run on the model pool, everything else on the
     * local pool. A producer still running at the deadline is cancelled.
     */
    public CompletableFuture<SignalScore> submit(SignalSource source, String userId,
                                                 Callable<SignalScore> producer, long timeoutMs) {
        Span span = tracer.nextSpan()
                .name("signal.score." + source.getCode())
                .tag("signal.source", source.getCode())
                .start();

        ExecutorService executor = scorers.containsKey(source) ? modelExecutor : localExecutor;
        CompletableFuture<SignalScore> result = new CompletableFuture<>();
        Future<?> task = schedule(executor, producer, span, result);

        return result
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((score, error) -> {
                    try {
                        if (error == null && score != null) {
                            health.markHealthy(source.getComponent());
                            span.tag("signal.value", String.valueOf(score.getValue()));
                            span.tag("signal.degraded", String.valueOf(score.isDegraded()));
                            return score;
                        }
                        if (task != null && unwrap(error) instanceof TimeoutException) {
                            task.cancel(true);
                        }
                        return fallback(source, userId, error, timeoutMs, span);
                    } finally {
                        span.end();
                    }
                });
    }

    private Future<?> schedule(ExecutorService executor, Callable<SignalScore> producer, Span span,
                               CompletableFuture<SignalScore> result) {
        try {
            return executor.submit(() -> {
                try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                    result.complete(producer.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
            return null;
        }
    }

    private SignalScore fallback(SignalSource source, String userId, Throwable error, long timeoutMs, Span span) {
        Throwable cause = unwrap(error);
        String reason;
        String kind;
        if (cause instanceof TimeoutException) {
            kind = "timeout";
            reason = "timed out after " + timeoutMs + "ms";
        } else if (cause instanceof ScorerUnavailableException) {
            kind = "unavailable";
            reason = cause.getMessage();
        } else if (cause instanceof RejectedExecutionException) {
            kind = "rejected";
            reason = "scorer pool saturated";
        } else if (cause == null) {
            kind = "empty";
            reason = "producer returned no score";
        } else {
            kind = "error";
            reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            log.error("Signal {} failed for user {}", source.getCode(), userId, cause);
        }

        span.tag("signal.degraded", "true");
        span.tag("signal.fallback", kind);
        health.markUnavailable(source.getComponent(), reason);
        metricsConfig.recordDegradedSignal(source.getCode(), kind);
        log.debug("Signal {} degraded for user {}: {}", source.getCode(), userId, reason);

        return SignalScore.degraded(source, source.getCode() + " unavailable: " + reason);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
