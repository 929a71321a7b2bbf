package ai.sourcebridge.translator.annotate;

import ai.sourcebridge.translator.diag.TranslationException;
import ai.sourcebridge.translator.ist.IstPrinter;
import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.translate.CodeTranslator;
import ai.sourcebridge.translator.translate.TranslationResult;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an annotator off the calling thread and guards what comes back. The annotated code must still translate and
 * must describe the same program as before; otherwise, and on timeout or any annotator failure, the translation is
 * handed back without annotation.
 */
public class AnnotationService implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationService.class);
    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile("(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);

    private static final AtomicInteger WORKER_COUNT = new AtomicInteger();

    private final AnnotatorFactory annotatorFactory;
    private final CodeTranslator codeTranslator;
    private final ExecutorService executor;
    private final Duration timeout;
    private final int maxRetryAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;

    public AnnotationService(AnnotatorFactory annotatorFactory, CodeTranslator codeTranslator, Duration timeout) {
        this(annotatorFactory, codeTranslator, timeout, 3, 2, 30, 0.3);
    }

    public AnnotationService(AnnotatorFactory annotatorFactory, CodeTranslator codeTranslator, Duration timeout,
                             int maxRetryAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {
        this.annotatorFactory = Objects.requireNonNull(annotatorFactory, "annotatorFactory");
        this.codeTranslator = Objects.requireNonNull(codeTranslator, "codeTranslator");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "annotation-worker-" + WORKER_COUNT.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Annotates in the background. The future always completes normally unless the caller cancels it.
     */
    public CompletableFuture<AnnotationResult> annotateAsync(TranslationResult translation, Language language,
                                                             AnnotationMode mode) {
        Objects.requireNonNull(translation, "translation");
        Objects.requireNonNull(language, "language");
        if (mode == null || mode == AnnotationMode.NONE) {
            return CompletableFuture.completedFuture(AnnotationResult.unchanged(translation));
        }
        Annotator annotator;
        try {
            annotator = annotatorFactory.select(mode);
        } catch (RuntimeException ex) {
            LOGGER.warn("Annotator for mode {} is unavailable: {}", mode, ex.getMessage());
            return CompletableFuture.completedFuture(AnnotationResult.fallback(translation, ex.getMessage()));
        }
        LOGGER.info("Annotating {} translation ({} mode)", language.displayName(), mode);
        CompletableFuture<String> work = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                work.complete(annotateWithRetry(annotator, translation.code(), language));
            } catch (RuntimeException ex) {
                work.completeExceptionally(ex);
            }
        });
        // a timed-out annotator is interrupted so it does not hold a worker
        return work.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((annotated, failure) -> {
                    if (failure != null) {
                        task.cancel(true);
                    }
                })
                .handle((annotated, failure) -> failure == null
                        ? verify(translation, annotated, language)
                        : fallback(translation, failure));
    }

    public AnnotationResult annotate(TranslationResult translation, Language language, AnnotationMode mode) {
        try {
            return annotateAsync(translation, language, mode).join();
        } catch (CancellationException ex) {
            return AnnotationResult.fallback(translation, "annotation was cancelled");
        }
    }

    private AnnotationResult verify(TranslationResult original, String annotated, Language language) {
        try {
            String before = IstPrinter.printCode(codeTranslator.check(original.code(), language));
            String after = IstPrinter.printCode(codeTranslator.check(annotated, language));
            if (!before.equals(after)) {
                LOGGER.warn("Annotated code no longer describes the same program; keeping the plain translation");
                return AnnotationResult.fallback(original, "annotation changed the program");
            }
            TranslationResult result = codeTranslator.translate(annotated, language, language);
            LOGGER.info("Annotated translation carries {} comments", result.comments().size());
            return AnnotationResult.annotated(result);
        } catch (TranslationException ex) {
            LOGGER.warn("Annotated code does not translate ({}); keeping the plain translation", ex.getMessage());
            return AnnotationResult.fallback(original, "annotated code does not translate: " + ex.getMessage());
        }
    }

    private AnnotationResult fallback(TranslationResult original, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        String reason = cause instanceof TimeoutException
                ? "annotation timed out after " + timeout.toSeconds() + " seconds"
                : String.valueOf(cause.getMessage());
        LOGGER.warn("Annotation failed: {}; keeping the plain translation", reason);
        return AnnotationResult.fallback(original, reason);
    }

    private String annotateWithRetry(Annotator annotator, String code, Language language) {
        AnnotationException lastFailure = null;
        for (int attempt = 0; attempt < maxRetryAttempts; attempt++) {
            try {
                return annotator.annotate(code, language);
            } catch (AnnotationException ex) {
                lastFailure = ex;
                Optional<Duration> maybeDelay = calculateRetryDelay(ex, attempt);
                if (maybeDelay.isEmpty() || attempt == maxRetryAttempts - 1) {
                    if (isRateLimitError(ex)) {
                        LOGGER.error("Annotation rate limited; max retries ({}) exceeded", maxRetryAttempts);
                    }
                    throw ex;
                }
                Duration delay = maybeDelay.get();
                LOGGER.warn("Annotation rate limited (429/RESOURCE_EXHAUSTED); retrying in {} seconds (attempt {}/{})",
                        delay.toSeconds(), attempt + 1, maxRetryAttempts);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Annotation retry interrupted");
                    throw ex;
                }
            }
        }
        throw lastFailure == null ? new AnnotationException("Unknown annotation failure", null) : lastFailure;
    }

    private Optional<Duration> calculateRetryDelay(Throwable throwable, int attemptNumber) {
        if (!isRateLimitError(throwable)) {
            return Optional.empty();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(throwable);
        if (providerDelay.isPresent()) {
            return providerDelay;
        }
        // initialBackoff * 2^attempt, capped, then spread by the jitter factor
        long baseDelaySeconds = initialBackoffSeconds * (1L << attemptNumber);
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        long finalDelaySeconds = Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier));
        return Optional.of(Duration.ofSeconds(finalDelaySeconds));
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return Optional.empty();
        }
        Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double seconds = Double.parseDouble(matcher.group(1));
        return Optional.of(Duration.ofMillis(Math.max(0, (long) (seconds * 1000))));
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
