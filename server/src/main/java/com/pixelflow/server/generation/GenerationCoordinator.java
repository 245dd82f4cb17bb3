package com.pixelflow.server.generation;

import com.pixelflow.cache.ResultCache;
import com.pixelflow.server.analysis.ImageAnalysis;
import com.pixelflow.server.analysis.ImageAnalyzer;
import com.pixelflow.server.error.AnalysisFailedException;
import com.pixelflow.server.error.AssemblyFailedException;
import com.pixelflow.server.error.GenerationCancelledException;
import com.pixelflow.server.error.InvalidImageException;
import com.pixelflow.server.error.PixelFlowException;
import com.pixelflow.server.error.SamplingFailedException;
import com.pixelflow.server.image.PixelBuffer;
import com.pixelflow.server.sampling.Sample;
import com.pixelflow.server.sampling.SamplingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analysis, sampling and assembly for one image at a time on a bounded
 * worker pool. The caller gets a future right away; at most one generation is
 * in flight and a second request fails immediately.
 */
public class GenerationCoordinator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GenerationCoordinator.class);

    static final float ANALYSIS_DONE = 0.33f;
    static final float SAMPLING_DONE = 0.66f;
    static final float COMPLETE = 1.0f;
    static final String CACHE_STAGE_NAME = "Loaded from cache";

    private final ImageAnalyzer analyzer;
    private final SamplingEngine samplingEngine;
    private final ParticleAssembler assembler;
    private final ResultCache<List<Particle>> cache;
    private final ExecutorService executor;

    private final Object stateLock = new Object();
    // Guarded by stateLock
    private GenerationState state = GenerationState.IDLE;
    private GenerationRun currentRun;

    public GenerationCoordinator(ImageAnalyzer analyzer, SamplingEngine samplingEngine,
            ParticleAssembler assembler, ResultCache<List<Particle>> cache, int maxConcurrentOperations) {
        this.analyzer = analyzer;
        this.samplingEngine = samplingEngine;
        this.assembler = assembler;
        this.cache = cache;
        this.executor = Executors.newFixedThreadPool(Math.max(1, maxConcurrentOperations),
                new WorkerThreadFactory());
    }

    public CompletableFuture<List<Particle>> generate(PixelBuffer buffer, ParticleGenerationConfig config,
            ScreenSize screenSize, ProgressListener listener) {
        if (buffer == null || config == null) {
            CompletableFuture<List<Particle>> invalid = new CompletableFuture<>();
            invalid.completeExceptionally(new InvalidImageException(
                    buffer == null ? "Pixel buffer is required" : "Generation config is required"));
            return invalid;
        }
        GenerationRun run;
        synchronized (stateLock) {
            if (state.isGenerating()) {
                CompletableFuture<List<Particle>> rejected = new CompletableFuture<>();
                rejected.completeExceptionally(new GenerationCancelledException(GenerationStage.STARTING,
                        "A generation is already in progress"));
                return rejected;
            }
            run = new GenerationRun(listener == null ? ProgressListener.NONE : listener);
            currentRun = run;
            state = new GenerationState(true, 0f, GenerationStage.STARTING);
        }

        try {
            logger.info("Starting generation: {}x{} {}", buffer.getWidth(), buffer.getHeight(), config);
            executor.execute(() -> execute(run, buffer, config, screenSize));
        } catch (RejectedExecutionException e) {
            finish(run, null, new GenerationCancelledException(GenerationStage.STARTING,
                    "Generation rejected: " + e.getMessage()));
        } catch (RuntimeException e) {
            finish(run, null, e);
        }
        return run.result;
    }

    private void execute(GenerationRun run, PixelBuffer buffer, ParticleGenerationConfig config,
            ScreenSize screenSize) {
        long start = System.currentTimeMillis();
        try {
            List<Particle> particles = runPipeline(run, buffer, config, screenSize);
            if (finish(run, particles, null)) {
                logger.info("Generation finished with {} particles in {} ms", particles.size(),
                        System.currentTimeMillis() - start);
            }
        } catch (Throwable t) {
            finish(run, null, unwrap(t));
        }
    }

    private List<Particle> runPipeline(GenerationRun run, PixelBuffer buffer, ParticleGenerationConfig config,
            ScreenSize screenSize) {
        CancellationToken token = run.token;

        // 1. Cache lookup
        String key = CacheKeyFactory.create(buffer.getWidth(), buffer.getHeight(), config);
        if (isCacheUsable(config)) {
            Optional<List<Particle>> cached = cache.get(key);
            if (cached.isPresent() && cached.get().size() == config.getTargetParticleCount()) {
                logger.debug("Cache HIT for {}", key);
                run.report(COMPLETE, CACHE_STAGE_NAME);
                return cached.get();
            }
            logger.debug("Cache MISS for {}", key);
        }

        // 2. Analysis
        token.throwIfCancelled(GenerationStage.ANALYZING);
        enterStage(run, GenerationStage.ANALYZING);
        ImageAnalysis analysis;
        try {
            analysis = analyzer.analyze(buffer, token);
        } catch (PixelFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisFailedException("Image analysis failed: " + e.getMessage(), e);
        }
        run.report(ANALYSIS_DONE, GenerationStage.ANALYZING.getDisplayName());

        // 3. Sampling
        token.throwIfCancelled(GenerationStage.SAMPLING);
        enterStage(run, GenerationStage.SAMPLING);
        List<Sample> samples;
        try {
            samples = samplingEngine.sample(analysis, buffer, config.getTargetParticleCount(),
                    config.samplingParams(), config.getSamplingStrategy(), token);
        } catch (PixelFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SamplingFailedException("Sampling failed: " + e.getMessage(), e);
        }
        run.report(SAMPLING_DONE, GenerationStage.SAMPLING.getDisplayName());

        // 4. Assembly
        token.throwIfCancelled(GenerationStage.ASSEMBLING);
        enterStage(run, GenerationStage.ASSEMBLING);
        List<Particle> particles;
        try {
            particles = assembler.assemble(samples, buffer.getWidth(), buffer.getHeight(), config, screenSize);
        } catch (PixelFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AssemblyFailedException(e.getMessage(), e);
        }
        token.throwIfCancelled(GenerationStage.ASSEMBLING);

        // 5. Store, best effort. A cancelled run must not publish its result.
        if (isCacheUsable(config) && !token.isCancelled()) {
            try {
                cache.put(key, particles);
            } catch (RuntimeException e) {
                logger.warn("Failed to cache generation result {}", key, e);
            }
        }
        run.report(COMPLETE, GenerationStage.ASSEMBLING.getDisplayName());
        return particles;
    }

    private boolean isCacheUsable(ParticleGenerationConfig config) {
        return cache != null && config.isCachingEnabled();
    }

    private void enterStage(GenerationRun run, GenerationStage stage) {
        synchronized (stateLock) {
            if (currentRun == run) {
                state = new GenerationState(true, state.getProgress(), stage);
            }
        }
    }

    /**
     * Publishes the outcome of {@code run}.
     *
     * @return false when the run had already been terminated, e.g. by a cancel
     */
    private boolean finish(GenerationRun run, List<Particle> particles, Throwable error) {
        if (!run.terminate()) {
            return false;
        }
        synchronized (stateLock) {
            if (currentRun == run) {
                if (error == null) {
                    state = new GenerationState(false, COMPLETE, GenerationStage.COMPLETED);
                } else if (error instanceof GenerationCancelledException) {
                    state = new GenerationState(false, 0f, GenerationStage.CANCELLED);
                } else {
                    state = new GenerationState(false, 0f, GenerationStage.FAILED);
                }
                currentRun = null;
            }
        }
        if (error == null) {
            run.result.complete(particles);
        } else if (error instanceof GenerationCancelledException) {
            logger.info("Generation cancelled: {}", error.getMessage());
            run.result.completeExceptionally(error);
        } else {
            logger.error("Generation failed", error);
            run.result.completeExceptionally(error);
        }
        return true;
    }

    /**
     * Cancels the in-flight generation, if any. Its future completes with a
     * {@link GenerationCancelledException} right away; stages still running
     * stop at their next cancellation check.
     */
    public void cancelGeneration() {
        GenerationRun run;
        synchronized (stateLock) {
            run = currentRun;
            if (run == null) {
                return;
            }
            run.token.cancel();
        }
        finish(run, null, new GenerationCancelledException("Generation cancelled by request"));
    }

    public GenerationState snapshot() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isGenerating() {
        return snapshot().isGenerating();
    }

    public float currentProgress() {
        return snapshot().getProgress();
    }

    public GenerationStage currentStage() {
        return snapshot().getStage();
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    public ResultCache<List<Particle>> getCache() {
        return cache;
    }

    @Override
    public void close() {
        cancelGeneration();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Generation workers did not stop within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * One generate call. Progress goes through here so that nothing is reported
     * once the run has reached a terminal state.
     */
    private final class GenerationRun {

        final CancellationToken token = new CancellationToken();
        final CompletableFuture<List<Particle>> result = new CompletableFuture<>();
        private final ProgressListener listener;
        private boolean terminal;
        private float lastProgress;

        GenerationRun(ProgressListener listener) {
            this.listener = listener;
        }

        synchronized void report(float progress, String stageName) {
            if (terminal || token.isCancelled()) {
                return;
            }
            lastProgress = Math.max(lastProgress, progress);
            synchronized (stateLock) {
                if (currentRun == this) {
                    state = new GenerationState(true, lastProgress, state.getStage());
                }
            }
            try {
                listener.onProgress(lastProgress, stageName);
            } catch (RuntimeException e) {
                logger.warn("Progress listener failed", e);
            }
        }

        /** Marks the run terminal; false if it already was. */
        synchronized boolean terminate() {
            if (terminal) {
                return false;
            }
            terminal = true;
            return true;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pixelflow-generation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
