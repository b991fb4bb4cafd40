package com.example.pdfmerge.application.service;

import com.example.pdfmerge.application.exception.JobCancelledException;
import com.example.pdfmerge.application.exception.JobTimeoutException;
import com.example.pdfmerge.config.ConversionExecutorConfig;
import com.example.pdfmerge.config.PdfMergeProperties;
import com.example.pdfmerge.domain.exception.NoFilesException;
import com.example.pdfmerge.domain.model.ArtifactHandle;
import com.example.pdfmerge.domain.model.ConvertedDocument;
import com.example.pdfmerge.domain.model.FitResult;
import com.example.pdfmerge.domain.model.JobState;
import com.example.pdfmerge.domain.model.MergeJob;
import com.example.pdfmerge.domain.model.OutputDocument;
import com.example.pdfmerge.domain.model.PdfDocumentMetadata;
import com.example.pdfmerge.domain.model.SourceFile;
import com.example.pdfmerge.domain.model.SourceKind;
import com.example.pdfmerge.domain.model.StorageArea;
import com.example.pdfmerge.infrastructure.exception.ArtifactStoreException;
import com.example.pdfmerge.infrastructure.pdf.DocumentAssembler;
import com.example.pdfmerge.infrastructure.pdf.ImageToDocumentConverter;
import com.example.pdfmerge.infrastructure.pdf.PdfBoxMetadataReader;
import com.example.pdfmerge.infrastructure.storage.ArtifactStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Application-layer service that runs one merge job: stage and convert every upload, merge the results in
 * submission order, keep the merged document and throw everything else away.
 * <p>
 * A job is all-or-nothing. The first failing file, an expired job timeout or an interrupt of the calling thread
 * stops the job, deletes every artifact it created and rethrows the first error.
 */
@Service
public class ConversionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);
    private static final DateTimeFormatter JOB_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    static final String MDC_JOB_ID = "jobId";
    static final String OUTPUT_PREFIX = "merged_";

    private final ArtifactStore artifactStore;
    private final ImageToDocumentConverter imageConverter;
    private final DocumentAssembler documentAssembler;
    private final PdfBoxMetadataReader metadataReader;
    private final Executor conversionExecutor;
    private final Duration jobTimeout;
    private final Duration cancelGrace;

    /**
     * @param artifactStore      store for staged uploads, converted pages and merged documents
     * @param imageConverter     raster image to one-page PDF conversion
     * @param documentAssembler  ordered merge of PDFs
     * @param metadataReader     description of the merged document
     * @param conversionExecutor worker pool running per-file conversions
     * @param properties         job timeout and cancel grace
     */
    public ConversionPipeline(ArtifactStore artifactStore,
                              ImageToDocumentConverter imageConverter,
                              DocumentAssembler documentAssembler,
                              PdfBoxMetadataReader metadataReader,
                              @Qualifier(ConversionExecutorConfig.CONVERSION_EXECUTOR) Executor conversionExecutor,
                              PdfMergeProperties properties) {
        this.artifactStore = artifactStore;
        this.imageConverter = imageConverter;
        this.documentAssembler = documentAssembler;
        this.metadataReader = metadataReader;
        this.conversionExecutor = conversionExecutor;
        this.jobTimeout = properties.pipeline().jobTimeout();
        this.cancelGrace = properties.pipeline().cancelGrace();
    }

    /**
     * Converts and merges the given files into one stored PDF.
     *
     * @param sources files in the order their pages should appear
     * @return the stored merged document
     * @throws NoFilesException       when {@code sources} is empty
     * @throws JobTimeoutException    when conversions do not finish within the job timeout
     * @throws JobCancelledException  when the calling thread is interrupted; the interrupt flag is restored
     * @throws com.example.pdfmerge.infrastructure.exception.ImageDecodingException when an image cannot be decoded
     * @throws com.example.pdfmerge.infrastructure.exception.PdfProcessingException when a document cannot be merged
     * @throws com.example.pdfmerge.infrastructure.exception.ArtifactStoreException when an artifact cannot be stored
     */
    public OutputDocument run(List<SourceFile> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new NoFilesException();
        }
        MergeJob job = MergeJob.create(newJobId(), sources);
        long deadline = System.nanoTime() + jobTimeout.toNanos();

        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_JOB_ID, job.jobId());
             JobResources resources = new JobResources(artifactStore)) {
            log.info("Merge job {} received with {} file(s)", job.jobId(), sources.size());
            try {
                OutputDocument output = execute(job, resources, deadline);
                log.info("Merge job {} done: {} ({} pages, {} bytes)",
                        job.jobId(), output.name(), output.pageCount(), output.sizeBytes());
                return output;
            } catch (RuntimeException ex) {
                JobState failedIn = job.fail();
                log.warn("Merge job {} failed while {}: {}", job.jobId(), failedIn, ex.getMessage());
                throw ex;
            }
        }
    }

    private OutputDocument execute(MergeJob job, JobResources resources, long deadline) {
        job.transitionTo(JobState.CONVERTING);
        List<ConvertedDocument> documents = convertAll(job, resources, deadline);

        ensureRunnable(job, deadline);
        job.startAssembling(documents);
        if (log.isDebugEnabled()) {
            for (ConvertedDocument document : documents) {
                log.debug("File {} ({}) ready as {}, {} bytes", document.position(), document.sourceName(),
                        document.origin(), artifactStore.size(document.artifact()));
            }
        }

        ArtifactHandle output;
        PdfDocumentMetadata metadata;
        try {
            output = resources.track(artifactStore.store(StorageArea.OUTPUT, OUTPUT_PREFIX + job.jobId() + ".pdf",
                    target -> documentAssembler.assemble(documents, target)));
            metadata = metadataReader.readMetadata(artifactStore.load(output));
        } catch (ArtifactStoreException e) {
            // interruptible file channels fail with ClosedByInterruptException
            if (Thread.currentThread().isInterrupted()) {
                throw new JobCancelledException(job.jobId(), e);
            }
            throw e;
        }

        job.transitionTo(JobState.DONE);
        resources.keep(output);
        return new OutputDocument(output.name(), metadata.fileSizeBytes(), metadata.pageCount(), job.createdAt(), metadata);
    }

    /**
     * Runs all conversions on the worker pool and waits for them. Results are placed by submission position,
     * so completion order does not matter; the first failure cancels whatever is still running and waits,
     * up to the cancel grace, for the cancelled conversions to stop before the job is cleaned up.
     */
    private List<ConvertedDocument> convertAll(MergeJob job, JobResources resources, long deadline) {
        List<SourceFile> sources = job.sources();
        CompletionService<ConvertedDocument> completion = new ExecutorCompletionService<>(conversionExecutor);
        List<Future<ConvertedDocument>> pending = new ArrayList<>(sources.size());
        List<AtomicBoolean> claimed = new ArrayList<>(sources.size());
        CountDownLatch settled = new CountDownLatch(sources.size());
        ConvertedDocument[] byPosition = new ConvertedDocument[sources.size()];

        boolean completed = false;
        try {
            for (int i = 0; i < sources.size(); i++) {
                int position = i;
                SourceFile source = sources.get(i);
                AtomicBoolean started = new AtomicBoolean();
                claimed.add(started);
                pending.add(completion.submit(() -> {
                    if (!started.compareAndSet(false, true)) {
                        return null;
                    }
                    try {
                        return prepare(job.jobId(), position, source, resources);
                    } finally {
                        settled.countDown();
                    }
                }));
            }
            for (int done = 0; done < sources.size(); done++) {
                long remaining = deadline - System.nanoTime();
                Future<ConvertedDocument> next = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (next == null) {
                    throw new JobTimeoutException(job.jobId(), jobTimeout);
                }
                ConvertedDocument document = unwrap(next);
                byPosition[document.position()] = document;
            }
            completed = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException(job.jobId());
        } finally {
            if (!completed) {
                pending.forEach(future -> future.cancel(true));
                // conversions that never started will not count down themselves
                for (AtomicBoolean started : claimed) {
                    if (started.compareAndSet(false, true)) {
                        settled.countDown();
                    }
                }
                awaitSettled(job, settled);
            }
        }
        return Arrays.asList(byPosition);
    }

    /**
     * Waits for cancelled conversions to stop. Runs on the failure path, so an interrupt of the calling thread
     * does not cut the wait short; it is restored afterwards.
     */
    private void awaitSettled(MergeJob job, CountDownLatch settled) {
        long graceDeadline = System.nanoTime() + cancelGrace.toNanos();
        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    if (!settled.await(Math.max(0, graceDeadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                        log.warn("Merge job {}: {} conversion(s) still running after {} ms, cleaning up without them",
                                job.jobId(), settled.getCount(), cancelGrace.toMillis());
                    }
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Stages one upload and, for images, converts it. Runs on a worker thread.
     */
    private ConvertedDocument prepare(String jobId, int position, SourceFile source, JobResources resources) {
        if (Thread.currentThread().isInterrupted()) {
            throw new JobCancelledException(jobId);
        }
        String baseName = jobId + "_" + position + "_" + safeName(source.name());
        ArtifactHandle original = resources.track(artifactStore.store(StorageArea.UPLOADS, baseName, source.content()));
        if (source.kind() == SourceKind.DOCUMENT) {
            log.debug("File {} ({}) passed through as document", position, source.name());
            return new ConvertedDocument(position, source.name(), SourceKind.DOCUMENT, original);
        }

        ArtifactHandle page = resources.track(artifactStore.store(StorageArea.UPLOADS, stem(baseName) + ".page.pdf", target -> {
            FitResult fit = imageConverter.convert(source, target);
            log.debug("File {} ({}) converted to a page at scale {}", position, source.name(), fit.scale());
        }));
        resources.discard(original);
        return new ConvertedDocument(position, source.name(), SourceKind.RASTER_IMAGE, page);
    }

    private void ensureRunnable(MergeJob job, long deadline) {
        if (Thread.currentThread().isInterrupted()) {
            throw new JobCancelledException(job.jobId());
        }
        if (deadline - System.nanoTime() <= 0) {
            throw new JobTimeoutException(job.jobId(), jobTimeout);
        }
    }

    private static ConvertedDocument unwrap(Future<ConvertedDocument> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Conversion failed", cause);
        }
    }

    private static String newJobId() {
        byte[] suffix = new byte[4];
        ThreadLocalRandom.current().nextBytes(suffix);
        return LocalDateTime.now().format(JOB_TIMESTAMP) + "_" + HexFormat.of().formatHex(suffix);
    }

    /**
     * Reduces a client-supplied file name to characters that are safe in a file system name.
     */
    static String safeName(String fileName) {
        String name = fileName.substring(Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\')) + 1);
        name = UNSAFE_NAME_CHARS.matcher(name).replaceAll("_");
        while (name.startsWith(".")) {
            name = name.substring(1);
        }
        return name.isEmpty() ? "upload" : name;
    }

    private static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
