package com.example.visualdata;

import com.example.visualdata.exif.ExifExtractor;
import com.example.visualdata.model.DiscoveryResult;
import com.example.visualdata.model.Photo;
import com.example.visualdata.model.Video;
import com.example.visualdata.model.VisualData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scans one directory (no recursion) for the files a {@link DiscoveryPolicy}
 * accepts, builds a record per file, drops the files the policy rejects, orders
 * the rest and numbers them from zero.
 *
 * <p>Directory entries are visited in file-name order and the final sort is
 * stable, so records with equal ordering keys keep their file-name order and
 * repeated runs over an unchanged directory return identical results.
 */
public final class VisualDataDiscoverer<T extends VisualData<T>> {
    private static final Logger LOGGER = LoggerFactory.getLogger(VisualDataDiscoverer.class);

    private final DiscoveryPolicy<T> policy;
    private final int threadCount;

    public VisualDataDiscoverer(DiscoveryPolicy<T> policy) {
        this(policy, 1);
    }

    /**
     * @param threadCount number of threads building records; 1 builds on the caller's thread
     */
    public VisualDataDiscoverer(DiscoveryPolicy<T> policy, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive, got " + threadCount);
        }
        this.policy = policy;
        this.threadCount = threadCount;
    }

    public static VisualDataDiscoverer<Photo> photos() {
        return new VisualDataDiscoverer<>(new PhotoPolicy());
    }

    public static VisualDataDiscoverer<Photo> exifPhotos(ExifExtractor extractor) {
        return new VisualDataDiscoverer<>(new ExifPhotoPolicy(extractor));
    }

    public static VisualDataDiscoverer<Video> videos() {
        return new VisualDataDiscoverer<>(new VideoPolicy());
    }

    public DiscoveryPolicy<T> policy() {
        return policy;
    }

    public DiscoveryResult<T> discover(String directory) throws IOException {
        if (directory == null || directory.isEmpty()) {
            return DiscoveryResult.empty(policy.type());
        }
        Path path;
        try {
            path = Path.of(directory);
        } catch (InvalidPathException ex) {
            LOGGER.debug("Not a valid directory path: {}", directory);
            return DiscoveryResult.empty(policy.type());
        }
        return discover(path);
    }

    /**
     * Discovers the records of the directory. A path that is not an existing
     * directory yields an empty result; a directory that cannot be listed raises.
     */
    public DiscoveryResult<T> discover(Path directory) throws IOException {
        LOGGER.debug("Searching for {} files in {}", policy.type().tag(), directory);
        if (!Files.isDirectory(directory)) {
            return DiscoveryResult.empty(policy.type());
        }

        List<Path> candidates = listCandidates(directory);
        List<T> records = threadCount > 1 && candidates.size() > 1
                ? buildInParallel(candidates)
                : buildSequentially(candidates);

        // List.sort is stable; ties keep file-name order.
        records.sort(policy.ordering());
        List<T> indexed = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            indexed.add(records.get(i).withIndex(i));
        }
        LOGGER.debug("Kept {} of {} {} candidates in {}", indexed.size(), candidates.size(), policy.type().tag(), directory);
        return new DiscoveryResult<>(indexed, policy.type());
    }

    private List<Path> listCandidates(Path directory) throws IOException {
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                Path fileName = entry.getFileName();
                if (fileName != null && policy.accepts(fileName.toString()) && Files.isRegularFile(entry)) {
                    candidates.add(entry);
                }
            }
        }
        candidates.sort(Comparator.comparing(entry -> entry.getFileName().toString()));
        return candidates;
    }

    private List<T> buildSequentially(List<Path> candidates) {
        List<T> records = new ArrayList<>(candidates.size());
        for (Path candidate : candidates) {
            build(candidate).ifPresent(records::add);
        }
        return records;
    }

    private List<T> buildInParallel(List<Path> candidates) throws IOException {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, candidates.size()));
        try {
            List<Future<Optional<T>>> futures = new ArrayList<>(candidates.size());
            for (Path candidate : candidates) {
                futures.add(executor.submit(() -> build(candidate)));
            }
            // Collected in listing order so the result does not depend on scheduling.
            List<T> records = new ArrayList<>(candidates.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get().ifPresent(records::add);
                } catch (ExecutionException ex) {
                    LOGGER.warn("Failed to build record for {}", candidates.get(i), ex.getCause());
                }
            }
            return records;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while building records");
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<T> build(Path candidate) {
        try {
            return policy.build(candidate);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to build record for {}", candidate, ex);
            return Optional.empty();
        }
    }
}
