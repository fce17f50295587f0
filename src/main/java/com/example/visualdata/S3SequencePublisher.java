package com.example.visualdata;

import com.example.visualdata.model.DiscoveryResult;
import com.example.visualdata.model.VisualData;
import com.example.visualdata.model.VisualDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Uploads a sequence to S3 under {@code <prefix>/<sequence directory name>/}.
 * Media files go first, in index order, and the manifest last, so a reader that
 * finds the manifest also finds every file it lists. A failed upload is logged
 * and reported; it never aborts the remaining uploads.
 */
public final class S3SequencePublisher implements SequencePublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3SequencePublisher.class);

    private final S3Client s3Client;
    private final String bucket;
    private final String prefix;

    public S3SequencePublisher(String bucket, String prefix, Optional<String> region) {
        this(region
                        .map(Region::of)
                        .map(r -> S3Client.builder().region(r).build())
                        .orElseGet(() -> S3Client.builder().build()),
                bucket,
                prefix);
    }

    S3SequencePublisher(S3Client s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
    }

    @Override
    public PublishReport publish(Path sequenceDirectory, DiscoveryResult<?> result, Path manifest) {
        String sequenceKey = sequenceKey(sequenceDirectory);
        List<String> uploaded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        String mediaType = contentTypeFor(result.type());
        for (VisualData<?> item : result.items()) {
            Path file = Path.of(item.path());
            upload(file, sequenceKey + file.getFileName(), mediaType, uploaded, failed);
        }
        upload(manifest, sequenceKey + manifest.getFileName(), "application/json", uploaded, failed);
        LOGGER.info("Published {} objects to s3://{}/{} ({} failed)", uploaded.size(), bucket, sequenceKey, failed.size());
        return new PublishReport(uploaded, failed);
    }

    @Override
    public void close() {
        s3Client.close();
    }

    /**
     * Key prefix shared by every object of the sequence, ending with a slash.
     */
    String sequenceKey(Path sequenceDirectory) {
        Path name = sequenceDirectory.toAbsolutePath().normalize().getFileName();
        String sequence = name == null ? "root" : name.toString();
        return prefix.isEmpty() ? sequence + "/" : prefix + "/" + sequence + "/";
    }

    private void upload(Path file, String key, String contentType, List<String> uploaded, List<String> failed) {
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .build();
            s3Client.putObject(request, RequestBody.fromFile(file));
            uploaded.add(key);
            LOGGER.debug("Uploaded {} to s3://{}/{}", file, bucket, key);
        } catch (SdkException | UncheckedIOException ex) {
            failed.add(file.toString());
            LOGGER.warn("Failed to upload {} to S3", file, ex);
        }
    }

    private static String contentTypeFor(VisualDataType type) {
        return type == VisualDataType.VIDEO ? "video/mp4" : "image/jpeg";
    }
}
