package com.example.visualdata;

import com.example.visualdata.exif.MetadataExtractorReader;
import com.example.visualdata.model.DiscoveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // Basic CLI contract: a single JSON config file path is required.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar visual-data-discoverer.jar <config.json>");
            System.exit(1);
        }
        DiscoveryConfig config = new ConfigLoader().load(Path.of(args[0]));
        run(config, publisherFor(config));
    }

    /**
     * Runs one discovery, writes its manifest and publishes a non-empty sequence.
     * The publisher is closed before returning.
     */
    static DiscoveryResult<?> run(DiscoveryConfig config, SequencePublisher publisher) throws Exception {
        try (publisher) {
            VisualDataDiscoverer<?> discoverer = config.mode().discoverer(new MetadataExtractorReader(), config.threadCount());
            DiscoveryResult<?> result = discoverer.discover(config.directory());
            new ManifestWriter().write(result, config.manifestFile());
            LOGGER.info("Wrote manifest {}", config.manifestFile());
            if (result.isEmpty()) {
                LOGGER.warn("No {} files found in {}; nothing to publish", result.type().tag(), config.directory());
                return result;
            }
            LOGGER.info("Discovered {} {} files in {}", result.size(), result.type().tag(), config.directory());
            PublishReport report = publisher.publish(config.directory(), result, config.manifestFile());
            if (!report.isComplete()) {
                LOGGER.warn("{} files of {} could not be published", report.failedFiles().size(), config.directory());
            }
            return result;
        }
    }

    private static SequencePublisher publisherFor(DiscoveryConfig config) {
        if (!config.s3UploadEnabled()) {
            return SequencePublisher.none();
        }
        return new S3SequencePublisher(
                config.s3Bucket().orElseThrow(),
                config.s3Prefix().orElse(""),
                config.s3Region()
        );
    }
}
