package github.sarthakdev143.matte_embed.config;

import github.sarthakdev143.matte_embed.model.Compression;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "matte-embed")
public record MatteEmbedProperties(
        String defaultCompression,
        String defaultMatteChannel,
        int defaultWorkers,
        Duration pollInterval,
        String quarantineDirectoryName,
        String oiiotoolPath) {

    private static final String DEFAULT_MATTE_CHANNEL = "matte";
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    private static final String DEFAULT_QUARANTINE_DIRECTORY = ".matte-embed-trash";
    private static final String DEFAULT_OIIOTOOL_BINARY = "oiiotool";

    public MatteEmbedProperties {
        defaultCompression = defaultCompression == null || defaultCompression.isBlank()
                ? Compression.PIZ.toCodecValue()
                : defaultCompression;
        defaultMatteChannel = defaultMatteChannel == null || defaultMatteChannel.isBlank()
                ? DEFAULT_MATTE_CHANNEL
                : defaultMatteChannel;
        defaultWorkers = defaultWorkers > 0
                ? Math.min(defaultWorkers, availableProcessors())
                : Math.max(availableProcessors() / 2, 1);
        pollInterval = pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()
                ? DEFAULT_POLL_INTERVAL
                : pollInterval;
        quarantineDirectoryName = quarantineDirectoryName == null || quarantineDirectoryName.isBlank()
                ? DEFAULT_QUARANTINE_DIRECTORY
                : quarantineDirectoryName;
        oiiotoolPath = oiiotoolPath == null || oiiotoolPath.isBlank() ? DEFAULT_OIIOTOOL_BINARY : oiiotoolPath;
    }

    public static MatteEmbedProperties defaults() {
        return new MatteEmbedProperties(null, null, 0, null, null, null);
    }

    public Compression compression() {
        return Compression.fromInput(defaultCompression);
    }

    private static int availableProcessors() {
        return Runtime.getRuntime().availableProcessors();
    }
}
