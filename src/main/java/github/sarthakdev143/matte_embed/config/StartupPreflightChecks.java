package github.sarthakdev143.matte_embed.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "matte-embed.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final String OIIOTOOL_PATH_ENV = "OIIOTOOL_PATH";
    private static final int OIIOTOOL_CHECK_TIMEOUT_SECONDS = 10;

    private final MatteEmbedProperties properties;

    public StartupPreflightChecks(MatteEmbedProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkOiiotoolConfiguration();
        checkDefaults();
    }

    private void checkOiiotoolConfiguration() {
        String configuredPath = System.getenv(OIIOTOOL_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            Path oiiotoolPath = Path.of(configuredPath);
            if (!Files.isRegularFile(oiiotoolPath)) {
                throw new IllegalStateException(
                        "oiiotool binary not found at " + oiiotoolPath.toAbsolutePath()
                                + ". Set " + OIIOTOOL_PATH_ENV + " to a valid oiiotool executable path.");
            }
            return;
        }

        try {
            Process process = new ProcessBuilder(properties.oiiotoolPath(), "--version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(OIIOTOOL_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "oiiotool is not available. Install OpenImageIO or set " + OIIOTOOL_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "oiiotool is not available. Install OpenImageIO or set " + OIIOTOOL_PATH_ENV + ".",
                    e);
        }
    }

    private void checkDefaults() {
        try {
            properties.compression();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("matte-embed.default-compression is invalid: " + e.getMessage(), e);
        }
    }
}
