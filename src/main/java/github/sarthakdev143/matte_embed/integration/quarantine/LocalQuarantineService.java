package github.sarthakdev143.matte_embed.integration.quarantine;

import github.sarthakdev143.matte_embed.config.MatteEmbedProperties;
import github.sarthakdev143.matte_embed.service.QuarantineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Component
public class LocalQuarantineService implements QuarantineService {

    private static final Logger logger = LoggerFactory.getLogger(LocalQuarantineService.class);

    private final MatteEmbedProperties properties;

    public LocalQuarantineService(MatteEmbedProperties properties) {
        this.properties = properties;
    }

    @Override
    public Path quarantine(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }

        Path trashDirectory = path.toAbsolutePath().resolveSibling(properties.quarantineDirectoryName());
        Files.createDirectories(trashDirectory);
        Path target = uniqueTarget(trashDirectory, path.getFileName().toString());

        try {
            Files.move(path, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(path, target);
        }
        logger.info("Quarantined {} to {}", path, target);
        return target;
    }

    private Path uniqueTarget(Path trashDirectory, String name) {
        Path candidate = trashDirectory.resolve(name);
        int attempt = 1;
        while (Files.exists(candidate)) {
            candidate = trashDirectory.resolve(name + "." + attempt);
            attempt++;
        }
        return candidate;
    }
}
