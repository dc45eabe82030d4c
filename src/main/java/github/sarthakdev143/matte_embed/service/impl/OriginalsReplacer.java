package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.model.ReplacementError;
import github.sarthakdev143.matte_embed.model.ReplacementOutcome;
import github.sarthakdev143.matte_embed.model.SequenceGroup;
import github.sarthakdev143.matte_embed.service.QuarantineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Swaps each processed base folder for its {@code _embedded} output and quarantines the originals.
 * <p>
 * Per group: the output is first renamed to {@code <base>_embedded.staging}, then the base folder is
 * quarantined, then the staging folder takes the base folder's path, and finally the matte folders are
 * quarantined. Between the second and third step the embedded frames exist under the staging name, so
 * no interruption leaves both the original and the output missing.
 */
@Component
public class OriginalsReplacer {

    private static final Logger logger = LoggerFactory.getLogger(OriginalsReplacer.class);
    static final String STAGING_SUFFIX = ".staging";

    private final QuarantineService quarantineService;

    public OriginalsReplacer(QuarantineService quarantineService) {
        this.quarantineService = quarantineService;
    }

    public ReplacementOutcome replace(List<SequenceGroup> groups) {
        List<Path> replaced = new ArrayList<>();
        List<ReplacementError> errors = new ArrayList<>();
        for (SequenceGroup group : groups) {
            if (replaceGroup(group, errors)) {
                replaced.add(group.baseFolder());
            }
        }
        logger.info("Replaced {} of {} sequences; {} replacement errors", replaced.size(), groups.size(), errors.size());
        return new ReplacementOutcome(replaced, errors);
    }

    private boolean replaceGroup(SequenceGroup group, List<ReplacementError> errors) {
        Path baseFolder = group.baseFolder();
        Path embeddedFolder = group.embeddedFolder();
        if (!Files.isDirectory(embeddedFolder)) {
            errors.add(new ReplacementError(baseFolder, "verify", "Embedded folder not found: " + embeddedFolder));
            return false;
        }

        Path stagingFolder = embeddedFolder.resolveSibling(embeddedFolder.getFileName() + STAGING_SUFFIX);
        try {
            if (Files.exists(stagingFolder)) {
                throw new FileAlreadyExistsException(stagingFolder.toString());
            }
            move(embeddedFolder, stagingFolder);
        } catch (IOException e) {
            errors.add(new ReplacementError(baseFolder, "stage", describe(e)));
            return false;
        }

        try {
            quarantineService.quarantine(baseFolder);
        } catch (IOException e) {
            errors.add(new ReplacementError(baseFolder, "quarantine", describe(e)));
            restoreStaging(stagingFolder, embeddedFolder);
            return false;
        }

        try {
            move(stagingFolder, baseFolder);
        } catch (IOException e) {
            logger.error(
                    "Replacement of {} interrupted: original was quarantined, embedded frames remain at {}",
                    baseFolder,
                    stagingFolder,
                    e);
            errors.add(new ReplacementError(
                    baseFolder,
                    "rename",
                    "Original quarantined but embedded output could not be renamed; recover it from "
                            + stagingFolder + ": " + describe(e)));
            return false;
        }

        for (Path matteFolder : group.matteFolders().values()) {
            try {
                quarantineService.quarantine(matteFolder);
            } catch (IOException e) {
                errors.add(new ReplacementError(baseFolder, "quarantine", "Matte folder " + matteFolder + ": " + describe(e)));
            }
        }
        return true;
    }

    private void restoreStaging(Path stagingFolder, Path embeddedFolder) {
        try {
            move(stagingFolder, embeddedFolder);
        } catch (IOException e) {
            logger.error("Could not move {} back to {}", stagingFolder, embeddedFolder, e);
        }
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private String describe(IOException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
