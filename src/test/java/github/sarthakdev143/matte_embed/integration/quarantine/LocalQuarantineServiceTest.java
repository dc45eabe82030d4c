package github.sarthakdev143.matte_embed.integration.quarantine;

import github.sarthakdev143.matte_embed.config.MatteEmbedProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalQuarantineServiceTest {

    @TempDir
    Path root;

    private final LocalQuarantineService quarantineService =
            new LocalQuarantineService(MatteEmbedProperties.defaults());

    @Test
    void movesFolderIntoSiblingTrash() throws Exception {
        Path folder = Files.createDirectories(root.resolve("Seq"));
        Files.writeString(folder.resolve("Seq.0001.exr"), "data");

        Path target = quarantineService.quarantine(folder);

        assertThat(folder).doesNotExist();
        assertThat(target).isEqualTo(root.toAbsolutePath().resolve(".matte-embed-trash").resolve("Seq"));
        assertThat(target.resolve("Seq.0001.exr")).hasContent("data");
    }

    @Test
    void repeatedNamesGetNumberedTargets() throws Exception {
        Files.createDirectories(root.resolve("Seq"));
        Path first = quarantineService.quarantine(root.resolve("Seq"));
        Files.createDirectories(root.resolve("Seq"));
        Path second = quarantineService.quarantine(root.resolve("Seq"));
        Files.createDirectories(root.resolve("Seq"));
        Path third = quarantineService.quarantine(root.resolve("Seq"));

        assertThat(first.getFileName().toString()).isEqualTo("Seq");
        assertThat(second.getFileName().toString()).isEqualTo("Seq.1");
        assertThat(third.getFileName().toString()).isEqualTo("Seq.2");
        assertThat(first).isDirectory();
        assertThat(second).isDirectory();
    }

    @Test
    void configuredTrashNameIsUsed() throws Exception {
        LocalQuarantineService custom = new LocalQuarantineService(
                new MatteEmbedProperties(null, null, 0, Duration.ofMillis(50), ".trash", null));
        Path folder = Files.createDirectories(root.resolve("Seq_matte"));

        Path target = custom.quarantine(folder);

        assertThat(target.getParent().getFileName().toString()).isEqualTo(".trash");
    }

    @Test
    void missingPathIsRejected() {
        assertThatThrownBy(() -> quarantineService.quarantine(root.resolve("missing")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
