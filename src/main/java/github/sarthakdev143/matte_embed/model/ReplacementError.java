package github.sarthakdev143.matte_embed.model;

import java.nio.file.Path;

public record ReplacementError(Path baseFolder, String stage, String message) {
}
