package github.sarthakdev143.matte_embed.model.image;

import java.nio.file.Path;

public record ImageHandle(Path path, ImageHeader header) {
}
