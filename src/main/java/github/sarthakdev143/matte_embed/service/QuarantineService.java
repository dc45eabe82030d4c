package github.sarthakdev143.matte_embed.service;

import java.io.IOException;
import java.nio.file.Path;

public interface QuarantineService {

    Path quarantine(Path path) throws IOException;
}
