package github.sarthakdev143.matte_embed.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EmbedTask(
        Path baseFolder,
        Map<String, Path> matteFolders,
        String baseFilename,
        Map<String, String> matteFilenames,
        Map<String, String> channelNames,
        Compression compression,
        String matteChannelBasename) {

    public EmbedTask {
        matteFolders = matteFolders == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(matteFolders));
        matteFilenames = matteFilenames == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(matteFilenames));
        channelNames = channelNames == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(channelNames));
    }

    public Path baseFile() {
        return baseFolder.resolve(baseFilename);
    }

    public Path matteFile(String channelKey) {
        return matteFolders.get(channelKey).resolve(matteFilenames.get(channelKey));
    }

    public Path outputFile() {
        return baseFolder.resolveSibling(baseFolder.getFileName() + "_embedded").resolve(baseFilename);
    }
}
