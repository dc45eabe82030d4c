package github.sarthakdev143.matte_embed.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record SequenceGroup(
        Path baseFolder,
        Map<String, Path> matteFolders,
        List<String> baseFiles,
        Map<String, List<String>> matteFiles,
        Map<String, String> channelNames,
        String sequenceType) {

    public static final String BASE_CHANNEL_KEY = "base";
    public static final String SINGLE_CHANNEL_TYPE = "Single Channel Matte";

    public SequenceGroup {
        matteFolders = matteFolders == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(matteFolders));
        baseFiles = baseFiles == null ? List.of() : List.copyOf(baseFiles);
        matteFiles = matteFiles == null ? Map.of() : copyFileLists(matteFiles);
        channelNames = channelNames == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(channelNames));
    }

    public Set<String> channelKeys() {
        return matteFolders.keySet();
    }

    public Path embeddedFolder() {
        return baseFolder.resolveSibling(baseFolder.getFileName() + "_embedded");
    }

    private static Map<String, List<String>> copyFileLists(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((key, files) -> copy.put(key, List.copyOf(files)));
        return Collections.unmodifiableMap(copy);
    }
}
