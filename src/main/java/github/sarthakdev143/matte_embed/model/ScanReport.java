package github.sarthakdev143.matte_embed.model;

import java.nio.file.Path;
import java.util.List;

public record ScanReport(
        Path root,
        List<SequenceGroup> groups,
        List<String> warnings) {

    public ScanReport {
        groups = groups == null ? List.of() : List.copyOf(groups);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public int totalSequences() {
        return groups.size();
    }

    public int totalFiles() {
        return groups.stream().mapToInt(group -> group.baseFiles().size()).sum();
    }
}
