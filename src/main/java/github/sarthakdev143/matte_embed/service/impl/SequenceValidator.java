package github.sarthakdev143.matte_embed.service.impl;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Component
public class SequenceValidator {

    private final FrameIndexer frameIndexer;

    public SequenceValidator(FrameIndexer frameIndexer) {
        this.frameIndexer = frameIndexer;
    }

    public Optional<String> checkCount(
            String channelKey,
            Path matteFolder,
            List<String> baseFiles,
            List<String> matteFiles) {
        if (matteFiles.size() == baseFiles.size()) {
            return Optional.empty();
        }

        StringBuilder warning = new StringBuilder("File count mismatch for ")
                .append(matteFolder)
                .append(" (channel ")
                .append(channelKey)
                .append("): expected ")
                .append(baseFiles.size())
                .append(", found ")
                .append(matteFiles.size());
        appendDifferences(warning, baseFiles, matteFiles);
        return Optional.of(warning.toString());
    }

    public List<String> checkFrameIdentity(
            List<String> baseFiles,
            Map<String, Path> matteFolders,
            Map<String, List<String>> matteFiles) {
        List<String> warnings = new ArrayList<>();
        Set<String> baseIds = identifierSet(baseFiles);
        List<String> baseOrder = frameIndexer.frameIds(baseFiles).collect(Collectors.toList());

        for (Map.Entry<String, List<String>> channel : matteFiles.entrySet()) {
            String channelKey = channel.getKey();
            List<String> files = channel.getValue();
            Path matteFolder = matteFolders.get(channelKey);

            if (!identifierSet(files).equals(baseIds)) {
                StringBuilder warning = new StringBuilder("Frame mismatch for ")
                        .append(matteFolder)
                        .append(" (channel ")
                        .append(channelKey)
                        .append(")");
                appendDifferences(warning, baseFiles, files);
                warnings.add(warning.toString());
                continue;
            }

            List<String> channelOrder = frameIndexer.frameIds(files).collect(Collectors.toList());
            if (!channelOrder.equals(baseOrder)) {
                warnings.add("Frame order mismatch for "
                        + matteFolder
                        + " (channel "
                        + channelKey
                        + "): duplicate frame identifiers prevent pairing frames by position");
            }
        }
        return warnings;
    }

    private void appendDifferences(StringBuilder warning, List<String> baseFiles, List<String> matteFiles) {
        Set<String> baseIds = identifierSet(baseFiles);
        Set<String> matteIds = identifierSet(matteFiles);

        Set<String> missing = new TreeSet<>(frameIndexer.identifierOrder());
        missing.addAll(baseIds);
        missing.removeAll(matteIds);

        Set<String> extra = new TreeSet<>(frameIndexer.identifierOrder());
        extra.addAll(matteIds);
        extra.removeAll(baseIds);

        if (!missing.isEmpty()) {
            warning.append("; missing frames ").append(missing);
        }
        if (!extra.isEmpty()) {
            warning.append("; extra frames ").append(extra);
        }
    }

    private Set<String> identifierSet(List<String> files) {
        return frameIndexer.frameIds(files).collect(Collectors.toCollection(TreeSet::new));
    }
}
