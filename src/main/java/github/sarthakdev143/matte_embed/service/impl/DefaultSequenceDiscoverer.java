package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.config.MatteEmbedProperties;
import github.sarthakdev143.matte_embed.model.ScanReport;
import github.sarthakdev143.matte_embed.model.SequenceGroup;
import github.sarthakdev143.matte_embed.service.SequenceDiscoverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class DefaultSequenceDiscoverer implements SequenceDiscoverer {

    private static final Logger logger = LoggerFactory.getLogger(DefaultSequenceDiscoverer.class);
    private static final Pattern MATTE_FOLDER_PATTERN = Pattern.compile("^(.+)_matte(.*)$");
    private static final String EMBEDDED_SUFFIX = "_embedded";
    private static final String STAGING_SUFFIX = "_embedded.staging";
    private static final Comparator<String> CHANNEL_KEY_ORDER = Comparator
            .comparing((String key) -> !SequenceGroup.BASE_CHANNEL_KEY.equals(key))
            .thenComparing(Comparator.naturalOrder());

    private final FrameIndexer frameIndexer;
    private final SequenceValidator sequenceValidator;
    private final ChannelNameResolver channelNameResolver;
    private final MatteEmbedProperties properties;

    public DefaultSequenceDiscoverer(
            FrameIndexer frameIndexer,
            SequenceValidator sequenceValidator,
            ChannelNameResolver channelNameResolver,
            MatteEmbedProperties properties) {
        this.frameIndexer = frameIndexer;
        this.sequenceValidator = sequenceValidator;
        this.channelNameResolver = channelNameResolver;
        this.properties = properties;
    }

    @Override
    public ScanReport discover(Path root) throws IOException {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Folder does not exist or is not a directory: " + root);
        }

        List<String> warnings = new ArrayList<>();
        Map<Path, Map<String, Path>> matteFoldersByBase = collectMatteFolders(root, warnings);

        List<SequenceGroup> groups = new ArrayList<>();
        for (Map.Entry<Path, Map<String, Path>> entry : matteFoldersByBase.entrySet()) {
            buildGroup(entry.getKey(), entry.getValue(), warnings).ifPresent(groups::add);
        }

        ScanReport report = new ScanReport(root, groups, warnings);
        logger.info(
                "Scanned {} sequences={} files={} warnings={}",
                root,
                report.totalSequences(),
                report.totalFiles(),
                warnings.size());
        return report;
    }

    private Map<Path, Map<String, Path>> collectMatteFolders(Path root, List<String> warnings) throws IOException {
        List<Path> matteFolders = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isSkipped(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (!dir.equals(root) && MATTE_FOLDER_PATTERN.matcher(dir.getFileName().toString()).matches()) {
                    matteFolders.add(dir);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                warnings.add("Error reading folder " + file + ": " + exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        matteFolders.sort(Comparator.comparing(Path::toString));

        Map<Path, Map<String, Path>> byBase = new TreeMap<>(Comparator.comparing(Path::toString));
        for (Path matteFolder : matteFolders) {
            Matcher matcher = MATTE_FOLDER_PATTERN.matcher(matteFolder.getFileName().toString());
            if (!matcher.matches()) {
                continue;
            }
            Path baseFolder = matteFolder.resolveSibling(matcher.group(1));
            if (!Files.isDirectory(baseFolder)) {
                warnings.add("Base folder not found for matte folder: " + matteFolder);
                continue;
            }

            String channelKey = toChannelKey(matcher.group(2));
            Map<String, Path> channels = byBase.computeIfAbsent(baseFolder, ignored -> new TreeMap<>(CHANNEL_KEY_ORDER));
            Path previous = channels.put(channelKey, matteFolder);
            if (previous != null) {
                warnings.add("Duplicate matte channel " + channelKey + " for " + baseFolder + ": "
                        + matteFolder.getFileName() + " replaces " + previous.getFileName());
            }
        }
        return byBase;
    }

    private Optional<SequenceGroup> buildGroup(Path baseFolder, Map<String, Path> matteFolders, List<String> warnings) {
        List<String> baseFiles;
        try {
            baseFiles = listImageFiles(baseFolder);
        } catch (IOException e) {
            warnings.add("Error reading base folder " + baseFolder + ": " + e.getMessage());
            return Optional.empty();
        }
        if (baseFiles.isEmpty()) {
            warnings.add("No EXR files found in base folder: " + baseFolder);
            return Optional.empty();
        }

        Map<String, List<String>> matteFiles = new LinkedHashMap<>();
        for (Map.Entry<String, Path> channel : matteFolders.entrySet()) {
            List<String> channelFiles;
            try {
                channelFiles = listImageFiles(channel.getValue());
            } catch (IOException e) {
                warnings.add("Error reading matte folder " + channel.getValue() + ": " + e.getMessage());
                return Optional.empty();
            }

            Optional<String> countWarning = sequenceValidator.checkCount(
                    channel.getKey(),
                    channel.getValue(),
                    baseFiles,
                    channelFiles);
            if (countWarning.isPresent()) {
                warnings.add(countWarning.get());
                return Optional.empty();
            }
            matteFiles.put(channel.getKey(), channelFiles);
        }

        List<String> identityWarnings = sequenceValidator.checkFrameIdentity(baseFiles, matteFolders, matteFiles);
        if (!identityWarnings.isEmpty()) {
            warnings.addAll(identityWarnings);
            return Optional.empty();
        }

        Map<String, String> channelNames;
        try {
            channelNames = channelNameResolver.resolveAll(matteFolders.keySet(), properties.defaultMatteChannel());
        } catch (IllegalArgumentException e) {
            warnings.add("Channel name collision for " + baseFolder + ": " + e.getMessage());
            return Optional.empty();
        }

        return Optional.of(new SequenceGroup(
                baseFolder,
                matteFolders,
                baseFiles,
                matteFiles,
                channelNames,
                describeSequenceType(matteFolders, channelNames)));
    }

    private List<String> listImageFiles(Path folder) throws IOException {
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(frameIndexer::isImageFile)
                    .sorted(frameIndexer.frameOrder())
                    .collect(Collectors.toList());
        }
    }

    private String describeSequenceType(Map<String, Path> matteFolders, Map<String, String> channelNames) {
        if (matteFolders.size() == 1 && matteFolders.containsKey(SequenceGroup.BASE_CHANNEL_KEY)) {
            return SequenceGroup.SINGLE_CHANNEL_TYPE;
        }
        return "Multi-Channel (" + String.join(", ", channelNames.values()) + ")";
    }

    private boolean isSkipped(Path dir) {
        String name = dir.getFileName().toString();
        return name.endsWith(EMBEDDED_SUFFIX)
                || name.endsWith(STAGING_SUFFIX)
                || name.equals(properties.quarantineDirectoryName());
    }

    private String toChannelKey(String suffix) {
        return suffix.isEmpty() ? SequenceGroup.BASE_CHANNEL_KEY : suffix.toLowerCase(Locale.ROOT);
    }
}
