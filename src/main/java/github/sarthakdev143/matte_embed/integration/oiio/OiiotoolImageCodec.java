package github.sarthakdev143.matte_embed.integration.oiio;

import github.sarthakdev143.matte_embed.config.MatteEmbedProperties;
import github.sarthakdev143.matte_embed.model.image.DataWindow;
import github.sarthakdev143.matte_embed.model.image.ImageHandle;
import github.sarthakdev143.matte_embed.model.image.ImageHeader;
import github.sarthakdev143.matte_embed.model.image.PixelBuffer;
import github.sarthakdev143.matte_embed.model.image.PixelType;
import github.sarthakdev143.matte_embed.service.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class OiiotoolImageCodec implements ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(OiiotoolImageCodec.class);
    private static final String OIIOTOOL_PATH_ENV = "OIIOTOOL_PATH";
    private static final String COMPRESSION_ATTRIBUTE = "compression";
    private static final Pattern RESOLUTION_PATTERN = Pattern.compile(":\\s*(\\d+)\\s*x\\s*(\\d+)\\s*,");
    private static final Pattern ORIGIN_PATTERN = Pattern.compile("pixel data origin:\\s*x=\\s*(-?\\d+),\\s*y=\\s*(-?\\d+)");
    private static final Pattern CHANNEL_LIST_PATTERN = Pattern.compile("^\\s*channel list:\\s*(.*)$");
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile("^\\s+([A-Za-z][\\w:/.\\-]*):\\s*(.*)$");

    private final MatteEmbedProperties properties;

    public OiiotoolImageCodec(MatteEmbedProperties properties) {
        this.properties = properties;
    }

    @Override
    public ImageHandle open(Path path) throws IOException, InterruptedException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + path);
        }
        String output = runCommand(buildInfoCommand(path), "read header of " + path.getFileName());
        return new ImageHandle(path, parseInfo(output));
    }

    @Override
    public ImageHeader header(ImageHandle handle) {
        return handle.header();
    }

    @Override
    public PixelBuffer readChannel(ImageHandle handle, String channelName, PixelType pixelType) throws IOException {
        if (!handle.header().hasChannel(channelName)) {
            throw new IOException("Channel " + channelName + " not found in " + handle.path().getFileName()
                    + " (available: " + String.join(", ", handle.header().channelNames()) + ")");
        }
        return new PixelBuffer(handle, channelName, pixelType);
    }

    @Override
    public void close(ImageHandle handle) {
        logger.debug("Released image handle for {}", handle.path());
    }

    @Override
    public void write(Path path, ImageHeader header, Map<String, PixelBuffer> channels)
            throws IOException, InterruptedException {
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("At least one channel is required to write " + path);
        }
        runCommand(buildWriteCommand(path, header, channels), "write " + path.getFileName());
    }

    List<String> buildInfoCommand(Path path) {
        return List.of(resolveOiiotoolBinary(), "--info", "-v", path.toString());
    }

    List<String> buildWriteCommand(Path outputPath, ImageHeader header, Map<String, PixelBuffer> channels) {
        List<String> command = new ArrayList<>();
        command.add(resolveOiiotoolBinary());

        List<List<Map.Entry<String, PixelBuffer>>> runs = groupBySource(channels);
        for (int index = 0; index < runs.size(); index++) {
            List<Map.Entry<String, PixelBuffer>> run = runs.get(index);
            command.add(run.get(0).getValue().source().path().toString());
            command.add("--ch");
            command.add(run.stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue().channelName())
                    .collect(Collectors.joining(",")));
            if (index > 0) {
                command.add("--chappend");
            }
        }

        ImageHeader sourceHeader = runs.get(0).get(0).getValue().source().header();
        for (String attribute : sourceHeader.attributes().keySet()) {
            if (!COMPRESSION_ATTRIBUTE.equals(attribute) && !header.attributes().containsKey(attribute)) {
                command.add("--eraseattrib");
                command.add(attribute);
            }
        }

        String compression = header.attributes().get(COMPRESSION_ATTRIBUTE);
        if (compression != null && !compression.isBlank()) {
            command.add("--compression");
            command.add(compression);
        }

        boolean allHalf = channels.values().stream().allMatch(buffer -> buffer.pixelType() == PixelType.HALF);
        if (allHalf) {
            command.add("-d");
            command.add("half");
        }

        command.add("-o");
        command.add(outputPath.toString());
        return command;
    }

    ImageHeader parseInfo(String output) throws IOException {
        String[] lines = output.split("\\R");
        Matcher resolution = lines.length == 0 ? null : RESOLUTION_PATTERN.matcher(lines[0]);
        if (resolution == null || !resolution.find()) {
            throw new IOException("Unrecognised oiiotool header output: " + output.strip());
        }
        int width = Integer.parseInt(resolution.group(1));
        int height = Integer.parseInt(resolution.group(2));
        int originX = 0;
        int originY = 0;
        List<String> channelNames = List.of();
        Map<String, String> attributes = new LinkedHashMap<>();

        for (int index = 1; index < lines.length; index++) {
            String line = lines[index];
            Matcher origin = ORIGIN_PATTERN.matcher(line);
            if (origin.find()) {
                originX = Integer.parseInt(origin.group(1));
                originY = Integer.parseInt(origin.group(2));
                continue;
            }
            Matcher channelList = CHANNEL_LIST_PATTERN.matcher(line);
            if (channelList.matches()) {
                channelNames = Arrays.stream(channelList.group(1).split(","))
                        .map(String::trim)
                        .filter(name -> !name.isEmpty())
                        .map(name -> name.replaceAll("\\s*\\(.*\\)$", ""))
                        .collect(Collectors.toList());
                continue;
            }
            Matcher attribute = ATTRIBUTE_PATTERN.matcher(line);
            if (attribute.matches()) {
                attributes.put(attribute.group(1), unquote(attribute.group(2).trim()));
            }
        }

        if (channelNames.isEmpty()) {
            throw new IOException("oiiotool reported no channels: " + lines[0].strip());
        }
        DataWindow dataWindow = new DataWindow(originX, originY, originX + width - 1, originY + height - 1);
        return new ImageHeader(dataWindow, channelNames, attributes);
    }

    private List<List<Map.Entry<String, PixelBuffer>>> groupBySource(Map<String, PixelBuffer> channels) {
        List<List<Map.Entry<String, PixelBuffer>>> runs = new ArrayList<>();
        List<Map.Entry<String, PixelBuffer>> current = null;
        Path currentSource = null;
        for (Map.Entry<String, PixelBuffer> entry : channels.entrySet()) {
            Path source = entry.getValue().source().path();
            if (current == null || !source.equals(currentSource)) {
                current = new ArrayList<>();
                runs.add(current);
                currentSource = source;
            }
            current.add(entry);
        }
        return runs;
    }

    private String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private String runCommand(List<String> command, String stage) throws IOException, InterruptedException {
        logger.debug("Running oiiotool command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        }

        int exitCode = process.waitFor();
        if (exitCode != 0) {
            throw new IOException(
                    "oiiotool failed during stage "
                            + stage
                            + " with exit code "
                            + exitCode
                            + ". Output: "
                            + output.toString().strip());
        }
        return output.toString();
    }

    String resolveOiiotoolBinary() {
        String configuredPath = System.getenv(OIIOTOOL_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return properties.oiiotoolPath();
    }
}
