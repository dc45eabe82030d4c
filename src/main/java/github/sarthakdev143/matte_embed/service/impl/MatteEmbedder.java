package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.model.EmbedTask;
import github.sarthakdev143.matte_embed.model.image.ImageHandle;
import github.sarthakdev143.matte_embed.model.image.ImageHeader;
import github.sarthakdev143.matte_embed.model.image.PixelBuffer;
import github.sarthakdev143.matte_embed.model.image.PixelType;
import github.sarthakdev143.matte_embed.service.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class MatteEmbedder {

    private static final Logger logger = LoggerFactory.getLogger(MatteEmbedder.class);
    static final String WRITER_ATTRIBUTE = "writer";
    static final String COMPRESSION_ATTRIBUTE = "compression";
    private static final String MATTE_SOURCE_CHANNEL = "R";

    private final ImageCodec imageCodec;
    private final ChannelNameResolver channelNameResolver;

    public MatteEmbedder(ImageCodec imageCodec, ChannelNameResolver channelNameResolver) {
        this.imageCodec = imageCodec;
        this.channelNameResolver = channelNameResolver;
    }

    public void embed(EmbedTask task) throws IOException, InterruptedException {
        List<ImageHandle> openHandles = new ArrayList<>();
        try {
            ImageHandle base;
            try {
                base = imageCodec.open(task.baseFile());
            } catch (IOException e) {
                throw new IOException("Error opening base file: " + e.getMessage(), e);
            }
            openHandles.add(base);

            ImageHeader baseHeader = imageCodec.header(base);
            Map<String, PixelBuffer> channels = new LinkedHashMap<>();
            for (String channelName : baseHeader.channelNames()) {
                if (!channelNameResolver.isMatteChannel(channelName, task.matteChannelBasename())) {
                    channels.put(channelName, imageCodec.readChannel(base, channelName, PixelType.HALF));
                }
            }

            for (String channelKey : task.matteFilenames().keySet()) {
                try {
                    ImageHandle matte = imageCodec.open(task.matteFile(channelKey));
                    openHandles.add(matte);
                    String sourceChannel = selectMatteSourceChannel(imageCodec.header(matte));
                    channels.put(
                            task.channelNames().get(channelKey),
                            imageCodec.readChannel(matte, sourceChannel, PixelType.HALF));
                } catch (IOException e) {
                    throw new IOException("Error processing matte channel " + channelKey + ": " + e.getMessage(), e);
                }
            }

            ImageHeader outputHeader = new ImageHeader(
                    baseHeader.dataWindow(),
                    new ArrayList<>(channels.keySet()),
                    outputAttributes(baseHeader, task));

            Path outputFile = task.outputFile();
            try {
                Files.createDirectories(outputFile.getParent());
                imageCodec.write(outputFile, outputHeader, channels);
            } catch (IOException e) {
                throw new IOException("Error writing output file: " + e.getMessage(), e);
            }
        } finally {
            closeAll(openHandles);
        }
    }

    private Map<String, String> outputAttributes(ImageHeader baseHeader, EmbedTask task) {
        Map<String, String> attributes = new LinkedHashMap<>(baseHeader.attributes());
        attributes.remove(WRITER_ATTRIBUTE);
        attributes.put(COMPRESSION_ATTRIBUTE, task.compression().toCodecValue());
        return attributes;
    }

    private String selectMatteSourceChannel(ImageHeader matteHeader) throws IOException {
        if (matteHeader.hasChannel(MATTE_SOURCE_CHANNEL)) {
            return MATTE_SOURCE_CHANNEL;
        }
        if (matteHeader.channelNames().size() == 1) {
            return matteHeader.channelNames().get(0);
        }
        throw new IOException("Matte image has no R channel and more than one channel: "
                + String.join(", ", matteHeader.channelNames()));
    }

    private void closeAll(List<ImageHandle> handles) {
        for (ImageHandle handle : handles) {
            try {
                imageCodec.close(handle);
            } catch (IOException e) {
                logger.warn("Failed to close image {}", handle.path(), e);
            }
        }
    }
}
