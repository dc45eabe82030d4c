package github.sarthakdev143.matte_embed.service;

import github.sarthakdev143.matte_embed.model.image.ImageHandle;
import github.sarthakdev143.matte_embed.model.image.ImageHeader;
import github.sarthakdev143.matte_embed.model.image.PixelBuffer;
import github.sarthakdev143.matte_embed.model.image.PixelType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public interface ImageCodec {

    ImageHandle open(Path path) throws IOException, InterruptedException;

    ImageHeader header(ImageHandle handle);

    PixelBuffer readChannel(ImageHandle handle, String channelName, PixelType pixelType) throws IOException;

    void close(ImageHandle handle) throws IOException;

    void write(Path path, ImageHeader header, Map<String, PixelBuffer> channels) throws IOException, InterruptedException;
}
