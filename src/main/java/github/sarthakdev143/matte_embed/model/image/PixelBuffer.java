package github.sarthakdev143.matte_embed.model.image;

public record PixelBuffer(ImageHandle source, String channelName, PixelType pixelType) {
}
