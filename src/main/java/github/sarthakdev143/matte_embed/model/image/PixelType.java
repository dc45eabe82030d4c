package github.sarthakdev143.matte_embed.model.image;

public enum PixelType {
    HALF,
    FLOAT
}
