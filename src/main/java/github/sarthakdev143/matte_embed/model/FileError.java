package github.sarthakdev143.matte_embed.model;

public record FileError(String filename, String error) {
}
