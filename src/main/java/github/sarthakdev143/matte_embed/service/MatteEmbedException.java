package github.sarthakdev143.matte_embed.service;

public class MatteEmbedException extends RuntimeException {

    public MatteEmbedException(String message, Throwable cause) {
        super(message, cause);
    }
}
