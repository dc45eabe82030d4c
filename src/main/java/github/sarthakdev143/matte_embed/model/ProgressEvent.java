package github.sarthakdev143.matte_embed.model;

public record ProgressEvent(
        int processed,
        int total,
        double percent,
        String statusLine,
        String detailLine) {
}
