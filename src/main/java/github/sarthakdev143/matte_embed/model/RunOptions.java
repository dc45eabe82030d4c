package github.sarthakdev143.matte_embed.model;

public record RunOptions(
        Compression compression,
        String matteChannelBasename,
        int workerCount,
        boolean replaceOriginals) {

    public RunOptions {
        compression = compression == null ? Compression.PIZ : compression;
        matteChannelBasename = matteChannelBasename == null || matteChannelBasename.isBlank()
                ? "matte"
                : matteChannelBasename.trim();
        if (workerCount < 1) {
            throw new IllegalArgumentException("Number of workers must be at least 1.");
        }
    }
}
