package github.sarthakdev143.matte_embed.model;

import java.nio.file.Path;

public record TaskOutcome(Path baseFolder, String baseFilename, String error) {

    public static TaskOutcome succeeded(EmbedTask task) {
        return new TaskOutcome(task.baseFolder(), task.baseFilename(), null);
    }

    public static TaskOutcome failed(EmbedTask task, String error) {
        return new TaskOutcome(task.baseFolder(), task.baseFilename(), error == null ? "Unknown error" : error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
