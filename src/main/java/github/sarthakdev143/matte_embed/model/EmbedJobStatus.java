package github.sarthakdev143.matte_embed.model;

import java.time.Instant;
import java.util.List;

public record EmbedJobStatus(
        String jobId,
        EmbedJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String rootFolder,
        int processedFiles,
        int totalFiles,
        double percent,
        String detailLine,
        String timingLine,
        List<String> warnings,
        List<FileError> errorFiles,
        List<String> replacedFolders) {

    public EmbedJobStatus {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errorFiles = errorFiles == null ? List.of() : List.copyOf(errorFiles);
        replacedFolders = replacedFolders == null ? List.of() : List.copyOf(replacedFolders);
    }

    public boolean isTerminal() {
        return state == EmbedJobState.COMPLETED
                || state == EmbedJobState.COMPLETED_WITH_ISSUES
                || state == EmbedJobState.CANCELLED
                || state == EmbedJobState.FAILED;
    }
}
