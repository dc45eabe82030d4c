package github.sarthakdev143.matte_embed.model;

import java.nio.file.Path;
import java.util.List;

public record RunResult(
        RunStatus status,
        int processedFiles,
        int totalFiles,
        List<String> warnings,
        List<FileError> errorFiles,
        List<Path> replacedFolders,
        List<ReplacementError> replacementErrors) {

    public RunResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errorFiles = errorFiles == null ? List.of() : List.copyOf(errorFiles);
        replacedFolders = replacedFolders == null ? List.of() : List.copyOf(replacedFolders);
        replacementErrors = replacementErrors == null ? List.of() : List.copyOf(replacementErrors);
    }

    public boolean success() {
        return status == RunStatus.SUCCESS;
    }

    public boolean replaced() {
        return !replacedFolders.isEmpty();
    }

    public RunResult withReplacement(List<Path> replaced, List<ReplacementError> errors) {
        RunStatus resolvedStatus = errors == null || errors.isEmpty() ? status : RunStatus.COMPLETED_WITH_ISSUES;
        return new RunResult(resolvedStatus, processedFiles, totalFiles, warnings, errorFiles, replaced, errors);
    }
}
