package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.model.FileError;
import github.sarthakdev143.matte_embed.model.RunResult;
import github.sarthakdev143.matte_embed.model.RunStatus;
import github.sarthakdev143.matte_embed.model.TaskOutcome;

import java.util.ArrayList;
import java.util.List;

public class ResultAggregator {

    private final List<String> warnings;
    private final int totalFiles;
    private final List<FileError> errorFiles = new ArrayList<>();
    private int processedFiles;

    public ResultAggregator(List<String> warnings, int totalFiles) {
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.totalFiles = totalFiles;
    }

    public void accept(TaskOutcome outcome) {
        processedFiles++;
        if (outcome.isFailed()) {
            errorFiles.add(new FileError(outcome.baseFilename(), outcome.error()));
        }
    }

    public int processedFiles() {
        return processedFiles;
    }

    public int errorCount() {
        return errorFiles.size();
    }

    public boolean replacementAllowed(boolean cancelled) {
        return !cancelled && errorFiles.isEmpty() && warnings.isEmpty();
    }

    public RunResult complete(boolean cancelled) {
        RunStatus status;
        if (cancelled) {
            status = RunStatus.CANCELLED;
        } else if (!errorFiles.isEmpty() || !warnings.isEmpty()) {
            status = RunStatus.COMPLETED_WITH_ISSUES;
        } else {
            status = RunStatus.SUCCESS;
        }
        return new RunResult(status, processedFiles, totalFiles, warnings, errorFiles, List.of(), List.of());
    }

    public static String describeIssues(RunResult result) {
        StringBuilder message = new StringBuilder();
        if (!result.warnings().isEmpty()) {
            message.append("The following warnings were encountered during scanning:\n\n");
            for (String warning : result.warnings()) {
                message.append("WARNING: ").append(warning).append('\n');
            }
            message.append('\n');
        }
        if (!result.errorFiles().isEmpty()) {
            message.append("The following files encountered errors during processing:\n\n");
            for (FileError errorFile : result.errorFiles()) {
                message.append(errorFile.filename()).append(": ").append(errorFile.error()).append('\n');
            }
            message.append('\n');
        }
        if (!result.replacementErrors().isEmpty()) {
            message.append("The following errors occurred during the replacement process:\n\n");
            result.replacementErrors().forEach(error -> message
                    .append(error.baseFolder())
                    .append(" [")
                    .append(error.stage())
                    .append("]: ")
                    .append(error.message())
                    .append('\n'));
        }
        return message.toString().strip();
    }
}
