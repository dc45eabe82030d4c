package github.sarthakdev143.matte_embed.model;

import java.nio.file.Path;
import java.util.List;

public record ReplacementOutcome(List<Path> replacedFolders, List<ReplacementError> errors) {

    public ReplacementOutcome {
        replacedFolders = replacedFolders == null ? List.of() : List.copyOf(replacedFolders);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
