package github.sarthakdev143.matte_embed.model;

public enum RunStatus {
    SUCCESS,
    COMPLETED_WITH_ISSUES,
    CANCELLED
}
