package github.sarthakdev143.matte_embed.model;

public enum EmbedJobState {
    QUEUED,
    SCANNING,
    PROCESSING,
    COMPLETED,
    COMPLETED_WITH_ISSUES,
    CANCELLED,
    FAILED
}
