package github.sarthakdev143.matte_embed.dto;

import github.sarthakdev143.matte_embed.model.EmbedJobState;

public record EmbedJobSubmissionResponse(
        String jobId,
        EmbedJobState state,
        String message) {
}
