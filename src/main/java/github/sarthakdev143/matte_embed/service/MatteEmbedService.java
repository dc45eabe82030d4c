package github.sarthakdev143.matte_embed.service;

import github.sarthakdev143.matte_embed.model.EmbedJobStatus;
import github.sarthakdev143.matte_embed.model.RunOptions;
import github.sarthakdev143.matte_embed.model.RunResult;
import github.sarthakdev143.matte_embed.model.ScanReport;
import github.sarthakdev143.matte_embed.pool.CancellationToken;
import github.sarthakdev143.matte_embed.pool.ProgressListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface MatteEmbedService {

    ScanReport scan(Path root) throws IOException;

    RunResult run(
            ScanReport report,
            RunOptions options,
            ProgressListener progressListener,
            CancellationToken cancellationToken);

    RunOptions defaultOptions();

    String submitJob(Path root, RunOptions options);

    Optional<EmbedJobStatus> getJobStatus(String jobId);

    boolean cancelJob(String jobId);
}
