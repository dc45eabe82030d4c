package github.sarthakdev143.matte_embed.controller;

import github.sarthakdev143.matte_embed.dto.EmbedJobSubmissionResponse;
import github.sarthakdev143.matte_embed.dto.ScanReportResponse;
import github.sarthakdev143.matte_embed.model.Compression;
import github.sarthakdev143.matte_embed.model.EmbedJobState;
import github.sarthakdev143.matte_embed.model.RunOptions;
import github.sarthakdev143.matte_embed.service.MatteEmbedService;
import github.sarthakdev143.matte_embed.service.impl.ChannelNameResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

@RestController
@RequestMapping("/api/sequences")
public class SequenceController {

    private static final Logger logger = LoggerFactory.getLogger(SequenceController.class);

    private final MatteEmbedService matteEmbedService;
    private final ChannelNameResolver channelNameResolver;

    public SequenceController(MatteEmbedService matteEmbedService, ChannelNameResolver channelNameResolver) {
        this.matteEmbedService = matteEmbedService;
        this.channelNameResolver = channelNameResolver;
    }

    @PostMapping("/scan")
    public ResponseEntity<?> scan(@RequestParam("root") String rootInput) {
        try {
            Path root = requireDirectory(rootInput);
            return ResponseEntity.ok(ScanReportResponse.from(matteEmbedService.scan(root)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Sequence scan failed for {}", rootInput, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to scan folder. Please try again.");
        }
    }

    @PostMapping("/embed")
    public ResponseEntity<?> embed(
            @RequestParam("root") String rootInput,
            @RequestParam(value = "compression", required = false) String compressionInput,
            @RequestParam(value = "matteChannel", required = false) String matteChannelInput,
            @RequestParam(value = "workers", required = false) Integer workersInput,
            @RequestParam(value = "replaceOriginals", required = false, defaultValue = "false") boolean replaceOriginals) {

        try {
            Path root = requireDirectory(rootInput);
            RunOptions options = validateAndBuildOptions(
                    compressionInput,
                    matteChannelInput,
                    workersInput,
                    replaceOriginals);

            String jobId = matteEmbedService.submitJob(root, options);
            return ResponseEntity.accepted()
                    .body(new EmbedJobSubmissionResponse(
                            jobId,
                            EmbedJobState.QUEUED,
                            "Embed job accepted. Poll /api/sequences/jobs/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Embed job submission failed for {}", rootInput, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start embed job. Please try again.");
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return matteEmbedService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        if (!matteEmbedService.cancelJob(jobId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No running job for id: " + jobId);
        }
        return ResponseEntity.accepted().body("Cancellation requested for job " + jobId + ".");
    }

    private RunOptions validateAndBuildOptions(
            String compressionInput,
            String matteChannelInput,
            Integer workersInput,
            boolean replaceOriginals) {
        RunOptions defaults = matteEmbedService.defaultOptions();

        Compression compression = compressionInput == null || compressionInput.isBlank()
                ? defaults.compression()
                : Compression.fromInput(compressionInput);

        String matteChannel = matteChannelInput == null || matteChannelInput.isBlank()
                ? defaults.matteChannelBasename()
                : matteChannelInput.trim();
        channelNameResolver.validateBasename(matteChannel);

        int workers = workersInput == null ? defaults.workerCount() : workersInput;
        int maxWorkers = Runtime.getRuntime().availableProcessors();
        if (workers < 1) {
            throw new IllegalArgumentException("Number of workers must be at least 1.");
        }
        if (workers > maxWorkers) {
            throw new IllegalArgumentException("Number of workers cannot exceed " + maxWorkers + ".");
        }

        return new RunOptions(compression, matteChannel, workers, replaceOriginals);
    }

    private Path requireDirectory(String rootInput) {
        if (rootInput == null || rootInput.isBlank()) {
            throw new IllegalArgumentException("root is required.");
        }

        Path root;
        try {
            root = Path.of(rootInput.trim());
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("root is not a valid path.", e);
        }
        if (!Files.exists(root)) {
            throw new IllegalArgumentException("Folder does not exist: " + rootInput);
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Path is not a directory: " + rootInput);
        }
        return root;
    }
}
