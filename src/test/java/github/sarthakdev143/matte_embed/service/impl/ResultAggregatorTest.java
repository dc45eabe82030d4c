package github.sarthakdev143.matte_embed.service.impl;

import github.sarthakdev143.matte_embed.model.FileError;
import github.sarthakdev143.matte_embed.model.ReplacementError;
import github.sarthakdev143.matte_embed.model.RunResult;
import github.sarthakdev143.matte_embed.model.RunStatus;
import github.sarthakdev143.matte_embed.model.TaskOutcome;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    private static final Path SEQ = Path.of("shots", "Seq");

    @Test
    void cleanRunSucceedsAndAllowsReplacement() {
        ResultAggregator aggregator = new ResultAggregator(List.of(), 2);
        aggregator.accept(new TaskOutcome(SEQ, "Seq.1001.exr", null));
        aggregator.accept(new TaskOutcome(SEQ, "Seq.1002.exr", null));

        RunResult result = aggregator.complete(false);

        assertThat(result.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(result.success()).isTrue();
        assertThat(result.processedFiles()).isEqualTo(2);
        assertThat(result.totalFiles()).isEqualTo(2);
        assertThat(aggregator.replacementAllowed(false)).isTrue();
    }

    @Test
    void failedTaskIsRecordedWithoutAffectingOthers() {
        ResultAggregator aggregator = new ResultAggregator(List.of(), 3);
        aggregator.accept(new TaskOutcome(SEQ, "Seq.1001.exr", null));
        aggregator.accept(new TaskOutcome(SEQ, "Seq.1002.exr", "Error opening base file: bad"));
        aggregator.accept(new TaskOutcome(SEQ, "Seq.1003.exr", null));

        RunResult result = aggregator.complete(false);

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED_WITH_ISSUES);
        assertThat(result.processedFiles()).isEqualTo(3);
        assertThat(result.errorFiles()).containsExactly(new FileError("Seq.1002.exr", "Error opening base file: bad"));
        assertThat(aggregator.errorCount()).isEqualTo(1);
        assertThat(aggregator.replacementAllowed(false)).isFalse();
    }

    @Test
    void scanWarningsBlockReplacement() {
        ResultAggregator aggregator = new ResultAggregator(List.of("Base folder not found for matte folder: x"), 0);

        assertThat(aggregator.complete(false).status()).isEqualTo(RunStatus.COMPLETED_WITH_ISSUES);
        assertThat(aggregator.replacementAllowed(false)).isFalse();
    }

    @Test
    void cancellationWinsOverOtherStatuses() {
        ResultAggregator aggregator = new ResultAggregator(List.of(), 4);
        aggregator.accept(new TaskOutcome(SEQ, "Seq.1001.exr", "boom"));

        RunResult result = aggregator.complete(true);

        assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(result.processedFiles()).isEqualTo(1);
        assertThat(aggregator.replacementAllowed(true)).isFalse();
    }

    @Test
    void replacementErrorsDowngradeStatus() {
        RunResult result = new ResultAggregator(List.of(), 0).complete(false)
                .withReplacement(List.of(), List.of(new ReplacementError(SEQ, "quarantine", "denied")));

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED_WITH_ISSUES);
        assertThat(result.replaced()).isFalse();
    }

    @Test
    void describeIssuesListsEverySection() {
        RunResult result = new RunResult(
                RunStatus.COMPLETED_WITH_ISSUES,
                2,
                2,
                List.of("Frame mismatch for Seq_matteB"),
                List.of(new FileError("Seq.1001.exr", "Error writing output file: disk full")),
                List.of(),
                List.of(new ReplacementError(SEQ, "rename", "busy")));

        String description = ResultAggregator.describeIssues(result);

        assertThat(description)
                .startsWith("The following warnings were encountered during scanning:")
                .contains("WARNING: Frame mismatch for Seq_matteB")
                .contains("Seq.1001.exr: Error writing output file: disk full")
                .contains("replacement process")
                .contains("[rename]: busy");
    }
}
