package github.sarthakdev143.matte_embed.model;

import java.time.Duration;
import java.util.Locale;

public record TimingEvent(Duration elapsed, Duration averagePerFile, Duration estimatedRemaining) {

    public String describe() {
        return String.format(
                Locale.ROOT,
                "Elapsed: %.2fs, Avg: %.2fs/file, Est. remaining: %.2fs",
                seconds(elapsed),
                seconds(averagePerFile),
                seconds(estimatedRemaining));
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
