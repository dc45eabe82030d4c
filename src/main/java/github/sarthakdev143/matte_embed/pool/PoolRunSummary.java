package github.sarthakdev143.matte_embed.pool;

import java.time.Duration;

public record PoolRunSummary(int processed, int total, boolean cancelled, Duration elapsed) {
}
