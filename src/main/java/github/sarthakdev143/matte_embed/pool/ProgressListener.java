package github.sarthakdev143.matte_embed.pool;

import github.sarthakdev143.matte_embed.model.ProgressEvent;
import github.sarthakdev143.matte_embed.model.TimingEvent;

public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    default void onProgress(ProgressEvent event) {
    }

    default void onTiming(TimingEvent event) {
    }
}
