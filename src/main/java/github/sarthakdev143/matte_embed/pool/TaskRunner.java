package github.sarthakdev143.matte_embed.pool;

import github.sarthakdev143.matte_embed.model.EmbedTask;

@FunctionalInterface
public interface TaskRunner {

    void run(EmbedTask task) throws Exception;
}
