package github.sarthakdev143.matte_embed.factory;

import github.sarthakdev143.matte_embed.pool.ExecutorConfig;
import github.sarthakdev143.matte_embed.pool.WorkerPool;

public interface WorkerPoolFactory {

    WorkerPool create(ExecutorConfig config);
}
