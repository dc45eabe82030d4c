package github.sarthakdev143.matte_embed.factory.impl;

import github.sarthakdev143.matte_embed.factory.WorkerPoolFactory;
import github.sarthakdev143.matte_embed.pool.ExecutorConfig;
import github.sarthakdev143.matte_embed.pool.WorkerPool;
import org.springframework.stereotype.Component;

@Component
public class DefaultWorkerPoolFactory implements WorkerPoolFactory {

    @Override
    public WorkerPool create(ExecutorConfig config) {
        return new WorkerPool(config);
    }
}
