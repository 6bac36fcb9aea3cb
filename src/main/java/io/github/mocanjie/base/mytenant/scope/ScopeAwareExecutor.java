package io.github.mocanjie.base.mytenant.scope;

import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 包装任意 {@link ExecutorService}：每个任务在<b>提交时刻</b>捕获提交线程的作用域快照并在其中执行。
 * {@code submit}/{@code invokeAll} 均经由 {@link #execute(Runnable)}，在提交线程上同步捕获。
 */
public class ScopeAwareExecutor extends AbstractExecutorService {

    private final ExecutorService delegate;

    public ScopeAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(ScopeSnapshot.capture().wrap(command));
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }

    public ExecutorService getDelegate() {
        return delegate;
    }
}
