package io.github.mocanjie.base.mytenant.scope;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 某一时刻的租户作用域快照（不可变）。
 *
 * <p>派生子任务或构建 {@code CompletableFuture} 回调链时捕获，子任务执行时在快照值的作用域中运行，
 * 结束后恢复执行线程原有的作用域，线程池中的工作线程不会残留租户值。
 *
 * <pre>{@code
 * ScopeSnapshot snapshot = ScopeSnapshot.capture();
 * CompletableFuture.supplyAsync(snapshot.wrap(() -> store.list(Employee.class)), pool)
 *         .thenApplyAsync(snapshot.wrap(list -> enrich(list)), pool);
 * }</pre>
 */
public final class ScopeSnapshot {

    private final Long tenantId;

    private ScopeSnapshot(Long tenantId) {
        this.tenantId = tenantId;
    }

    /**
     * 捕获当前线程的作用域
     */
    public static ScopeSnapshot capture() {
        return new ScopeSnapshot(ScopeContext.current().orElse(null));
    }

    public static ScopeSnapshot of(Long tenantId) {
        return new ScopeSnapshot(tenantId);
    }

    public Optional<Long> tenantId() {
        return Optional.ofNullable(tenantId);
    }

    public Runnable wrap(Runnable task) {
        return () -> ScopeContext.run(tenantId, task);
    }

    /**
     * 与 {@link #wrap(Supplier)} 区分命名，避免无参 lambda 同时匹配两者
     */
    public <T> Callable<T> wrapCallable(Callable<T> task) {
        return () -> ScopeContext.call(tenantId, task);
    }

    public <T> Supplier<T> wrap(Supplier<T> task) {
        return () -> ScopeContext.supply(tenantId, task);
    }

    public <T, R> Function<T, R> wrap(Function<T, R> task) {
        return input -> ScopeContext.supply(tenantId, () -> task.apply(input));
    }

    @Override
    public String toString() {
        return "ScopeSnapshot{tenantId=" + tenantId + "}";
    }
}
