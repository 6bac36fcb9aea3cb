package io.github.mocanjie.base.mytenant.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ScopeContext#withScope(Long)} 返回的句柄，关闭时恢复进入前的作用域。
 *
 * <p>重复关闭无副作用。只能在打开它的线程上关闭，其他线程上的关闭会被忽略并记录告警。
 * 乱序关闭外层句柄时一并释放其内层帧；之后再关闭已被释放的内层句柄不改变当前作用域。
 */
public final class ScopedHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScopedHandle.class);

    private final ScopeContext.Frame frame;
    private final Thread owner;
    private boolean closed;

    ScopedHandle(ScopeContext.Frame frame) {
        this.frame = frame;
        this.owner = Thread.currentThread();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (Thread.currentThread() != owner) {
            log.warn("ScopedHandle 在非创建线程[{}]上关闭，已忽略（创建线程: {}）",
                    Thread.currentThread().getName(), owner.getName());
            return;
        }
        closed = true;
        if (!ScopeContext.isActive(frame)) {
            log.warn("作用域 {} 已随外层句柄释放，忽略本次关闭", frame.tenantId);
            return;
        }
        if (ScopeContext.currentFrame() != frame) {
            log.warn("作用域未按嵌套顺序释放，连同内层作用域一起恢复到进入 {} 之前的值", frame.tenantId);
        }
        ScopeContext.restore(frame.parent);
    }

    public boolean isClosed() {
        return closed;
    }
}
