package io.github.mocanjie.base.mytenant.scope;

import io.github.mocanjie.base.mytenant.exception.ScopeMissingException;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * 租户作用域上下文（ThreadLocal）
 *
 * <p>保存当前工作单元可见的租户ID，不存在即表示"无限制"（超级管理员 / 全局访问）。
 * 作用域严格按栈嵌套：{@link #withScope(Long)} 返回的句柄关闭时恢复调用前的值，支持任意深度。
 *
 * <p>用法：
 * <pre>{@code
 * // 请求入口：整个请求处于租户 7 的作用域
 * try (ScopedHandle ignored = ScopeContext.withScope(7L)) {
 *     chain.doFilter(request, response);
 * }
 *
 * // 管理端：临时放开租户限制（逻辑删除条件依旧生效）
 * List<Organization> all = ScopeContext.withoutTenant(() -> store.list(Organization.class));
 *
 * // 提交到线程池：在提交时刻捕获快照
 * executor.submit(ScopeSnapshot.capture().wrap(() -> store.list(Employee.class)));
 * }</pre>
 *
 * <p>ThreadLocal 不会自动传递到其他线程。子任务必须通过 {@link ScopeSnapshot} / {@link ScopeAwareExecutor} /
 * {@link ScopeTaskDecorator} 在提交时携带快照，之后父任务或兄弟任务的变更对其不可见。
 */
public final class ScopeContext {

    private static final ThreadLocal<Frame> CURRENT = new ThreadLocal<>();

    private ScopeContext() {}

    /**
     * 当前租户ID，empty 表示无限制作用域
     */
    public static Optional<Long> current() {
        Frame frame = CURRENT.get();
        return frame == null ? Optional.empty() : frame.tenantId;
    }

    /**
     * 当前是否处于无限制作用域
     */
    public static boolean isUnrestricted() {
        return current().isEmpty();
    }

    /**
     * 进入租户作用域，必须配合 try-with-resources 使用
     *
     * @param tenantId 租户ID，传 null 进入无限制作用域
     * @return 关闭时恢复到调用前的作用域
     */
    public static ScopedHandle withScope(Long tenantId) {
        Frame frame = new Frame(Optional.ofNullable(tenantId), CURRENT.get());
        CURRENT.set(frame);
        return new ScopedHandle(frame);
    }

    public static void run(Long tenantId, Runnable runnable) {
        try (ScopedHandle ignored = withScope(tenantId)) {
            runnable.run();
        }
    }

    public static <T> T supply(Long tenantId, Supplier<T> supplier) {
        try (ScopedHandle ignored = withScope(tenantId)) {
            return supplier.get();
        }
    }

    public static <T> T call(Long tenantId, Callable<T> callable) throws Exception {
        try (ScopedHandle ignored = withScope(tenantId)) {
            return callable.call();
        }
    }

    /**
     * 在无限制作用域中执行代码（有返回值）
     */
    public static <T> T withoutTenant(Supplier<T> supplier) {
        return supply(null, supplier);
    }

    /**
     * 在无限制作用域中执行代码（无返回值）
     */
    public static void withoutTenant(Runnable runnable) {
        run(null, runnable);
    }

    /**
     * 获取当前租户ID，无限制作用域时抛出 {@link ScopeMissingException}。
     * 供要求必须携带租户的调用方使用，过滤条件本身不会调用。
     */
    public static Long requireTenant() {
        return current().orElseThrow(ScopeMissingException::new);
    }

    static Frame currentFrame() {
        return CURRENT.get();
    }

    static void restore(Frame frame) {
        if (frame == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(frame);
        }
    }

    /**
     * 当前线程的帧链上是否还有 frame（尚未被外层句柄释放）
     */
    static boolean isActive(Frame frame) {
        for (Frame f = CURRENT.get(); f != null; f = f.parent) {
            if (f == frame) return true;
        }
        return false;
    }

    /**
     * 不可变的作用域帧，parent 指向进入前的帧；用对象身份判断句柄是否按栈顺序关闭
     */
    static final class Frame {
        final Optional<Long> tenantId;
        final Frame parent;

        Frame(Optional<Long> tenantId, Frame parent) {
            this.tenantId = tenantId;
            this.parent = parent;
        }
    }
}
