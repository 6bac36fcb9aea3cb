package io.github.mocanjie.base.mytenant.scope;

import org.springframework.core.task.TaskDecorator;

/**
 * Spring {@link TaskDecorator}：配置到 {@code ThreadPoolTaskExecutor} 后，{@code @Async} 等异步任务携带提交时刻的作用域。
 *
 * <pre>{@code
 * executor.setTaskDecorator(new ScopeTaskDecorator());
 * }</pre>
 */
public class ScopeTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        return ScopeSnapshot.capture().wrap(runnable);
    }
}
