package io.github.mocanjie.base.mytenant.filter;

import java.util.function.Predicate;

/**
 * 行可见性过滤条件。
 *
 * <p>实现必须是纯函数：只依赖实体本身和<b>求值时刻</b>的环境状态（例如 {@code ScopeContext.current()}），
 * 不得在构造/注册时捕获作用域值。同一个实例会在启动时注册一次，之后被所有请求并发调用。
 *
 * @param <T> 实体类型
 */
public interface RowFilter<T> extends Predicate<T> {

    /**
     * 条件名称，同一实体类型下唯一
     */
    String name();

    /**
     * 内存求值：实体在当前作用域下是否可见
     */
    @Override
    boolean test(T entity);

    /**
     * 转换为 SQL 条件片段，由持久层在查询发出时调用。
     *
     * @param tableRef 表别名（无别名时为表名）
     * @return 条件表达式；当前作用域下不需要限制时返回 null
     */
    String toSql(String tableRef);
}
