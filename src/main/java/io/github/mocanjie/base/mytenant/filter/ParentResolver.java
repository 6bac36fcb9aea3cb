package io.github.mocanjie.base.mytenant.filter;

/**
 * 按主键读取父实体，<b>不</b>应用任何过滤条件。
 * 供经由父实体判定租户的过滤条件在内存求值时使用。
 */
public interface ParentResolver {

    /**
     * @return 父实体，不存在返回 null
     */
    <P> P resolve(Class<P> parentType, Object parentId);
}
