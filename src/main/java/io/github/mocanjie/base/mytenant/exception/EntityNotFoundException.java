package io.github.mocanjie.base.mytenant.exception;

import lombok.Getter;

/**
 * 记录不存在。
 *
 * <p>在当前租户作用域下不可见的记录与真正不存在的记录抛出同一异常，调用方无法据此区分二者。
 */
@Getter
public class EntityNotFoundException extends MyTenantException {

    private final Class<?> entityType;
    private final Object id;

    public EntityNotFoundException(Class<?> entityType, Object id) {
        this(entityType, id, String.format("%s %s Not Found", entityType.getSimpleName(), id));
    }

    protected EntityNotFoundException(Class<?> entityType, Object id, String message) {
        super(message);
        this.entityType = entityType;
        this.id = id;
    }
}
