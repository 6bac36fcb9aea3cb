package io.github.mocanjie.base.mytenant.exception;

import lombok.Getter;

/**
 * 写入时引用的父记录在当前作用域下不可见（包括跨租户引用与父记录不存在/已删除）。
 * 故意不提供单独的"无权限"异常。
 */
@Getter
public class ParentNotVisibleException extends EntityNotFoundException {

    private final String referenceField;

    public ParentNotVisibleException(Class<?> parentType, Object parentId, String referenceField) {
        super(parentType, parentId, String.format("%s Not Found", referenceField));
        this.referenceField = referenceField;
    }
}
