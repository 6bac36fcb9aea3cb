package io.github.mocanjie.base.mytenant.validation;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.dao.EntityStore;
import io.github.mocanjie.base.mytenant.exception.ParentNotVisibleException;
import io.github.mocanjie.base.mytenant.metadata.ParentRefInfo;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import lombok.extern.slf4j.Slf4j;

/**
 * 写入前的跨实体引用校验
 *
 * <p>父记录的存在性检查走带过滤条件的查询：跨租户的父记录与不存在、已删除的父记录表现完全一致，
 * 都抛出 {@link ParentNotVisibleException}。校验在任何修改之前执行，失败不会留下部分写入。
 */
@Slf4j
public class ReferenceValidator {

    private final EntityStore entityStore;

    public ReferenceValidator(EntityStore entityStore) {
        this.entityStore = entityStore;
    }

    /**
     * 父记录在当前作用域下是否可见
     */
    public boolean validateParentExists(Class<? extends MyTableEntity> parentType, Object parentId) {
        if (parentId == null) {
            return false;
        }
        return entityStore.existsById(parentType, parentId);
    }

    /**
     * 校验实体上所有 {@code @ParentRef} 引用
     *
     * @throws ParentNotVisibleException 任一父记录不可见
     */
    public void validateReferences(Object entity) {
        TableInfo tableInfo = TableInfoBuilder.getTableInfo(entity.getClass());
        for (ParentRefInfo ref : tableInfo.getParentRefs()) {
            Object parentId = tableInfo.getFieldValue(entity, ref.getFieldName());
            if (!validateParentExists(ref.getParentClass(), parentId)) {
                log.debug("{}.{}={} 引用的{}不可见", entity.getClass().getSimpleName(), ref.getFieldName(),
                        parentId, ref.getParentClass().getSimpleName());
                throw new ParentNotVisibleException(ref.getParentClass(), parentId, ref.getFieldName());
            }
        }
    }
}
