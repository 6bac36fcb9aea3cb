package io.github.mocanjie.base.mytenant.dao;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.filter.FilterRegistry;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * 实体存储。所有读写都受实体类型有效过滤条件（逻辑删除 + 当前租户作用域）约束。
 */
public interface EntityStore {

	<PO extends MyTableEntity> List<PO> list(Class<PO> clazz);

	<PO extends MyTableEntity> Optional<PO> findById(Class<PO> clazz, Object id);

	<PO extends MyTableEntity> boolean existsById(Class<PO> clazz, Object id);

	/**
	 * 新增。租户列为空时取当前作用域，删除标记为空时置为未删除，
	 * 所有 {@code @ParentRef} 引用须在当前作用域下可见。
	 * @return 主键
	 * @throws io.github.mocanjie.base.mytenant.exception.ParentNotVisibleException 引用的父记录不可见
	 */
	<PO extends MyTableEntity> Serializable insert(PO po);

	/**
	 * 修改（忽略 null 字段）。租户列不可修改。
	 * @throws io.github.mocanjie.base.mytenant.exception.EntityNotFoundException 记录在当前作用域下不可见
	 */
	<PO extends MyTableEntity> int update(PO po);

	/**
	 * 逻辑删除
	 * @return 记录不可见时返回 false，不做任何修改
	 */
	<PO extends MyTableEntity> boolean softDelete(Class<PO> clazz, Object id);

	FilterRegistry getFilterRegistry();
}
