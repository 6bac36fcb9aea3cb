package io.github.mocanjie.base.mytenant.dao.impl;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.dao.EntityStore;
import io.github.mocanjie.base.mytenant.exception.EntityNotFoundException;
import io.github.mocanjie.base.mytenant.exception.MyTenantException;
import io.github.mocanjie.base.mytenant.filter.FilterRegistry;
import io.github.mocanjie.base.mytenant.filter.ParentResolver;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import io.github.mocanjie.base.mytenant.metadata.TenantMode;
import io.github.mocanjie.base.mytenant.scope.ScopeContext;
import io.github.mocanjie.base.mytenant.validation.ReferenceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Optional;

/**
 * 写入模板：补全默认值 -> 校验引用 -> 执行修改。子类负责带过滤条件的读取与实际的存储操作。
 *
 * <p>同时作为 {@link ParentResolver}，供经由父实体判定租户的过滤条件按主键读取父记录（不带过滤条件）。
 * 过滤条件依赖本存储、存储又依赖过滤条件注册表，因此注册表通过 {@link #setFilterRegistry(FilterRegistry)} 后置注入。
 */
public abstract class AbstractEntityStore implements EntityStore, ParentResolver {

	protected static Logger log = LoggerFactory.getLogger(AbstractEntityStore.class);

	private volatile FilterRegistry filterRegistry;

	protected final ReferenceValidator referenceValidator = new ReferenceValidator(this);

	public void setFilterRegistry(FilterRegistry filterRegistry) {
		this.filterRegistry = filterRegistry;
	}

	@Override
	public FilterRegistry getFilterRegistry() {
		FilterRegistry registry = this.filterRegistry;
		if (registry == null) {
			throw new IllegalStateException(getClass().getSimpleName() + " 尚未设置过滤条件注册表");
		}
		return registry;
	}

	public ReferenceValidator getReferenceValidator() {
		return referenceValidator;
	}

	@Override
	public <PO extends MyTableEntity> boolean existsById(Class<PO> clazz, Object id) {
		return id != null && findById(clazz, id).isPresent();
	}

	@Override
	public <PO extends MyTableEntity> Serializable insert(PO po) {
		TableInfo tableInfo = TableInfoBuilder.getTableInfo(po.getClass());
		if (tableInfo.hasDeleteColumn() && tableInfo.getFieldValue(po, tableInfo.getDelFieldName()) == null) {
			tableInfo.setFieldValue(po, tableInfo.getDelFieldName(), tableInfo.getUnDelValue());
		}
		fillTenant(tableInfo, po);
		referenceValidator.validateReferences(po);
		return doInsert(tableInfo, po);
	}

	@Override
	@SuppressWarnings("unchecked")
	public <PO extends MyTableEntity> int update(PO po) {
		TableInfo tableInfo = TableInfoBuilder.getTableInfo(po.getClass());
		Object id = tableInfo.getPkValue(po);
		Class<PO> clazz = (Class<PO>) po.getClass();
		PO existing = findById(clazz, id).orElseThrow(() -> new EntityNotFoundException(clazz, id));
		// 租户归属与删除标记沿用库中的值
		if (tableInfo.getTenantFieldName() != null) {
			tableInfo.setFieldValue(po, tableInfo.getTenantFieldName(), tableInfo.getTenantValue(existing));
		}
		if (tableInfo.hasDeleteColumn()) {
			tableInfo.setFieldValue(po, tableInfo.getDelFieldName(), tableInfo.getFieldValue(existing, tableInfo.getDelFieldName()));
		}
		referenceValidator.validateReferences(po);
		return doUpdate(tableInfo, po, existing);
	}

	@Override
	public <PO extends MyTableEntity> boolean softDelete(Class<PO> clazz, Object id) {
		TableInfo tableInfo = TableInfoBuilder.getTableInfo(clazz);
		if (!tableInfo.hasDeleteColumn()) {
			throw new MyTenantException(clazz.getSimpleName() + " 未配置逻辑删除字段");
		}
		Optional<PO> existing = findById(clazz, id);
		if (existing.isEmpty()) {
			log.debug("{} {} 在当前作用域下不可见，忽略删除", clazz.getSimpleName(), id);
			return false;
		}
		return doSoftDelete(tableInfo, existing.get());
	}

	/**
	 * 租户列为空时取当前作用域。租户列即主键时（租户表本身）不填充。
	 */
	private void fillTenant(TableInfo tableInfo, Object po) {
		if (tableInfo.getTenantMode() != TenantMode.DIRECT) return;
		if (tableInfo.getTenantFieldName().equals(tableInfo.getPkFieldName())) return;
		if (tableInfo.getTenantValue(po) != null) return;
		ScopeContext.current().ifPresent(tenantId -> tableInfo.setFieldValue(po, tableInfo.getTenantFieldName(), tenantId));
	}

	protected abstract Serializable doInsert(TableInfo tableInfo, Object po);

	protected abstract int doUpdate(TableInfo tableInfo, Object po, Object existing);

	protected abstract boolean doSoftDelete(TableInfo tableInfo, Object existing);
}
