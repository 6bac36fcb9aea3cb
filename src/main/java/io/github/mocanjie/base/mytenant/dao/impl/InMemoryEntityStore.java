package io.github.mocanjie.base.mytenant.dao.impl;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.exception.EntityNotFoundException;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import org.apache.commons.beanutils.ConvertUtils;
import org.springframework.beans.BeanUtils;
import org.springframework.dao.DuplicateKeyException;

import java.io.Serializable;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 内存实现，直接用 {@link io.github.mocanjie.base.mytenant.filter.FilterRegistry#effectivePredicate(Class)} 求值。
 *
 * <p>保存与返回的都是副本，调用方修改返回对象不会影响存储内容。列表按主键升序。
 */
public class InMemoryEntityStore extends AbstractEntityStore {

	private final Map<Class<?>, ConcurrentNavigableMap<Object, Object>> tables = new ConcurrentHashMap<>();

	private final AtomicLong sequence = new AtomicLong();

	@Override
	public <PO extends MyTableEntity> List<PO> list(Class<PO> clazz) {
		Predicate<PO> predicate = getFilterRegistry().effectivePredicate(clazz);
		return table(clazz).values().stream()
				.map(clazz::cast)
				.filter(predicate)
				.map(this::copy)
				.collect(Collectors.toList());
	}

	@Override
	public <PO extends MyTableEntity> Optional<PO> findById(Class<PO> clazz, Object id) {
		if (id == null) return Optional.empty();
		Object stored = table(clazz).get(key(TableInfoBuilder.getTableInfo(clazz), id));
		if (stored == null) return Optional.empty();
		PO po = clazz.cast(stored);
		if (!getFilterRegistry().effectivePredicate(clazz).test(po)) return Optional.empty();
		return Optional.of(copy(po));
	}

	@Override
	public <P> P resolve(Class<P> parentType, Object parentId) {
		if (parentId == null) return null;
		Object stored = table(parentType).get(key(TableInfoBuilder.getTableInfo(parentType), parentId));
		return stored == null ? null : parentType.cast(stored);
	}

	@Override
	protected Serializable doInsert(TableInfo tableInfo, Object po) {
		Object id = tableInfo.getPkValue(po);
		if (id == null) {
			tableInfo.setPkValue(po, sequence.incrementAndGet());
		} else if (id instanceof Number) {
			long value = ((Number) id).longValue();
			sequence.accumulateAndGet(value, Math::max);
		}
		Object key = key(tableInfo, tableInfo.getPkValue(po));
		if (table(tableInfo.getClazz()).putIfAbsent(key, copy(po)) != null) {
			throw new DuplicateKeyException(String.format("%s 主键重复: %s", tableInfo.getTableName(), key));
		}
		return (Serializable) key;
	}

	/**
	 * 在库中当前值上合并，而不是在先前读到的副本上合并：并发的逻辑删除不会被覆盖回未删除。
	 * 合并时重新判断可见性，期间已不可见的行视为不存在。
	 */
	@Override
	protected int doUpdate(TableInfo tableInfo, Object po, Object existing) {
		Predicate<Object> visible = visiblePredicate(tableInfo);
		List<String> ignore = new ArrayList<>();
		ignore.add(tableInfo.getPkFieldName());
		if (tableInfo.getTenantFieldName() != null) ignore.add(tableInfo.getTenantFieldName());
		if (tableInfo.hasDeleteColumn()) ignore.add(tableInfo.getDelFieldName());
		for (Field field : tableInfo.getFieldList()) {
			if (tableInfo.getFieldValue(po, field.getName()) == null) ignore.add(field.getName());
		}
		String[] ignoreProperties = ignore.toArray(new String[0]);
		// 重新计算时可能多次调用，只看最后一次的结果
		boolean[] updated = new boolean[1];
		Object id = tableInfo.getPkValue(existing);
		table(tableInfo.getClazz()).computeIfPresent(key(tableInfo, id), (k, current) -> {
			updated[0] = visible.test(current);
			if (!updated[0]) return current;
			Object target = copy(current);
			BeanUtils.copyProperties(po, target, ignoreProperties);
			return target;
		});
		if (!updated[0]) {
			throw new EntityNotFoundException(tableInfo.getClazz(), id);
		}
		return 1;
	}

	@Override
	protected boolean doSoftDelete(TableInfo tableInfo, Object existing) {
		Predicate<Object> visible = visiblePredicate(tableInfo);
		boolean[] deleted = new boolean[1];
		table(tableInfo.getClazz()).computeIfPresent(key(tableInfo, tableInfo.getPkValue(existing)), (k, current) -> {
			deleted[0] = visible.test(current);
			if (!deleted[0]) return current;
			Object target = copy(current);
			tableInfo.setFieldValue(target, tableInfo.getDelFieldName(), tableInfo.getDelValue());
			return target;
		});
		return deleted[0];
	}

	@SuppressWarnings("unchecked")
	private Predicate<Object> visiblePredicate(TableInfo tableInfo) {
		return (Predicate<Object>) (Predicate<?>) getFilterRegistry().effectivePredicate(tableInfo.getClazz());
	}

	private ConcurrentNavigableMap<Object, Object> table(Class<?> clazz) {
		return tables.computeIfAbsent(clazz, k -> new ConcurrentSkipListMap<>(InMemoryEntityStore::compareKeys));
	}

	/**
	 * 主键统一转换为实体主键字段的类型
	 */
	private static Object key(TableInfo tableInfo, Object id) {
		return ConvertUtils.convert(id, tableInfo.getPkField().getType());
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static int compareKeys(Object a, Object b) {
		return ((Comparable) a).compareTo(b);
	}

	@SuppressWarnings("unchecked")
	private <T> T copy(T source) {
		T target = (T) BeanUtils.instantiateClass(source.getClass());
		BeanUtils.copyProperties(source, target);
		return target;
	}
}
