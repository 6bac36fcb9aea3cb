package io.github.mocanjie.base.mytenant.filter;

import io.github.mocanjie.base.mytenant.exception.RegistrationConflictException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 按实体类型登记行可见性过滤条件，并将同一类型的所有条件以 AND 组合为一个有效条件。
 *
 * <p>多个关注点（逻辑删除、租户隔离……）各自注册，互不覆盖；组合满足交换律/结合律，注册顺序不影响结果。
 * 没有任何条件的实体类型不受限制。
 *
 * <p>生命周期：启动阶段注册，随后调用 {@link #freeze()} 预先组合好每个类型的有效条件并转为只读，
 * 之后可被任意线程无锁读取。组合结果仍是"闭包"，每次求值都会读取当时的作用域。
 */
@Slf4j
public class FilterRegistry {

    private final Map<Class<?>, List<RowFilter<?>>> filters = new LinkedHashMap<>();

    private volatile Map<Class<?>, Predicate<?>> compiled;

    /**
     * 为实体类型追加一个过滤条件
     *
     * @throws RegistrationConflictException 同一类型下条件名重复，或注册表已冻结
     */
    public synchronized <T> void register(Class<T> entityType, RowFilter<? super T> filter) {
        if (compiled != null) {
            throw new RegistrationConflictException(String.format("过滤条件注册表已冻结，无法再为%s注册[%s]",
                    entityType.getSimpleName(), filter.name()));
        }
        List<RowFilter<?>> list = filters.computeIfAbsent(entityType, k -> new ArrayList<>());
        for (RowFilter<?> existing : list) {
            if (existing.name().equals(filter.name())) {
                throw new RegistrationConflictException(String.format("%s 重复注册过滤条件[%s]",
                        entityType.getSimpleName(), filter.name()));
            }
        }
        list.add(filter);
        log.debug("注册过滤条件: {} -> {}", entityType.getSimpleName(), filter);
    }

    /**
     * 实体类型的有效条件（所有已注册条件的 AND）。冻结前每次调用即时组合。
     */
    @SuppressWarnings("unchecked")
    public <T> Predicate<T> effectivePredicate(Class<T> entityType) {
        Map<Class<?>, Predicate<?>> snapshot = compiled;
        if (snapshot != null) {
            Predicate<?> predicate = snapshot.get(entityType);
            return predicate == null ? e -> true : (Predicate<T>) predicate;
        }
        synchronized (this) {
            return compose(filters.getOrDefault(entityType, Collections.emptyList()));
        }
    }

    /**
     * 实体类型已注册的条件（按注册顺序），供持久层转换为本地查询语言
     */
    public List<RowFilter<?>> filtersFor(Class<?> entityType) {
        if (compiled != null) {
            return filters.getOrDefault(entityType, Collections.emptyList());
        }
        synchronized (this) {
            return List.copyOf(filters.getOrDefault(entityType, Collections.emptyList()));
        }
    }

    public synchronized Set<Class<?>> getEntityTypes() {
        return Collections.unmodifiableSet(filters.keySet());
    }

    /**
     * 预先组合所有类型的有效条件，之后注册表只读
     */
    public synchronized void freeze() {
        if (compiled != null) return;
        Map<Class<?>, Predicate<?>> result = new HashMap<>();
        for (Map.Entry<Class<?>, List<RowFilter<?>>> entry : filters.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
            result.put(entry.getKey(), compose(entry.getValue()));
        }
        compiled = Collections.unmodifiableMap(result);
        log.info("过滤条件注册表已冻结，共{}个实体类型", result.size());
    }

    public boolean isFrozen() {
        return compiled != null;
    }

    @SuppressWarnings("unchecked")
    private static <T> Predicate<T> compose(List<RowFilter<?>> list) {
        if (list.isEmpty()) {
            return e -> true;
        }
        Predicate<? super T>[] parts = list.toArray(new Predicate[0]);
        return entity -> {
            for (Predicate<? super T> part : parts) {
                if (!part.test(entity)) return false;
            }
            return true;
        };
    }
}
