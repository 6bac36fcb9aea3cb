package io.github.mocanjie.base.mytenant.filter;

import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import io.github.mocanjie.base.mytenant.metadata.TenantMode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;

/**
 * 模型初始化：根据表元数据为每个实体注册逻辑删除条件与租户条件，然后冻结注册表。
 * 两类条件相互独立，实体可以只有其中一种。
 */
@Slf4j
public class FilterRegistrar {

    private final TenantPredicateFactory tenantPredicateFactory;

    public FilterRegistrar(TenantPredicateFactory tenantPredicateFactory) {
        this.tenantPredicateFactory = tenantPredicateFactory;
    }

    public FilterRegistry buildRegistry(Collection<TableInfo> tableInfos) {
        FilterRegistry registry = new FilterRegistry();
        registerAll(registry, tableInfos);
        registry.freeze();
        return registry;
    }

    public void registerAll(FilterRegistry registry, Collection<TableInfo> tableInfos) {
        for (TableInfo tableInfo : tableInfos) {
            register(registry, tableInfo.getClazz(), tableInfo);
        }
    }

    private <T> void register(FilterRegistry registry, Class<T> entityType, TableInfo tableInfo) {
        if (tableInfo.hasDeleteColumn()) {
            registry.register(entityType, new SoftDeleteFilter<>(tableInfo));
        }
        if (tableInfo.getTenantMode() != TenantMode.NONE) {
            registry.register(entityType, tenantPredicateFactory.forEntity(entityType));
        }
        log.info("{} 过滤条件: softDelete={}, tenant={}", entityType.getSimpleName(),
                tableInfo.hasDeleteColumn(), tableInfo.getTenantMode());
    }
}
