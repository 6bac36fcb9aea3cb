package io.github.mocanjie.base.mytenant.filter;

import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.exception.MyTenantException;
import io.github.mocanjie.base.mytenant.metadata.ParentRefInfo;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import io.github.mocanjie.base.mytenant.metadata.TenantMode;
import io.github.mocanjie.base.mytenant.scope.ScopeContext;

import java.util.Optional;

/**
 * 生成"行在租户 T 下可见"的过滤条件，T 为<b>求值时刻</b>的 {@link ScopeContext#current()}。
 *
 * <p>根据实体元数据自动选择判别方式，调用方无需关心：
 * <ul>
 *   <li>{@link TenantMode#DIRECT}：比较实体自身的 {@code @TenantColumn}</li>
 *   <li>{@link TenantMode#VIA_PARENT}：经由 {@code @ParentRef(tenantOwner = true)} 指向的父实体比较（一跳），
 *   父记录已逻辑删除时子记录同样不可见</li>
 * </ul>
 * 无限制作用域下所有租户条件恒为真。
 */
public class TenantPredicateFactory {

    public static final String NAME = "tenant";

    public static final String DEFAULT_TENANT_PARAM = "scopeTenantId";

    private final ParentResolver parentResolver;

    private final String tenantParamName;

    public TenantPredicateFactory(ParentResolver parentResolver) {
        this(parentResolver, DEFAULT_TENANT_PARAM);
    }

    public TenantPredicateFactory(ParentResolver parentResolver, String tenantParamName) {
        this.parentResolver = parentResolver;
        this.tenantParamName = tenantParamName;
    }

    public String getTenantParamName() {
        return tenantParamName;
    }

    public <T> RowFilter<T> forEntity(Class<T> entityType) {
        TableInfo tableInfo = TableInfoBuilder.getTableInfo(entityType);
        switch (tableInfo.getTenantMode()) {
            case DIRECT:
                return new DirectTenantFilter<>(tableInfo);
            case VIA_PARENT:
                ParentRefInfo ref = tableInfo.getTenantParent();
                TableInfo parentInfo = TableInfoBuilder.getTableInfo(ref.getParentClass());
                if (parentInfo.getTenantMode() != TenantMode.DIRECT) {
                    throw new MyTenantException(String.format("%s 经由 %s 判定租户，但 %s 自身没有@TenantColumn（仅支持一跳）",
                            entityType.getSimpleName(), ref.getParentClass().getSimpleName(), ref.getParentClass().getSimpleName()));
                }
                return new ParentTenantFilter<>(tableInfo, ref, parentInfo);
            default:
                throw new IllegalArgumentException(entityType.getName() + " 不参与租户隔离");
        }
    }

    static boolean sameTenant(Object value, Long tenantId) {
        if (value == null) return false;
        if (value instanceof Number) return ((Number) value).longValue() == tenantId;
        return String.valueOf(value).equals(String.valueOf(tenantId));
    }

    private final class DirectTenantFilter<T> implements RowFilter<T> {

        private final TableInfo tableInfo;

        DirectTenantFilter(TableInfo tableInfo) {
            this.tableInfo = tableInfo;
        }

        @Override
        public String name() {
            return NAME;
        }

        @Override
        public boolean test(T entity) {
            Optional<Long> scope = ScopeContext.current();
            return scope.isEmpty() || sameTenant(tableInfo.getTenantValue(entity), scope.get());
        }

        @Override
        public String toSql(String tableRef) {
            if (ScopeContext.isUnrestricted()) return null;
            return String.format("%s.%s = :%s", tableRef, tableInfo.getTenantColumnName(), tenantParamName);
        }

        @Override
        public String toString() {
            return "TenantFilter{" + tableInfo.getTableName() + "." + tableInfo.getTenantColumnName() + "}";
        }
    }

    private final class ParentTenantFilter<T> implements RowFilter<T> {

        private final TableInfo tableInfo;
        private final ParentRefInfo ref;
        private final TableInfo parentInfo;

        ParentTenantFilter(TableInfo tableInfo, ParentRefInfo ref, TableInfo parentInfo) {
            this.tableInfo = tableInfo;
            this.ref = ref;
            this.parentInfo = parentInfo;
        }

        @Override
        public String name() {
            return NAME;
        }

        @Override
        public boolean test(T entity) {
            Optional<Long> scope = ScopeContext.current();
            if (scope.isEmpty()) return true;
            Object parentId = tableInfo.getFieldValue(entity, ref.getFieldName());
            if (parentId == null) return false;
            Object parent = parentResolver.resolve(ref.getParentClass(), parentId);
            return parent != null && !parentInfo.isDeleted(parent)
                    && sameTenant(parentInfo.getTenantValue(parent), scope.get());
        }

        @Override
        public String toSql(String tableRef) {
            if (ScopeContext.isUnrestricted()) return null;
            String parentRef = tableRef + "_scope_p";
            String parentDeleted = parentInfo.hasDeleteColumn()
                    ? String.format(" AND %s.%s = %d", parentRef, parentInfo.getDelColumnName(), parentInfo.getUnDelValue())
                    : "";
            return String.format("EXISTS (SELECT 1 FROM %s %s WHERE %s.%s = %s.%s AND %s.%s = :%s%s)",
                    parentInfo.getTableName(), parentRef,
                    parentRef, parentInfo.getPkColumnName(), tableRef, ref.getColumnName(),
                    parentRef, parentInfo.getTenantColumnName(), tenantParamName, parentDeleted);
        }

        @Override
        public String toString() {
            return "TenantFilter{" + tableInfo.getTableName() + " -> " + parentInfo.getTableName() + "}";
        }
    }
}
