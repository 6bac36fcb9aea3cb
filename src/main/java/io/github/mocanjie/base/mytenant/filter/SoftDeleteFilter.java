package io.github.mocanjie.base.mytenant.filter;

import io.github.mocanjie.base.mytenant.metadata.TableInfo;

/**
 * 逻辑删除过滤：已删除的行在任何作用域下（包括无限制作用域）都不可见
 */
public class SoftDeleteFilter<T> implements RowFilter<T> {

    public static final String NAME = "softDelete";

    private final TableInfo tableInfo;

    public SoftDeleteFilter(TableInfo tableInfo) {
        if (!tableInfo.hasDeleteColumn()) {
            throw new IllegalArgumentException(tableInfo.getTableName() + " 未配置逻辑删除字段");
        }
        this.tableInfo = tableInfo;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean test(T entity) {
        return !tableInfo.isDeleted(entity);
    }

    @Override
    public String toSql(String tableRef) {
        return String.format("%s.%s = %d", tableRef, tableInfo.getDelColumnName(), tableInfo.getUnDelValue());
    }

    @Override
    public String toString() {
        return "SoftDeleteFilter{" + tableInfo.getTableName() + "}";
    }
}
