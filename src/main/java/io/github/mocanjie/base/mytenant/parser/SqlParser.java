package io.github.mocanjie.base.mytenant.parser;

import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import org.apache.commons.lang3.StringUtils;

import java.lang.reflect.Field;
import java.util.LinkedList;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 根据表元数据生成单表语句。查询语句不带任何过滤条件，由 {@link JSqlFilterParser} 统一注入。
 */
public class SqlParser {

    public static final String INSERT_SQL = "INSERT INTO %s(%s) VALUES (%s)";
    public static final String UPDATE_SQL = "UPDATE %s SET %s WHERE %s=:%s";
    public static final String SELECT_SQL = "SELECT * FROM %s";
    public static final String SELECT_BY_SQL = "SELECT * FROM %s WHERE %s=:%s";
    public static final String DEL_BYID_LOGIC_SQL = "UPDATE %s SET %s = %s WHERE %s=:%s";

    private SqlParser() {}

    /**
     * INSERT 语句，忽略值为 null 或空白字符串的字段（主键为空时交给数据库生成）
     */
    public static String getInsertSql(TableInfo tableInfo, Object obj) {
        LinkedList<String> valueList = new LinkedList<>();
        String columns = tableInfo.getFieldList().stream()
                .filter(f -> hasValue(tableInfo, obj, f))
                .map(f -> {
                    String fName = f.getName().trim();
                    valueList.add(fName);
                    return tableInfo.getColumnName(fName);
                }).collect(Collectors.joining(","));
        String values = valueList.stream().map(n -> ":" + n).collect(Collectors.joining(","));
        return String.format(INSERT_SQL, tableInfo.getTableName(), columns, values);
    }

    /**
     * UPDATE 语句。主键、租户列和删除标记列不会出现在 SET 中：租户归属不可修改，删除只能走逻辑删除。
     *
     * @param ignoreNull 为 true 时跳过值为 null 的字段
     */
    public static String getUpdateSql(TableInfo tableInfo, Object obj, boolean ignoreNull) {
        String columns = tableInfo.getFieldList().stream()
                .filter(f -> {
                    String fieldName = f.getName();
                    if (fieldName.equals(tableInfo.getPkFieldName())) return false;
                    if (Objects.equals(fieldName, tableInfo.getTenantFieldName())) return false;
                    if (Objects.equals(fieldName, tableInfo.getDelFieldName())) return false;
                    return !ignoreNull || hasValue(tableInfo, obj, f);
                })
                .map(f -> String.format("%s=:%s", tableInfo.getColumnName(f.getName()), f.getName()))
                .collect(Collectors.joining(","));
        if (columns.isEmpty()) {
            return null;
        }
        return String.format(UPDATE_SQL, tableInfo.getTableName(), columns, tableInfo.getPkColumnName(), tableInfo.getPkFieldName());
    }

    public static String getSelectSql(TableInfo tableInfo) {
        return String.format(SELECT_SQL, tableInfo.getTableName());
    }

    public static String getSelectByIdSql(TableInfo tableInfo) {
        return String.format(SELECT_BY_SQL, tableInfo.getTableName(), tableInfo.getPkColumnName(), tableInfo.getPkFieldName());
    }

    /**
     * 逻辑删除：UPDATE table SET delete_flag = 1 WHERE id=:id
     */
    public static String getSoftDeleteSql(TableInfo tableInfo) {
        return String.format(DEL_BYID_LOGIC_SQL, tableInfo.getTableName(), tableInfo.getDelColumnName(),
                tableInfo.getDelValue(), tableInfo.getPkColumnName(), tableInfo.getPkFieldName());
    }

    private static boolean hasValue(TableInfo tableInfo, Object obj, Field f) {
        Object value = tableInfo.getFieldValue(obj, f.getName());
        if (value == null) return false;
        if (value instanceof String) return StringUtils.isNotBlank((String) value);
        return true;
    }
}
