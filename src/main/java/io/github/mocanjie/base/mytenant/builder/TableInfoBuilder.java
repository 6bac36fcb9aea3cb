package io.github.mocanjie.base.mytenant.builder;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.annotation.MyTable;
import io.github.mocanjie.base.mytenant.annotation.ParentRef;
import io.github.mocanjie.base.mytenant.annotation.TenantColumn;
import io.github.mocanjie.base.mytenant.exception.MyTenantException;
import io.github.mocanjie.base.mytenant.metadata.ParentRefInfo;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import io.github.mocanjie.base.mytenant.metadata.TenantMode;
import io.github.mocanjie.base.mytenant.utils.CommonUtils;
import io.github.mocanjie.base.mytenant.utils.MyReflectionUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 扫描 {@code @MyTable} 实体并缓存表元数据（主键、逻辑删除、租户判别方式、父引用）。
 * 启动阶段写入，之后只读。
 */
@Slf4j
public class TableInfoBuilder {

    private static final Map<Class<?>, TableInfo> tableInfoMap = new ConcurrentHashMap<>();

    private static final Map<String, TableInfo> tableNameMap = new ConcurrentHashMap<>();

    private TableInfoBuilder() {}

    /**
     * 扫描指定包下的所有 {@code @MyTable} 类
     */
    public static void init(String... basePackages) {
        log.info("初始化@MyTable信息，扫描包: {}", String.join(",", basePackages));
        for (String basePackage : basePackages) {
            if (StringUtils.isBlank(basePackage)) continue;
            Reflections reflections = new Reflections(new ConfigurationBuilder()
                    .forPackage(basePackage)
                    .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                    .setScanners(Scanners.TypesAnnotated));
            Set<Class<?>> classSet = reflections.getTypesAnnotatedWith(MyTable.class);
            log.info("包{}下共找到@MyTable注解的类{}个", basePackage, classSet.size());
            register(classSet.toArray(new Class<?>[0]));
        }
    }

    /**
     * 显式注册实体类（重复注册同一个类会覆盖为相同结果）
     */
    public static void register(Class<?>... classes) {
        for (Class<?> aClass : classes) {
            TableInfo tableInfo = build(aClass);
            tableInfoMap.put(aClass, tableInfo);
            tableNameMap.put(tableInfo.getTableName().toLowerCase(), tableInfo);
            log.info("缓存表信息: table={}, class={}, tenantMode={}, delColumn={}",
                    tableInfo.getTableName(), aClass.getName(), tableInfo.getTenantMode(), tableInfo.getDelColumnName());
        }
    }

    private static TableInfo build(Class<?> aClass) {
        MyTable annotation = aClass.getAnnotation(MyTable.class);
        if (annotation == null) {
            throw new MyTenantException(aClass + " 缺少@MyTable注解");
        }
        if (!MyTableEntity.class.isAssignableFrom(aClass)) {
            throw new MyTenantException(aClass + " 标注了@MyTable但未实现MyTableEntity");
        }
        List<Field> fieldList = MyReflectionUtils.getFieldList(aClass);
        Field pkField = fieldList.stream().filter(f -> f.getName().equals(annotation.pkField())).findFirst()
                .orElseThrow(() -> new MyTenantException(aClass + "没有找到对应的主键"));

        TableInfo tableInfo = new TableInfo()
                .setTableName(annotation.value())
                .setClazz(aClass)
                .setPkField(pkField)
                .setPkFieldName(annotation.pkField())
                .setPkColumnName(annotation.pkColumn())
                .setFieldList(fieldList)
                .setDelValue(annotation.delValue())
                .setUnDelValue(annotation.unDelValue());
        if (annotation.delValue() == annotation.unDelValue()) {
            throw new MyTenantException(aClass + " 的 delValue 与 unDelValue 不能相同");
        }

        boolean hasDelField = fieldList.stream().anyMatch(f -> f.getName().equals(annotation.delField()));
        if (StringUtils.isNotBlank(annotation.delColumn()) && hasDelField) {
            tableInfo.setDelColumnName(annotation.delColumn()).setDelFieldName(annotation.delField());
        } else {
            log.info("{} 未配置有效的逻辑删除字段，不注册逻辑删除条件", aClass.getSimpleName());
        }

        List<ParentRefInfo> parentRefs = new ArrayList<>();
        for (Field field : fieldList) {
            TenantColumn tenantColumn = field.getAnnotation(TenantColumn.class);
            if (tenantColumn != null) {
                if (tableInfo.getTenantFieldName() != null) {
                    throw new MyTenantException(aClass + " 存在多个@TenantColumn字段");
                }
                String column = StringUtils.isNotBlank(tenantColumn.value()) ? tenantColumn.value().trim()
                        : field.getName().equals(annotation.pkField()) ? annotation.pkColumn()
                        : CommonUtils.camelCaseToUnderscore(field.getName());
                tableInfo.setTenantFieldName(field.getName()).setTenantColumnName(column);
            }
            ParentRef parentRef = field.getAnnotation(ParentRef.class);
            if (parentRef != null) {
                String column = StringUtils.isNotBlank(parentRef.column()) ? parentRef.column().trim()
                        : tenantColumn != null ? tableInfo.getTenantColumnName()
                        : CommonUtils.camelCaseToUnderscore(field.getName());
                parentRefs.add(new ParentRefInfo()
                        .setFieldName(field.getName())
                        .setColumnName(column)
                        .setParentClass(parentRef.value())
                        .setTenantOwner(parentRef.tenantOwner()));
            }
        }
        tableInfo.setParentRefs(Collections.unmodifiableList(parentRefs));

        long owners = parentRefs.stream().filter(ParentRefInfo::isTenantOwner).count();
        if (owners > 1) {
            throw new MyTenantException(aClass + " 只能有一个@ParentRef(tenantOwner = true)");
        }
        if (tableInfo.getTenantFieldName() != null && owners > 0) {
            throw new MyTenantException(aClass + " 不能同时声明@TenantColumn与@ParentRef(tenantOwner = true)");
        }
        if (tableInfo.getTenantFieldName() != null) {
            tableInfo.setTenantMode(TenantMode.DIRECT);
        } else if (owners == 1) {
            tableInfo.setTenantMode(TenantMode.VIA_PARENT);
        }
        return tableInfo;
    }

    public static TableInfo getTableInfo(Class<?> aClass){
        TableInfo tableInfo = tableInfoMap.get(aClass);
        if(tableInfo==null) throw new MyTenantException(aClass+" 缺少@MyTable注解或未被扫描");
        return tableInfo;
    }

    /**
     * 按表名查找（忽略大小写），未注册返回 null
     */
    public static TableInfo getTableInfoByTableName(String tableName) {
        if (tableName == null) return null;
        return tableNameMap.get(tableName.toLowerCase());
    }

    public static Collection<TableInfo> getAllTableInfos() {
        return Collections.unmodifiableCollection(tableInfoMap.values());
    }

    public static void clear() {
        tableInfoMap.clear();
        tableNameMap.clear();
        log.info("@MyTable缓存已清空");
    }
}
