package io.github.mocanjie.base.mytenant.metadata;

import io.github.mocanjie.base.mytenant.exception.MyTenantException;
import io.github.mocanjie.base.mytenant.utils.CommonUtils;
import lombok.Data;
import lombok.experimental.Accessors;
import org.apache.commons.beanutils.ConvertUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.BeanUtils;

import java.beans.PropertyDescriptor;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Data
@Accessors(chain = true)
public class TableInfo {
    private String tableName;
    private Field pkField;
    private String pkFieldName;
    private String pkColumnName;
    private String delColumnName;
    private String delFieldName;
    private int delValue;
    private int unDelValue;
    private Class<?> clazz;
    private List<Field> fieldList;

    private TenantMode tenantMode = TenantMode.NONE;
    private String tenantFieldName;
    private String tenantColumnName;
    private List<ParentRefInfo> parentRefs = new ArrayList<>();

    public Field getFieldByName(String fieldName){
        Optional<Field> field = this.fieldList.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
        if(field.isPresent()) return field.get();
        throw new MyTenantException(String.format("%s 没有找到%s变量", clazz.getName(), fieldName));
    }

    public boolean hasDeleteColumn() {
        return StringUtils.isNotBlank(delColumnName) && StringUtils.isNotBlank(delFieldName);
    }

    /**
     * 参与租户判别的父引用（仅 {@link TenantMode#VIA_PARENT} 时存在）
     */
    public ParentRefInfo getTenantParent() {
        return parentRefs.stream().filter(ParentRefInfo::isTenantOwner).findFirst().orElse(null);
    }

    public boolean isDeleted(Object obj) {
        if (!hasDeleteColumn()) return false;
        Object flag = getFieldValue(obj, delFieldName);
        if (flag == null) return true;
        return ((Number) ConvertUtils.convert(flag, Integer.class)).intValue() != getUnDelValue();
    }

    public Object getTenantValue(Object obj) {
        return tenantFieldName == null ? null : getFieldValue(obj, tenantFieldName);
    }

    public Object getPkValue(Object obj){
        return getFieldValue(obj, pkFieldName);
    }

    public void setPkValue(Object obj, Object id){
        setFieldValue(obj, pkFieldName, id);
    }

    public Object getFieldValue(Object obj, String fieldName) {
        PropertyDescriptor propertyDescriptor = BeanUtils.getPropertyDescriptor(obj.getClass(), fieldName);
        if (propertyDescriptor == null || propertyDescriptor.getReadMethod() == null) {
            throw new MyTenantException(String.format("%s 缺少%s的getter", obj.getClass().getName(), fieldName));
        }
        try {
            return propertyDescriptor.getReadMethod().invoke(obj);
        } catch (ReflectiveOperationException e) {
            throw new MyTenantException(String.format("读取%s.%s失败", obj.getClass().getSimpleName(), fieldName), e);
        }
    }

    /**
     * 写入字段值，按字段类型做必要的转换（例如数据库返回的 BigInteger 主键）
     */
    public void setFieldValue(Object obj, String fieldName, Object value) {
        PropertyDescriptor propertyDescriptor = BeanUtils.getPropertyDescriptor(obj.getClass(), fieldName);
        if (propertyDescriptor == null || propertyDescriptor.getWriteMethod() == null) {
            throw new MyTenantException(String.format("%s 缺少%s的setter", obj.getClass().getName(), fieldName));
        }
        try {
            Object converted = value == null ? null : ConvertUtils.convert(value, propertyDescriptor.getPropertyType());
            propertyDescriptor.getWriteMethod().invoke(obj, converted);
        } catch (ReflectiveOperationException e) {
            throw new MyTenantException(String.format("写入%s.%s失败", obj.getClass().getSimpleName(), fieldName), e);
        }
    }

    /**
     * 字段对应的列名
     */
    public String getColumnName(String fieldName) {
        if (Objects.equals(fieldName, pkFieldName)) return pkColumnName;
        if (Objects.equals(fieldName, delFieldName)) return delColumnName;
        if (Objects.equals(fieldName, tenantFieldName)) return tenantColumnName;
        for (ParentRefInfo ref : parentRefs) {
            if (ref.getFieldName().equals(fieldName)) return ref.getColumnName();
        }
        return CommonUtils.camelCaseToUnderscore(fieldName);
    }
}
