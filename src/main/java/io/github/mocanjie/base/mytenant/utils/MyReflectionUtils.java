package io.github.mocanjie.base.mytenant.utils;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

public class MyReflectionUtils {

    /**
     * 收集实例字段（含父类，子类同名字段覆盖父类），跳过 static 与 transient
     */
    public static List<Field> getFieldList(Class<?> aClass){
        Map<String, Field> fieldMap = new LinkedHashMap<>();
        for (Class<?> c = aClass; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers)) continue;
                fieldMap.putIfAbsent(field.getName(), field);
            }
        }
        return new LinkedList<>(fieldMap.values());
    }
}
