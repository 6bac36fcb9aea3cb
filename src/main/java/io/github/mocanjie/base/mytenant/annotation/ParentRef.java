package io.github.mocanjie.base.mytenant.annotation;

import io.github.mocanjie.base.mytenant.MyTableEntity;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * 标记指向父实体主键的外键字段。
 *
 * <p>写入（新增/修改）前会在当前租户作用域下校验父记录是否可见，不可见即视为不存在。
 * {@link #tenantOwner()} 为 true 时，本实体没有自己的租户字段，租户归属经由该父实体判定（仅支持一跳）。
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface ParentRef {
	Class<? extends MyTableEntity> value();
	String column() default "";
	boolean tenantOwner() default false;
}
