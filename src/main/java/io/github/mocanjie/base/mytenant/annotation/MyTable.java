package io.github.mocanjie.base.mytenant.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * 实体与表的映射；同时声明逻辑删除字段，启动时据此自动注册逻辑删除过滤条件。
 * 删除字段为空字符串表示该表不参与逻辑删除。
 */
@Documented
@Retention(RUNTIME)
@Target(TYPE)
public @interface MyTable {
	/** 表名 */
	String value();
	String pkColumn() default "id";
	String pkField() default "id";
	/** 为空时不参与逻辑删除 */
	String delColumn() default "delete_flag";
	String delField() default "deleteFlag";
	/** 已删除 */
	int delValue() default 1;
	/** 未删除，新增时删除字段为空则填入此值 */
	int unDelValue() default 0;
}
