package io.github.mocanjie.base.mytenant.annotation;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * 标记实体上直接保存租户ID的字段（租户判别字段）。
 *
 * <p>每个实体最多一个。该字段一经写入不可修改：UPDATE 语句不会包含它。
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface TenantColumn {
	String value() default "";//对应数据库列名称，默认驼峰转下划线
}
