package io.github.mocanjie.base.mytenant.domain.entity;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.annotation.MyTable;
import io.github.mocanjie.base.mytenant.annotation.TenantColumn;
import lombok.Data;

/**
 * 租户。租户判别字段即主键：租户作用域下只能看到自己。
 */
@Data
@MyTable("tenant")
public class Tenant implements MyTableEntity {
    @TenantColumn
    private Long id;
    private String name;
    private String description;
    private Integer deleteFlag;
}
