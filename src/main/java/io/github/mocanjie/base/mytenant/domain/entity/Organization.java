package io.github.mocanjie.base.mytenant.domain.entity;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.annotation.MyTable;
import io.github.mocanjie.base.mytenant.annotation.ParentRef;
import io.github.mocanjie.base.mytenant.annotation.TenantColumn;
import lombok.Data;

@Data
@MyTable("organization")
public class Organization implements MyTableEntity {
    private Long id;
    @TenantColumn
    @ParentRef(Tenant.class)
    private Long tenantId;
    private String name;
    private Integer deleteFlag;
}
