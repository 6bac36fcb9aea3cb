package io.github.mocanjie.base.mytenant.test.entity;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.annotation.MyTable;
import io.github.mocanjie.base.mytenant.annotation.TenantColumn;
import lombok.Data;

@Data
@MyTable("document")
public class TestDocument implements MyTableEntity {
    private Long id;
    @TenantColumn("owner_tenant")
    private Long tenantId;
    private String title;
    private Integer deleteFlag;
}
