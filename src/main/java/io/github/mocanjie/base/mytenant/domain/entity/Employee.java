package io.github.mocanjie.base.mytenant.domain.entity;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.annotation.MyTable;
import io.github.mocanjie.base.mytenant.annotation.ParentRef;
import lombok.Data;

/**
 * 员工，没有自己的租户字段，租户归属经由所属组织判定
 */
@Data
@MyTable("employee")
public class Employee implements MyTableEntity {
    private Long id;
    @ParentRef(value = Organization.class, tenantOwner = true)
    private Long organizationId;
    private String name;
    private String code;
    private Integer deleteFlag;
}
