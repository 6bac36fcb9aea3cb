package io.github.mocanjie.base.mytenant.metadata;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import lombok.Data;
import lombok.experimental.Accessors;

@Data
@Accessors(chain = true)
public class ParentRefInfo {
    private String fieldName;
    private String columnName;
    private Class<? extends MyTableEntity> parentClass;
    private boolean tenantOwner;
}
