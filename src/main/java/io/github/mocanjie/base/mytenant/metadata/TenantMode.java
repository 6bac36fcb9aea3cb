package io.github.mocanjie.base.mytenant.metadata;

/**
 * 实体的租户判别方式
 */
public enum TenantMode {
    /** 不参与租户隔离 */
    NONE,
    /** 实体自身带有 {@code @TenantColumn} 字段 */
    DIRECT,
    /** 经由 {@code @ParentRef(tenantOwner = true)} 指向的父实体判定（一跳） */
    VIA_PARENT
}
