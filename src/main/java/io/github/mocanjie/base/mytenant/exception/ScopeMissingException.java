package io.github.mocanjie.base.mytenant.exception;

/**
 * 调用方要求必须处于某个租户作用域内，但当前为无限制作用域。
 * 仅由 {@code ScopeContext.requireTenant()} 抛出，核心读写流程不会主动拒绝无作用域的调用。
 */
public class ScopeMissingException extends MyTenantException {

    public ScopeMissingException() {
        super("X-Tenant-Id Not found");
    }
}
