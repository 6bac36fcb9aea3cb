package io.github.mocanjie.base.mytenant.exception;

/**
 * 过滤条件注册冲突（同一实体重复注册同名条件，或注册表冻结后继续注册）。
 * 属于编程错误，只会在启动阶段出现，不应捕获重试。
 */
public class RegistrationConflictException extends MyTenantException {

    public RegistrationConflictException(String message) {
        super(message);
    }
}
