package io.github.mocanjie.base.mytenant.exception;

/**
 * mytenant 所有异常的基类（非受检）
 */
public class MyTenantException extends RuntimeException {

    public MyTenantException(String message) {
        super(message);
    }

    public MyTenantException(String message, Throwable cause) {
        super(message, cause);
    }
}
