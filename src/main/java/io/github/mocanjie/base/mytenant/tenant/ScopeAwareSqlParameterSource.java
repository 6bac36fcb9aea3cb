package io.github.mocanjie.base.mytenant.tenant;

import io.github.mocanjie.base.mytenant.scope.ScopeContext;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

/**
 * 作用域感知的 SQL 参数源包装类
 *
 * <p>在原有 {@link SqlParameterSource} 基础上追加租户参数，使注入的 {@code :scopeTenantId} 占位符能被解析。
 * 取值发生在语句执行时刻，读取的是当时的 {@link ScopeContext#current()}，而不是包装时的值。
 * 同名的业务参数以本参数为准。
 */
public class ScopeAwareSqlParameterSource implements SqlParameterSource {

    private final SqlParameterSource delegate;
    private final String tenantParamName;

    public ScopeAwareSqlParameterSource(SqlParameterSource delegate, String tenantParamName) {
        this.delegate = delegate;
        this.tenantParamName = tenantParamName;
    }

    @Override
    public boolean hasValue(String paramName) {
        if (tenantParamName.equals(paramName)) {
            return ScopeContext.current().isPresent();
        }
        return delegate.hasValue(paramName);
    }

    @Override
    public Object getValue(String paramName) throws IllegalArgumentException {
        if (tenantParamName.equals(paramName)) {
            return ScopeContext.current()
                    .orElseThrow(() -> new IllegalArgumentException("无限制作用域下不存在参数: " + paramName));
        }
        return delegate.getValue(paramName);
    }

    @Override
    public int getSqlType(String paramName) {
        if (tenantParamName.equals(paramName)) {
            return TYPE_UNKNOWN;
        }
        return delegate.getSqlType(paramName);
    }

    @Override
    public String getTypeName(String paramName) {
        if (tenantParamName.equals(paramName)) {
            return null;
        }
        return delegate.getTypeName(paramName);
    }
}
