package io.github.mocanjie.base.mytenant.configuration;

import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.dao.impl.AbstractEntityStore;
import io.github.mocanjie.base.mytenant.dao.impl.JdbcEntityStore;
import io.github.mocanjie.base.mytenant.domain.entity.Employee;
import io.github.mocanjie.base.mytenant.domain.entity.Organization;
import io.github.mocanjie.base.mytenant.domain.entity.Tenant;
import io.github.mocanjie.base.mytenant.domain.service.DirectoryService;
import io.github.mocanjie.base.mytenant.domain.service.impl.DirectoryServiceImpl;
import io.github.mocanjie.base.mytenant.filter.FilterRegistrar;
import io.github.mocanjie.base.mytenant.filter.FilterRegistry;
import io.github.mocanjie.base.mytenant.filter.TenantPredicateFactory;
import io.github.mocanjie.base.mytenant.scope.ScopeTaskDecorator;
import io.github.mocanjie.base.mytenant.utils.LogLevelUtils;
import io.github.mocanjie.base.mytenant.validation.ReferenceValidator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackages;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@AutoConfiguration(after = MyTenantJdbcTemplateAutoConfiguration.class)
@ConditionalOnClass(NamedParameterJdbcTemplate.class)
public class MyTenantAutoConfiguration {

    @Value("${mytenant.showsql:true}")
    public boolean showSql;

    @Value("${mytenant.entity-packages:}")
    public String[] entityPackages;

    @Value("${mytenant.tenant-param-name:" + TenantPredicateFactory.DEFAULT_TENANT_PARAM + "}")
    public String tenantParamName;

    @Bean
    @ConditionalOnMissingBean
    public AbstractEntityStore entityStore(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new JdbcEntityStore(namedParameterJdbcTemplate, tenantParamName);
    }

    /**
     * 扫描实体并冻结过滤条件注册表，完成后回填到存储
     */
    @Bean
    public FilterRegistry filterRegistry(AbstractEntityStore entityStore, BeanFactory beanFactory) {
        TableInfoBuilder.init(resolveEntityPackages(beanFactory));
        TableInfoBuilder.register(Tenant.class, Organization.class, Employee.class);
        TenantPredicateFactory factory = new TenantPredicateFactory(entityStore, tenantParamName);
        FilterRegistry registry = new FilterRegistrar(factory).buildRegistry(TableInfoBuilder.getAllTableInfos());
        entityStore.setFilterRegistry(registry);
        return registry;
    }

    /**
     * 以下 Bean 依赖 filterRegistry 参数，保证在注册表回填到存储之后才创建
     */
    @Bean
    public ReferenceValidator referenceValidator(AbstractEntityStore entityStore, FilterRegistry filterRegistry) {
        return entityStore.getReferenceValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public DirectoryService directoryService(AbstractEntityStore entityStore, FilterRegistry filterRegistry) {
        return new DirectoryServiceImpl(entityStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScopeTaskDecorator scopeTaskDecorator() {
        return new ScopeTaskDecorator();
    }

    private String[] resolveEntityPackages(BeanFactory beanFactory) {
        List<String> packages = new ArrayList<>();
        if (entityPackages != null) {
            Arrays.stream(entityPackages).map(String::trim).filter(p -> !p.isEmpty()).forEach(packages::add);
        }
        if (packages.isEmpty() && AutoConfigurationPackages.has(beanFactory)) {
            packages.addAll(AutoConfigurationPackages.get(beanFactory));
        }
        if (packages.isEmpty()) {
            log.warn("未配置 mytenant.entity-packages 且无法确定应用包路径，仅注册内置实体");
        }
        return packages.toArray(new String[0]);
    }

    @PostConstruct
    void logInit(){
        // 反射方式兼容不同的日志实现
        Object loggerFactory = LoggerFactory.getILoggerFactory();
        if (!LogLevelUtils.setLevel(loggerFactory, "org.reflections", "ERROR")) {
            log.warn("当前日志实现不是 Logback，mytenant.showsql 不生效");
            return;
        }
        if(showSql){
            LogLevelUtils.setLevel(loggerFactory, "io.github.mocanjie.base.mytenant.parser", "DEBUG");
            LogLevelUtils.setLevel(loggerFactory, "org.springframework.jdbc.core.JdbcTemplate", "DEBUG");
            LogLevelUtils.setLevel(loggerFactory, "org.springframework.jdbc.core.StatementCreatorUtils", "TRACE");
        }
    }
}
