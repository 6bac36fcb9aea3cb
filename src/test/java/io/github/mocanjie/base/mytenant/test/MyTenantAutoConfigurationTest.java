package io.github.mocanjie.base.mytenant.test;

import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.configuration.MyTenantAutoConfiguration;
import io.github.mocanjie.base.mytenant.configuration.MyTenantJdbcTemplateAutoConfiguration;
import io.github.mocanjie.base.mytenant.dao.impl.AbstractEntityStore;
import io.github.mocanjie.base.mytenant.dao.impl.InMemoryEntityStore;
import io.github.mocanjie.base.mytenant.dao.impl.JdbcEntityStore;
import io.github.mocanjie.base.mytenant.domain.entity.Employee;
import io.github.mocanjie.base.mytenant.domain.entity.Organization;
import io.github.mocanjie.base.mytenant.domain.entity.Tenant;
import io.github.mocanjie.base.mytenant.domain.service.DirectoryService;
import io.github.mocanjie.base.mytenant.exception.ParentNotVisibleException;
import io.github.mocanjie.base.mytenant.filter.FilterRegistry;
import io.github.mocanjie.base.mytenant.scope.ScopeContext;
import io.github.mocanjie.base.mytenant.scope.ScopeTaskDecorator;
import io.github.mocanjie.base.mytenant.test.entity.TestDocument;
import io.github.mocanjie.base.mytenant.utils.LogLevelUtils;
import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.*;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 自动配置测试：内嵌 H2 + 建表脚本，验证 Bean 装配与端到端隔离
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@DisplayName("自动配置测试")
class MyTenantAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    SqlInitializationAutoConfiguration.class,
                    MyTenantJdbcTemplateAutoConfiguration.class,
                    MyTenantAutoConfiguration.class))
            .withPropertyValues(
                    "spring.datasource.generate-unique-name=true",
                    "spring.sql.init.schema-locations=classpath:schema.sql",
                    "mytenant.entity-packages=io.github.mocanjie.base.mytenant.test.entity");

    @AfterEach
    void cleanup() {
        TableInfoBuilder.clear();
    }

    @Test
    @Order(1)
    @DisplayName("1.1 默认装配 JDBC 存储并冻结注册表")
    void test01_defaultBeans() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertTrue(context.getBean(AbstractEntityStore.class) instanceof JdbcEntityStore);
            FilterRegistry registry = context.getBean(FilterRegistry.class);
            assertTrue(registry.isFrozen());
            assertEquals(2, registry.filtersFor(Organization.class).size());
            assertEquals(2, registry.filtersFor(TestDocument.class).size(), "配置包中的实体一并注册");
            assertNotNull(context.getBean(DirectoryService.class));
            assertNotNull(context.getBean(ScopeTaskDecorator.class));
        });
    }

    @Test
    @Order(2)
    @DisplayName("1.2 端到端隔离")
    void test02_endToEnd() {
        contextRunner.run(context -> {
            AbstractEntityStore store = context.getBean(AbstractEntityStore.class);
            DirectoryService service = context.getBean(DirectoryService.class);

            Organization org1 = ScopeContext.withoutTenant(() -> {
                store.insert(tenant(1L));
                store.insert(tenant(2L));
                service.createOrganization(organization(2L, "Org-2"));
                return service.createOrganization(organization(1L, "Org-1"));
            });

            assertEquals(1, ScopeContext.supply(1L, service::getOrganizations).size());
            assertEquals(2, service.getAllOrganizations().size());

            Employee employee = new Employee();
            employee.setOrganizationId(org1.getId());
            employee.setName("Bob");
            assertThrows(ParentNotVisibleException.class,
                    () -> ScopeContext.run(2L, () -> service.createEmployee(employee)));
        });
    }

    @Test
    @Order(3)
    @DisplayName("1.3 自定义参数名")
    void test03_customParamName() {
        contextRunner.withPropertyValues("mytenant.tenant-param-name=tid", "mytenant.showsql=false").run(context -> {
            AbstractEntityStore store = context.getBean(AbstractEntityStore.class);
            ScopeContext.withoutTenant(() -> {
                store.insert(tenant(1L));
                store.insert(tenant(2L));
            });
            assertEquals(1, ScopeContext.supply(2L, () -> store.list(Tenant.class)).size());
        });
    }

    @Test
    @Order(4)
    @DisplayName("1.4 用户自定义存储优先")
    void test04_userDefinedStore() {
        contextRunner.withBean(AbstractEntityStore.class, InMemoryEntityStore::new).run(context -> {
            AbstractEntityStore store = context.getBean(AbstractEntityStore.class);
            assertTrue(store instanceof InMemoryEntityStore);
            assertSame(context.getBean(FilterRegistry.class), store.getFilterRegistry(), "注册表回填到自定义存储");
        });
    }

    @Test
    @Order(5)
    @DisplayName("1.5 showsql 开启时调高 SQL 日志级别")
    void test05_showSqlLevels() {
        contextRunner.run(context -> {
            ch.qos.logback.classic.Logger parserLogger =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("io.github.mocanjie.base.mytenant.parser");
            assertEquals(Level.DEBUG, parserLogger.getLevel());
            ch.qos.logback.classic.Logger reflectionsLogger =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("org.reflections");
            assertEquals(Level.ERROR, reflectionsLogger.getLevel());
        });
    }

    @Test
    @Order(6)
    @DisplayName("1.6 非 Logback 日志实现时跳过而不报错")
    void test06_nonLogbackFactory() {
        assertFalse(LogLevelUtils.setLevel(new NOPLoggerFactory(), "org.reflections", "ERROR"));
        assertFalse(LogLevelUtils.setLevel(null, "org.reflections", "ERROR"));
        assertFalse(LogLevelUtils.setLevel(LoggerFactory.getILoggerFactory(), "org.reflections", "NO_SUCH_LEVEL"),
                "无效级别记录告警后返回 false");
    }

    private static Tenant tenant(Long id) {
        Tenant t = new Tenant();
        t.setId(id);
        t.setName("Tenant-" + id);
        return t;
    }

    private static Organization organization(Long tenantId, String name) {
        Organization o = new Organization();
        o.setTenantId(tenantId);
        o.setName(name);
        return o;
    }
}
