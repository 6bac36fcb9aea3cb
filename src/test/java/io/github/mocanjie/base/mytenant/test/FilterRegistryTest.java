package io.github.mocanjie.base.mytenant.test;

import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.exception.RegistrationConflictException;
import io.github.mocanjie.base.mytenant.filter.FilterRegistrar;
import io.github.mocanjie.base.mytenant.filter.FilterRegistry;
import io.github.mocanjie.base.mytenant.filter.RowFilter;
import io.github.mocanjie.base.mytenant.filter.SoftDeleteFilter;
import io.github.mocanjie.base.mytenant.filter.TenantPredicateFactory;
import io.github.mocanjie.base.mytenant.dao.impl.InMemoryEntityStore;
import io.github.mocanjie.base.mytenant.scope.ScopeContext;
import io.github.mocanjie.base.mytenant.scope.ScopedHandle;
import io.github.mocanjie.base.mytenant.test.entity.TestAuditLog;
import io.github.mocanjie.base.mytenant.test.entity.TestDocument;
import io.github.mocanjie.base.mytenant.test.entity.TestTag;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 过滤条件注册表测试
 *
 * 覆盖范围：
 *  - 多个条件 AND 组合、注册顺序无关
 *  - 重名 / 冻结后注册冲突
 *  - 无条件类型不受限
 *  - 组合结果在求值时读取作用域
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
@DisplayName("过滤条件注册表测试")
class FilterRegistryTest {

    private static TenantPredicateFactory factory;

    @BeforeAll
    static void setup() {
        TableInfoBuilder.clear();
        TableInfoBuilder.register(TestDocument.class, TestTag.class, TestAuditLog.class);
        factory = new TenantPredicateFactory(new InMemoryEntityStore());
    }

    @AfterAll
    static void teardown() {
        TableInfoBuilder.clear();
    }

    private static TestDocument doc(Long tenantId, Integer deleteFlag) {
        TestDocument d = new TestDocument();
        d.setTenantId(tenantId);
        d.setDeleteFlag(deleteFlag);
        return d;
    }

    private static List<TestDocument> samples() {
        return Arrays.asList(doc(1L, 0), doc(1L, 1), doc(2L, 0), doc(2L, 1), doc(null, 0), doc(1L, null));
    }

    private static List<Boolean> evaluate(Predicate<TestDocument> predicate, Long scope) {
        return ScopeContext.supply(scope, () -> {
            List<Boolean> result = new ArrayList<>();
            for (TestDocument d : samples()) result.add(predicate.test(d));
            return result;
        });
    }

    // =========================================================
    // 1. 组合
    // =========================================================

    @Test
    @Order(1)
    @DisplayName("1.1 未注册条件的类型不受限制")
    void test01_unrestrictedType() {
        FilterRegistry registry = new FilterRegistry();
        assertTrue(registry.effectivePredicate(TestDocument.class).test(doc(9L, 1)));
        registry.freeze();
        assertTrue(registry.effectivePredicate(TestDocument.class).test(doc(9L, 1)));
        assertTrue(registry.filtersFor(TestDocument.class).isEmpty());
    }

    @Test
    @Order(2)
    @DisplayName("1.2 逻辑删除与租户条件同时生效")
    void test02_conjunction() {
        FilterRegistry registry = new FilterRegistrar(factory)
                .buildRegistry(List.of(TableInfoBuilder.getTableInfo(TestDocument.class)));
        Predicate<TestDocument> p = registry.effectivePredicate(TestDocument.class);
        assertEquals(List.of(true, false, false, false, false, false), evaluate(p, 1L));
        assertEquals(List.of(false, false, true, false, false, false), evaluate(p, 2L));
        // 无限制作用域：租户条件恒真，逻辑删除依旧生效
        assertEquals(List.of(true, false, true, false, true, false), evaluate(p, null));
    }

    @Test
    @Order(3)
    @DisplayName("1.3 注册顺序不影响结果")
    void test03_orderIndependent() {
        RowFilter<TestDocument> softDelete = new SoftDeleteFilter<>(TableInfoBuilder.getTableInfo(TestDocument.class));
        RowFilter<TestDocument> tenant = factory.forEntity(TestDocument.class);

        FilterRegistry ab = new FilterRegistry();
        ab.register(TestDocument.class, softDelete);
        ab.register(TestDocument.class, tenant);
        FilterRegistry ba = new FilterRegistry();
        ba.register(TestDocument.class, tenant);
        ba.register(TestDocument.class, softDelete);

        for (Long scope : Arrays.asList(1L, 2L, 3L, null)) {
            assertEquals(evaluate(ab.effectivePredicate(TestDocument.class), scope),
                    evaluate(ba.effectivePredicate(TestDocument.class), scope), "scope=" + scope);
        }
        ab.freeze();
        ba.freeze();
        for (Long scope : Arrays.asList(1L, 2L, 3L, null)) {
            assertEquals(evaluate(ab.effectivePredicate(TestDocument.class), scope),
                    evaluate(ba.effectivePredicate(TestDocument.class), scope), "frozen scope=" + scope);
        }
    }

    @Test
    @Order(4)
    @DisplayName("1.4 只声明一种关注点的实体只注册一种条件")
    void test04_partialRegistration() {
        FilterRegistry registry = new FilterRegistrar(factory).buildRegistry(List.of(
                TableInfoBuilder.getTableInfo(TestTag.class), TableInfoBuilder.getTableInfo(TestAuditLog.class)));

        assertEquals(1, registry.filtersFor(TestTag.class).size());
        assertEquals(SoftDeleteFilter.NAME, registry.filtersFor(TestTag.class).get(0).name());
        assertEquals(1, registry.filtersFor(TestAuditLog.class).size());
        assertEquals(TenantPredicateFactory.NAME, registry.filtersFor(TestAuditLog.class).get(0).name());

        TestTag tag = new TestTag();
        tag.setDeleteFlag(0);
        assertTrue(ScopeContext.supply(5L, () -> registry.effectivePredicate(TestTag.class).test(tag)),
                "无租户字段的实体在任何作用域下可见");
    }

    @Test
    @Order(5)
    @DisplayName("1.5 组合结果在求值时读取作用域")
    void test05_lazyScope() {
        FilterRegistry registry = new FilterRegistrar(factory)
                .buildRegistry(List.of(TableInfoBuilder.getTableInfo(TestDocument.class)));
        // 在作用域之外取得组合结果
        Predicate<TestDocument> p = registry.effectivePredicate(TestDocument.class);
        TestDocument d = doc(1L, 0);
        try (ScopedHandle ignored = ScopeContext.withScope(1L)) {
            assertTrue(p.test(d));
            try (ScopedHandle inner = ScopeContext.withScope(2L)) {
                assertFalse(p.test(d));
            }
            assertTrue(p.test(d));
        }
    }

    // =========================================================
    // 2. 冲突
    // =========================================================

    @Test
    @Order(6)
    @DisplayName("2.1 同一类型重复注册同名条件")
    void test06_duplicateName() {
        FilterRegistry registry = new FilterRegistry();
        registry.register(TestDocument.class, new SoftDeleteFilter<>(TableInfoBuilder.getTableInfo(TestDocument.class)));
        assertThrows(RegistrationConflictException.class, () -> registry.register(TestDocument.class,
                new SoftDeleteFilter<>(TableInfoBuilder.getTableInfo(TestDocument.class))));
        // 不同类型可以用同名条件
        registry.register(TestTag.class, new SoftDeleteFilter<>(TableInfoBuilder.getTableInfo(TestTag.class)));
        assertEquals(2, registry.getEntityTypes().size());
    }

    @Test
    @Order(7)
    @DisplayName("2.2 冻结后不能再注册")
    void test07_registerAfterFreeze() {
        FilterRegistry registry = new FilterRegistry();
        registry.freeze();
        assertTrue(registry.isFrozen());
        assertThrows(RegistrationConflictException.class, () -> registry.register(TestTag.class,
                new SoftDeleteFilter<>(TableInfoBuilder.getTableInfo(TestTag.class))));
    }

    @Test
    @Order(8)
    @DisplayName("2.3 冻结后条件列表只读")
    void test08_frozenListReadOnly() {
        FilterRegistry registry = new FilterRegistrar(factory)
                .buildRegistry(List.of(TableInfoBuilder.getTableInfo(TestDocument.class)));
        List<RowFilter<?>> filters = registry.filtersFor(TestDocument.class);
        assertEquals(2, filters.size());
        assertThrows(UnsupportedOperationException.class, () -> filters.remove(0));
    }
}
