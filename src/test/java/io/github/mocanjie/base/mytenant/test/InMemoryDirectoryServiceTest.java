package io.github.mocanjie.base.mytenant.test;

import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.dao.impl.AbstractEntityStore;
import io.github.mocanjie.base.mytenant.dao.impl.InMemoryEntityStore;
import io.github.mocanjie.base.mytenant.domain.entity.Organization;
import io.github.mocanjie.base.mytenant.exception.EntityNotFoundException;
import io.github.mocanjie.base.mytenant.filter.FilterRegistrar;
import io.github.mocanjie.base.mytenant.filter.TenantPredicateFactory;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import io.github.mocanjie.base.mytenant.scope.ScopeContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("目录服务测试（内存存储）")
class InMemoryDirectoryServiceTest extends DirectoryServiceScenarios {

    @Override
    protected AbstractEntityStore createStore() {
        return new InMemoryEntityStore();
    }

    @Test
    @Order(101)
    @DisplayName("5.1 返回的是副本，修改不影响存储")
    void test101_returnsCopies() {
        Organization loaded = ScopeContext.supply(1L, () -> store.findById(Organization.class, org1.getId())).orElseThrow();
        loaded.setName("changed outside");
        loaded.setDeleteFlag(1);
        assertEquals("Org-1", ScopeContext.supply(1L, () -> store.findById(Organization.class, org1.getId()))
                .orElseThrow().getName());
    }

    @Test
    @Order(102)
    @DisplayName("5.2 主键重复")
    void test102_duplicateKey() {
        assertThrows(DuplicateKeyException.class, () -> ScopeContext.run(null, () -> store.insert(tenant(1L))));
    }

    // =========================================================
    // 6. 并发修改与删除
    // =========================================================

    /**
     * 在 doUpdate / doSoftDelete 之前插入另一个写操作，模拟两次写入交错
     */
    private static InMemoryEntityStore interleavingStore(Runnable beforeUpdate, Runnable beforeSoftDelete) {
        InMemoryEntityStore racing = new InMemoryEntityStore() {
            private boolean fired;

            @Override
            protected int doUpdate(TableInfo tableInfo, Object po, Object existing) {
                if (!fired && beforeUpdate != null) {
                    fired = true;
                    beforeUpdate.run();
                }
                return super.doUpdate(tableInfo, po, existing);
            }

            @Override
            protected boolean doSoftDelete(TableInfo tableInfo, Object existing) {
                if (!fired && beforeSoftDelete != null) {
                    fired = true;
                    beforeSoftDelete.run();
                }
                return super.doSoftDelete(tableInfo, existing);
            }
        };
        racing.setFilterRegistry(new FilterRegistrar(new TenantPredicateFactory(racing))
                .buildRegistry(TableInfoBuilder.getAllTableInfos()));
        return racing;
    }

    private static Organization seed(InMemoryEntityStore racing) {
        return ScopeContext.withoutTenant(() -> {
            racing.insert(tenant(1L));
            Organization o = organization(1L, "Org-Race");
            racing.insert(o);
            return o;
        });
    }

    private static Organization renamed(Long id) {
        Organization change = new Organization();
        change.setId(id);
        change.setName("Renamed");
        return change;
    }

    @Test
    @Order(103)
    @DisplayName("6.1 修改期间被逻辑删除，不会把删除标记改回")
    void test103_softDeleteDuringUpdate() {
        InMemoryEntityStore[] holder = new InMemoryEntityStore[1];
        Long[] id = new Long[1];
        holder[0] = interleavingStore(() -> holder[0].softDelete(Organization.class, id[0]), null);
        Organization org = seed(holder[0]);
        id[0] = org.getId();

        assertThrows(EntityNotFoundException.class, () -> ScopeContext.run(1L, () -> holder[0].update(renamed(org.getId()))));
        Organization stored = holder[0].resolve(Organization.class, org.getId());
        assertEquals(1, stored.getDeleteFlag(), "删除标记保持已删除");
        assertEquals("Org-Race", stored.getName());
        assertTrue(ScopeContext.supply(1L, () -> holder[0].list(Organization.class)).isEmpty());
    }

    @Test
    @Order(104)
    @DisplayName("6.2 删除期间被修改，修改内容不丢失")
    void test104_updateDuringSoftDelete() {
        InMemoryEntityStore[] holder = new InMemoryEntityStore[1];
        Long[] id = new Long[1];
        holder[0] = interleavingStore(null, () -> holder[0].update(renamed(id[0])));
        Organization org = seed(holder[0]);
        id[0] = org.getId();

        assertTrue(ScopeContext.supply(1L, () -> holder[0].softDelete(Organization.class, org.getId())));
        Organization stored = holder[0].resolve(Organization.class, org.getId());
        assertEquals(1, stored.getDeleteFlag());
        assertEquals("Renamed", stored.getName());
    }

    @Test
    @Order(105)
    @DisplayName("6.3 并发修改与删除后行始终保持已删除")
    void test105_concurrentUpdateAndSoftDelete() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                Organization org = ScopeContext.supply(1L, () -> service.createOrganization(organization(1L, "Org-R")));
                CountDownLatch start = new CountDownLatch(1);
                Future<?> updating = pool.submit(() -> {
                    start.await();
                    try {
                        ScopeContext.run(1L, () -> store.update(renamed(org.getId())));
                    } catch (EntityNotFoundException e) {
                        // 删除先完成
                    }
                    return null;
                });
                Future<Boolean> deleting = pool.submit(() -> {
                    start.await();
                    return ScopeContext.supply(1L, () -> service.deleteOrganization(org.getId()));
                });
                start.countDown();
                updating.get(5, TimeUnit.SECONDS);
                assertTrue(deleting.get(5, TimeUnit.SECONDS));
                Organization stored = store.resolve(Organization.class, org.getId());
                assertEquals(1, stored.getDeleteFlag(), "round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
