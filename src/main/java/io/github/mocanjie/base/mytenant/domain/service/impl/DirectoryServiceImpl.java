package io.github.mocanjie.base.mytenant.domain.service.impl;

import io.github.mocanjie.base.mytenant.dao.EntityStore;
import io.github.mocanjie.base.mytenant.domain.entity.Employee;
import io.github.mocanjie.base.mytenant.domain.entity.Organization;
import io.github.mocanjie.base.mytenant.domain.service.DirectoryService;
import io.github.mocanjie.base.mytenant.scope.ScopeContext;
import io.github.mocanjie.base.mytenant.scope.ScopeSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Transactional(readOnly = true)
public class DirectoryServiceImpl implements DirectoryService {

	private final EntityStore entityStore;

	public DirectoryServiceImpl(EntityStore entityStore) {
		this.entityStore = entityStore;
	}

	@Override
	public List<Organization> getOrganizations() {
		return entityStore.list(Organization.class);
	}

	@Override
	public List<Organization> getAllOrganizations() {
		return ScopeContext.withoutTenant(this::getOrganizations);
	}

	@Transactional
	@Override
	public Organization createOrganization(Organization organization) {
		entityStore.insert(organization);
		log.info("新增组织: id={}, tenantId={}", organization.getId(), organization.getTenantId());
		return organization;
	}

	@Override
	public List<Employee> getEmployees() {
		return entityStore.list(Employee.class);
	}

	@Override
	public List<Employee> getEmployees(Long tenantId) {
		return ScopeContext.supply(tenantId, () -> getEmployees());
	}

	@Transactional
	@Override
	public Employee createEmployee(Employee employee) {
		entityStore.insert(employee);
		log.info("新增员工: id={}, organizationId={}", employee.getId(), employee.getOrganizationId());
		return employee;
	}

	@Transactional
	@Override
	public boolean deleteOrganization(Long id) {
		return entityStore.softDelete(Organization.class, id);
	}

	@Transactional
	@Override
	public boolean deleteEmployee(Long id) {
		return entityStore.softDelete(Employee.class, id);
	}

	@Override
	public CompletableFuture<List<Employee>> getEmployeesAsync(Executor executor) {
		return CompletableFuture.supplyAsync(ScopeSnapshot.capture().wrap(() -> getEmployees()), executor);
	}
}
