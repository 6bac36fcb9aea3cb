package io.github.mocanjie.base.mytenant.domain.service;

import io.github.mocanjie.base.mytenant.domain.entity.Employee;
import io.github.mocanjie.base.mytenant.domain.entity.Organization;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 组织与员工目录。除特别说明外，所有方法都在调用方当前的租户作用域内执行。
 */
public interface DirectoryService {

	List<Organization> getOrganizations();

	/**
	 * 无限制作用域下的全部组织（逻辑删除的仍不返回）
	 */
	List<Organization> getAllOrganizations();

	/**
	 * @throws io.github.mocanjie.base.mytenant.exception.ParentNotVisibleException 租户在当前作用域下不可见
	 */
	Organization createOrganization(Organization organization);

	List<Employee> getEmployees();

	/**
	 * 临时切换到指定租户作用域查询员工，返回后恢复调用前的作用域
	 */
	List<Employee> getEmployees(Long tenantId);

	/**
	 * @throws io.github.mocanjie.base.mytenant.exception.ParentNotVisibleException 所属组织在当前作用域下不可见
	 */
	Employee createEmployee(Employee employee);

	boolean deleteOrganization(Long id);

	boolean deleteEmployee(Long id);

	/**
	 * 在线程池中查询员工，使用提交时刻的作用域
	 */
	CompletableFuture<List<Employee>> getEmployeesAsync(Executor executor);
}
