package io.github.mocanjie.base.mytenant.dao.impl;

import io.github.mocanjie.base.mytenant.MyTableEntity;
import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.exception.MyTenantException;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import io.github.mocanjie.base.mytenant.parser.JSqlFilterParser;
import io.github.mocanjie.base.mytenant.parser.SqlParser;
import io.github.mocanjie.base.mytenant.tenant.ScopeAwareSqlParameterSource;
import org.springframework.beans.BeanUtils;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BeanPropertyRowMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SingleColumnRowMapper;
import org.springframework.jdbc.core.namedparam.BeanPropertySqlParameterSource;
import org.springframework.jdbc.core.namedparam.EmptySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.io.Serializable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 {@link NamedParameterJdbcTemplate} 的实现
 *
 * <p>所有查询都先经过 {@link JSqlFilterParser} 注入已注册的过滤条件，租户参数在执行时由
 * {@link ScopeAwareSqlParameterSource} 从当前作用域取值。
 */
public class JdbcEntityStore extends AbstractEntityStore {

	protected final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	private final String tenantParamName;

	public JdbcEntityStore(NamedParameterJdbcTemplate namedParameterJdbcTemplate, String tenantParamName) {
		this.namedParameterJdbcTemplate = namedParameterJdbcTemplate;
		this.tenantParamName = tenantParamName;
	}

	public boolean isWrapClass(Class<?> clz) {
		return BeanUtils.isSimpleValueType(clz) || clz == java.sql.Date.class;
	}

	private <T> RowMapper<T> getRowMapper(Class<T> clazz){
		if(isWrapClass(clazz)) return new SingleColumnRowMapper<T>(clazz);
		return new BeanPropertyRowMapper<T>(clazz);
	}

	/**
	 * 手写查询，FROM/JOIN/子查询/UNION 中出现的实体表都会注入过滤条件
	 */
	public <T> List<T> queryListForSql(String sql, Map<String, Object> param, Class<T> clazz) {
		SqlParameterSource sps = (param==null|| param.isEmpty())? new EmptySqlParameterSource():new MapSqlParameterSource(param);
		return query(sql, sps, clazz);
	}

	public <T> List<T> queryListForSql(String sql, Object param, Class<T> clazz) {
		SqlParameterSource sps = param==null ? new EmptySqlParameterSource() : new BeanPropertySqlParameterSource(param);
		return query(sql, sps, clazz);
	}

	public <T> T querySingleForSql(String sql, Map<String, Object> param, Class<T> clazz) {
		List<T> list = this.queryListForSql(sql, param, clazz);
		return (list==null || list.isEmpty())?null:list.get(0);
	}

	private <T> List<T> query(String sql, SqlParameterSource sps, Class<T> clazz) {
		String processedSql = JSqlFilterParser.appendFilterConditions(sql, getFilterRegistry());
		return namedParameterJdbcTemplate.query(processedSql, new ScopeAwareSqlParameterSource(sps, tenantParamName), getRowMapper(clazz));
	}

	@Override
	public <PO extends MyTableEntity> List<PO> list(Class<PO> clazz) {
		TableInfo tableInfo = TableInfoBuilder.getTableInfo(clazz);
		String sql = String.format("%s ORDER BY %s", SqlParser.getSelectSql(tableInfo), tableInfo.getPkColumnName());
		return queryListForSql(sql, (Map<String, Object>) null, clazz);
	}

	@Override
	public <PO extends MyTableEntity> Optional<PO> findById(Class<PO> clazz, Object id) {
		if (id == null) return Optional.empty();
		TableInfo tableInfo = TableInfoBuilder.getTableInfo(clazz);
		return Optional.ofNullable(querySingleForSql(SqlParser.getSelectByIdSql(tableInfo), idParam(tableInfo, id), clazz));
	}

	/**
	 * 不经过滤条件的主键查询
	 */
	@Override
	public <P> P resolve(Class<P> parentType, Object parentId) {
		if (parentId == null) return null;
		TableInfo tableInfo = TableInfoBuilder.getTableInfo(parentType);
		List<P> list = namedParameterJdbcTemplate.query(SqlParser.getSelectByIdSql(tableInfo),
				new MapSqlParameterSource(idParam(tableInfo, parentId)), getRowMapper(parentType));
		return list.isEmpty() ? null : list.get(0);
	}

	@Override
	protected Serializable doInsert(TableInfo tableInfo, Object po) {
		try{
			SqlParameterSource paramSource = new BeanPropertySqlParameterSource(po);
			String sql = SqlParser.getInsertSql(tableInfo, po);
			Object pkValue = tableInfo.getPkValue(po);
			if(pkValue!=null){
				namedParameterJdbcTemplate.update(sql, paramSource);
				return (Serializable) pkValue;
			}
			KeyHolder holder = new GeneratedKeyHolder();
			namedParameterJdbcTemplate.update(sql, paramSource, holder, new String[]{tableInfo.getPkColumnName()});
			Number key = holder.getKey();
			if (key == null) {
				throw new MyTenantException(tableInfo.getTableName() + " 未返回自增主键");
			}
			tableInfo.setPkValue(po, key.longValue());
			return (Serializable) tableInfo.getPkValue(po);
		}catch(DuplicateKeyException e){
			log.error("插入异常",e);
			throw e;
		}catch(MyTenantException e){
			throw e;
		}catch(Exception e){
			log.error("插入异常",e);
			throw new MyTenantException("系统错误,请联系管理员", e);
		}
	}

	@Override
	protected int doUpdate(TableInfo tableInfo, Object po, Object existing) {
		String sql = SqlParser.getUpdateSql(tableInfo, po, true);
		if (sql == null) {
			return 0;
		}
		return namedParameterJdbcTemplate.update(sql, new BeanPropertySqlParameterSource(po));
	}

	@Override
	protected boolean doSoftDelete(TableInfo tableInfo, Object existing) {
		Map<String, Object> param = idParam(tableInfo, tableInfo.getPkValue(existing));
		return namedParameterJdbcTemplate.update(SqlParser.getSoftDeleteSql(tableInfo), param) > 0;
	}

	private static Map<String, Object> idParam(TableInfo tableInfo, Object id) {
		Map<String, Object> param = new HashMap<>();
		param.put(tableInfo.getPkFieldName(), id);
		return param;
	}
}
