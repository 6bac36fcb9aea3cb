package io.github.mocanjie.base.mytenant;

/**
 * 标记接口：所有映射到数据库表的实体类必须实现此接口，同时必须标注 {@code @MyTable}。
 * <p>
 * {@link io.github.mocanjie.base.mytenant.dao.EntityStore} 的所有读写方法都以此为上界，
 * 未实现此接口的类无法进入过滤条件体系。
 */
public interface MyTableEntity {}
