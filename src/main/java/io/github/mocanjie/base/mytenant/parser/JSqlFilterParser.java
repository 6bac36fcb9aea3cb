package io.github.mocanjie.base.mytenant.parser;

import io.github.mocanjie.base.mytenant.builder.TableInfoBuilder;
import io.github.mocanjie.base.mytenant.exception.MyTenantException;
import io.github.mocanjie.base.mytenant.filter.FilterRegistry;
import io.github.mocanjie.base.mytenant.filter.RowFilter;
import io.github.mocanjie.base.mytenant.metadata.TableInfo;
import io.github.mocanjie.base.mytenant.utils.CommonUtils;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.conditional.XorExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 基于JSqlParser的过滤条件注入器
 *
 * <p>对 SELECT 语句中出现的每个 {@code @MyTable} 表，取出 {@link FilterRegistry} 中为该实体注册的全部过滤条件，
 * 在查询发出时刻转换为 SQL（租户条件因此读取的是当时的作用域）：
 * <ul>
 *   <li>主表、INNER JOIN、FULL JOIN 的条件追加到 WHERE</li>
 *   <li>LEFT/RIGHT JOIN 的条件追加到该 JOIN 的 ON 子句，避免把外连接变成内连接</li>
 *   <li>递归处理 WITH、FROM/JOIN 子查询、UNION 各分支，以及 SELECT 列、WHERE、ON、GROUP BY、HAVING、
 *   QUALIFY、ORDER BY 中任意位置的子查询（函数参数、CASE、IN / EXISTS / 比较）</li>
 * </ul>
 * 注入完成后再扫描一遍语句中的所有表，仍有实体表未带上条件（如括号包裹的 JOIN 组）时拒绝执行。
 * 无法解析的 SQL 同样拒绝执行，不会带着缺失的过滤条件放行。
 */
public class JSqlFilterParser {

    private static final Logger log = LoggerFactory.getLogger(JSqlFilterParser.class);

    private final FilterRegistry registry;

    /**
     * 已处理的实体表（含注入片段中的父表），按对象身份比较
     */
    private final Set<Table> handled = Collections.newSetFromMap(new IdentityHashMap<>());

    private final SubQueryVisitor subQueryVisitor = new SubQueryVisitor();

    private JSqlFilterParser(FilterRegistry registry) {
        this.registry = registry;
    }

    /**
     * 为 SQL 注入所有相关表的过滤条件
     *
     * @param sql 原始SQL语句
     * @param registry 过滤条件注册表
     * @return 注入条件后的SQL；非 SELECT 语句原样返回
     * @throws MyTenantException SQL 无法解析，或实体表出现在无法注入条件的位置
     */
    public static String appendFilterConditions(String sql, FilterRegistry registry) {
        if (sql == null || sql.trim().isEmpty()) {
            return sql;
        }
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            log.warn("解析SQL失败，拒绝执行: {}, 异常: {}", sql, e.getMessage());
            throw new MyTenantException("无法解析SQL，已拒绝执行", e);
        }
        if (!(statement instanceof Select)) {
            return sql;
        }
        Select select = (Select) statement;
        JSqlFilterParser parser = new JSqlFilterParser(registry);
        parser.processSelect(select);
        parser.verifyAllTablesHandled(select, sql);
        String processed = select.toString();
        if (log.isDebugEnabled()) {
            log.debug("Original SQL: {}", sql);
            log.debug("Processed SQL: {}", processed);
        }
        return processed;
    }

    private void processSelect(Select select) {
        if (select.getWithItemsList() != null) {
            for (WithItem withItem : select.getWithItemsList()) {
                processSelect(withItem);
            }
        }
        if (select instanceof PlainSelect) {
            processPlainSelect((PlainSelect) select);
        } else if (select instanceof SetOperationList) {
            for (Select branch : ((SetOperationList) select).getSelects()) {
                processSelect(branch);
            }
        } else if (select instanceof ParenthesedSelect) {
            processSelect(((ParenthesedSelect) select).getSelect());
        }
        visitOrderBy(select.getOrderByElements());
    }

    private void processPlainSelect(PlainSelect plainSelect) {
        // 先处理用户 SQL 中已有的子查询，再注入条件，注入的 EXISTS 片段不会被二次处理
        processFromItem(plainSelect.getFromItem());
        if (plainSelect.getJoins() != null) {
            for (Join join : plainSelect.getJoins()) {
                processFromItem(join.getRightItem());
                if (join.getOnExpressions() != null) {
                    for (Expression on : join.getOnExpressions()) {
                        visitSubQueries(on);
                    }
                }
            }
        }
        if (plainSelect.getSelectItems() != null) {
            for (SelectItem<?> selectItem : plainSelect.getSelectItems()) {
                visitSubQueries(selectItem.getExpression());
            }
        }
        visitSubQueries(plainSelect.getWhere());
        if (plainSelect.getGroupBy() != null) {
            visitSubQueries(plainSelect.getGroupBy().getGroupByExpressionList());
        }
        visitSubQueries(plainSelect.getHaving());
        visitSubQueries(plainSelect.getQualify());

        List<Expression> whereConditions = new ArrayList<>();
        if (plainSelect.getFromItem() instanceof Table) {
            Expression condition = buildConditions((Table) plainSelect.getFromItem());
            if (condition != null) whereConditions.add(condition);
        }
        if (plainSelect.getJoins() != null) {
            for (Join join : plainSelect.getJoins()) {
                if (!(join.getRightItem() instanceof Table)) continue;
                Expression condition = buildConditions((Table) join.getRightItem());
                if (condition == null) continue;
                if (join.isLeft() || join.isRight()) {
                    addConditionToJoinOn(join, condition);
                } else {
                    whereConditions.add(condition);
                }
            }
        }

        if (!whereConditions.isEmpty()) {
            Expression combined = and(whereConditions);
            Expression currentWhere = plainSelect.getWhere();
            plainSelect.setWhere(currentWhere == null ? combined : new AndExpression(protect(currentWhere), combined));
        }
    }

    private void processFromItem(FromItem fromItem) {
        if (fromItem instanceof ParenthesedSelect) {
            processSelect((ParenthesedSelect) fromItem);
        }
    }

    private void visitOrderBy(List<OrderByElement> orderByElements) {
        if (orderByElements == null) return;
        for (OrderByElement element : orderByElements) {
            visitSubQueries(element.getExpression());
        }
    }

    private void visitSubQueries(Expression expression) {
        if (expression != null) {
            expression.accept(subQueryVisitor);
        }
    }

    /**
     * 表对应实体的全部过滤条件（AND），未注册的表或当前无需限制时返回 null
     */
    private Expression buildConditions(Table table) {
        TableInfo tableInfo = TableInfoBuilder.getTableInfoByTableName(table.getName());
        if (tableInfo == null) {
            return null;
        }
        handled.add(table);
        String alias = table.getAlias() != null ? table.getAlias().getName() : null;
        String tableRef = CommonUtils.tableRef(table.getName(), alias);
        List<Expression> conditions = new ArrayList<>();
        for (RowFilter<?> filter : registry.filtersFor(tableInfo.getClazz())) {
            String sql = filter.toSql(tableRef);
            if (sql == null) continue;
            Expression condition;
            try {
                condition = CCJSqlParserUtil.parseCondExpression(sql);
            } catch (JSQLParserException e) {
                throw new MyTenantException(String.format("过滤条件[%s]生成的SQL无法解析: %s", filter.name(), sql), e);
            }
            // 条件片段自带的父表已经受控
            TableCollector collector = new TableCollector();
            collector.getTables(condition);
            handled.addAll(collector.found);
            conditions.add(condition);
        }
        log.debug("表{}({})注入{}个过滤条件", table.getName(), tableRef, conditions.size());
        return conditions.isEmpty() ? null : and(conditions);
    }

    /**
     * 语句中每个实体表都必须已注入条件，否则拒绝执行
     */
    private void verifyAllTablesHandled(Select select, String sql) {
        TableCollector collector = new TableCollector();
        try {
            collector.getTables((Statement) select);
        } catch (UnsupportedOperationException e) {
            log.warn("无法确认SQL中的表是否都已注入过滤条件，拒绝执行: {}", sql);
            throw new MyTenantException("无法确认SQL中的表是否都已注入过滤条件，已拒绝执行", e);
        }
        for (Table table : collector.found) {
            if (handled.contains(table) || TableInfoBuilder.getTableInfoByTableName(table.getName()) == null) {
                continue;
            }
            log.warn("表{}出现在无法注入过滤条件的位置，拒绝执行: {}", table.getName(), sql);
            throw new MyTenantException(String.format("表 %s 出现在无法注入过滤条件的位置，已拒绝执行", table.getName()));
        }
    }

    /**
     * 使用 setOnExpressions 合并为单个 ON 表达式，避免出现重复 ON 子句
     */
    private static void addConditionToJoinOn(Join join, Expression condition) {
        Collection<Expression> onExpressions = join.getOnExpressions();
        Expression combined = null;
        if (onExpressions != null) {
            for (Expression expr : onExpressions) {
                combined = combined == null ? protect(expr) : new AndExpression(combined, protect(expr));
            }
        }
        combined = combined == null ? condition : new AndExpression(combined, condition);
        List<Expression> newExpressions = new ArrayList<>();
        newExpressions.add(combined);
        join.setOnExpressions(newExpressions);
    }

    private static Expression and(List<Expression> conditions) {
        Expression result = conditions.get(0);
        for (int i = 1; i < conditions.size(); i++) {
            result = new AndExpression(result, conditions.get(i));
        }
        return result;
    }

    /**
     * OR/XOR 在与新条件 AND 之前加括号，保持原有优先级
     */
    private static Expression protect(Expression expression) {
        if (expression instanceof OrExpression || expression instanceof XorExpression) {
            return new Parenthesis(expression);
        }
        return expression;
    }

    /**
     * 遍历表达式树，遇到子查询交回 {@link #processSelect(Select)}
     */
    private final class SubQueryVisitor extends ExpressionVisitorAdapter {

        @Override
        public void visit(ParenthesedSelect select) {
            processSelect(select);
        }

        @Override
        public void visit(Select select) {
            processSelect(select);
        }
    }

    /**
     * 收集语句中出现的全部 {@link Table} 对象（不含列引用中的表名）
     */
    private static final class TableCollector extends TablesNamesFinder {

        private final List<Table> found = new ArrayList<>();

        @Override
        public void visit(Table table) {
            found.add(table);
            super.visit(table);
        }
    }
}
