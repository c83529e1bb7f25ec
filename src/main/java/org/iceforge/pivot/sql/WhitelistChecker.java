package org.iceforge.pivot.sql;

import org.apache.calcite.sql.JoinConditionType;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlDataTypeSpec;
import org.apache.calcite.sql.SqlDynamicParam;
import org.apache.calcite.sql.SqlFunction;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlIntervalQualifier;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlWindow;
import org.apache.calcite.sql.SqlWith;
import org.apache.calcite.sql.SqlWithItem;
import org.iceforge.pivot.error.UnsafeQueryException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks a parsed query and fails on the first table or column the whitelist does not know.
 * Table aliases, derived tables, CTEs and select-list aliases are tracked per query scope;
 * correlated references resolve through enclosing scopes. Function calls must name an
 * allowed function.
 */
final class WhitelistChecker {

    private final SqlWhitelist whitelist;
    private final String sql;

    WhitelistChecker(SqlWhitelist whitelist, String sql) {
        this.whitelist = whitelist;
        this.sql = sql;
    }

    void check(SqlNode root) {
        query(root, new Scope(null));
    }

    /**
     * Walks a query node and returns its output column names, or null when they cannot be
     * known (e.g. {@code SELECT *}).
     */
    private Set<String> query(SqlNode node, Scope outer) {
        if (node instanceof SqlSelect select) {
            return select(select, outer).outputs();
        }
        if (node instanceof SqlOrderBy orderBy) {
            Scope orderScope;
            Set<String> outputs;
            if (orderBy.query instanceof SqlSelect select) {
                SelectResult result = select(select, outer);
                orderScope = result.scope();
                outputs = result.outputs();
            } else {
                outputs = query(orderBy.query, outer);
                orderScope = new Scope(outer);
                if (outputs != null) {
                    orderScope.selectAliases.addAll(outputs);
                }
            }
            expr(orderBy.orderList, orderScope);
            return outputs;
        }
        if (node instanceof SqlWith with) {
            Scope withScope = new Scope(outer);
            for (SqlNode item : with.withList) {
                SqlWithItem withItem = (SqlWithItem) item;
                Set<String> cols = query(withItem.query, new Scope(withScope));
                if (withItem.columnList != null) {
                    cols = names(withItem.columnList);
                }
                withScope.ctes.put(fold(withItem.name, 0), cols == null ? ANY : cols);
            }
            return query(with.body, withScope);
        }
        if (node instanceof SqlCall call && isSetOperation(call.getKind())) {
            Set<String> first = null;
            boolean firstSeen = false;
            for (SqlNode operand : call.getOperandList()) {
                Set<String> out = query(operand, outer);
                if (!firstSeen) {
                    first = out;
                    firstSeen = true;
                }
            }
            return first;
        }
        if (node instanceof SqlCall call && call.getKind() == SqlKind.VALUES) {
            expr(call, new Scope(outer));
            return null;
        }
        throw violation(SafetyRule.NOT_A_QUERY, "unsupported query form " + node.getKind());
    }

    private SelectResult select(SqlSelect select, Scope outer) {
        Scope scope = new Scope(outer);
        List<SqlNode> joinConditions = new ArrayList<>();
        if (select.getFrom() != null) {
            from(select.getFrom(), scope, joinConditions);
        }

        Set<String> outputs = new LinkedHashSet<>();
        boolean star = false;
        for (SqlNode item : select.getSelectList()) {
            if (item.getKind() == SqlKind.AS) {
                SqlNode alias = ((SqlCall) item).operand(1);
                String name = fold((SqlIdentifier) alias, 0);
                scope.selectAliases.add(name);
                outputs.add(name);
            } else if (item instanceof SqlIdentifier id) {
                if (id.isStar()) {
                    star = true;
                } else {
                    outputs.add(fold(id, id.names.size() - 1));
                }
            }
        }

        for (SqlNode condition : joinConditions) {
            expr(condition, scope);
        }
        for (SqlNode item : select.getSelectList()) {
            expr(item, scope);
        }
        expr(select.getWhere(), scope);
        expr(select.getGroup(), scope);
        expr(select.getHaving(), scope);
        expr(select.getWindowList(), scope);
        expr(select.getOrderList(), scope);
        return new SelectResult(scope, star ? null : outputs);
    }

    private void from(SqlNode node, Scope scope, List<SqlNode> joinConditions) {
        if (node instanceof SqlJoin join) {
            from(join.getLeft(), scope, joinConditions);
            from(join.getRight(), scope, joinConditions);
            if (join.getCondition() != null) {
                if (join.getConditionType() == JoinConditionType.USING) {
                    for (SqlNode col : (SqlNodeList) join.getCondition()) {
                        joinConditions.add(col);
                    }
                } else {
                    joinConditions.add(join.getCondition());
                }
            }
            return;
        }
        if (node instanceof SqlIdentifier id) {
            String table = qualified(id, id.names.size());
            Set<String> cols = table(table, scope);
            scope.relations.put(fold(id, id.names.size() - 1), cols);
            if (id.names.size() > 1) {
                scope.relations.put(table, cols);
            }
            return;
        }
        if (node.getKind() == SqlKind.AS) {
            SqlCall as = (SqlCall) node;
            SqlNode inner = as.operand(0);
            String alias = fold((SqlIdentifier) as.operand(1), 0);
            Set<String> cols;
            if (inner instanceof SqlIdentifier id) {
                cols = table(qualified(id, id.names.size()), scope);
            } else if (inner.isA(SqlKind.QUERY)) {
                Set<String> out = query(inner, scope.parent);
                cols = out == null ? ANY : out;
            } else {
                throw violation(SafetyRule.UNKNOWN_TABLE, "unsupported FROM item " + inner.getKind());
            }
            if (as.getOperandList().size() > 2) {
                Set<String> renamed = new LinkedHashSet<>();
                for (SqlNode col : as.getOperandList().subList(2, as.getOperandList().size())) {
                    renamed.addAll(names(col));
                }
                cols = renamed;
            }
            scope.relations.put(alias, cols);
            return;
        }
        if (node.isA(SqlKind.QUERY)) {
            Set<String> out = query(node, scope.parent);
            scope.relations.put("$derived" + scope.relations.size(), out == null ? ANY : out);
            return;
        }
        throw violation(SafetyRule.UNKNOWN_TABLE, "unsupported FROM item " + node.getKind());
    }

    private Set<String> table(String name, Scope scope) {
        if (!name.contains(".")) {
            Set<String> cte = scope.findCte(name);
            if (cte != null) {
                return cte;
            }
        }
        return whitelist.columnsOf(name)
                .orElseThrow(() -> violation(SafetyRule.UNKNOWN_TABLE, "table '" + name + "' is not part of the cube schema"));
    }

    private void expr(SqlNode node, Scope scope) {
        if (node == null
                || node instanceof SqlLiteral
                || node instanceof SqlDataTypeSpec
                || node instanceof SqlIntervalQualifier
                || node instanceof SqlDynamicParam) {
            return;
        }
        if (node instanceof SqlIdentifier id) {
            identifier(id, scope);
            return;
        }
        if (node instanceof SqlNodeList list) {
            for (SqlNode child : list) {
                expr(child, scope);
            }
            return;
        }
        if (node.isA(SqlKind.QUERY)) {
            query(node, scope);
            return;
        }
        if (node instanceof SqlWindow window) {
            expr(window.getPartitionList(), scope);
            expr(window.getOrderList(), scope);
            return;
        }
        if (node instanceof SqlCall call) {
            if (call.getKind() == SqlKind.AS) {
                expr(call.operand(0), scope);
                return;
            }
            if (call instanceof SqlBasicCall && call.getKind() == SqlKind.OVER) {
                expr(call.operand(0), scope);
                SqlNode window = call.operand(1);
                // a bare identifier here names a WINDOW clause, not a column
                if (!(window instanceof SqlIdentifier)) {
                    expr(window, scope);
                }
                return;
            }
            if (call.getOperator() instanceof SqlFunction function) {
                checkFunction(function);
            }
            for (SqlNode operand : call.getOperandList()) {
                expr(operand, scope);
            }
        }
    }

    private void identifier(SqlIdentifier id, Scope scope) {
        List<String> names = id.names;
        if (names.size() == 1) {
            if (id.isStar()) {
                return;
            }
            String column = fold(id, 0);
            if (!scope.resolvesUnqualified(column)) {
                throw violation(SafetyRule.UNKNOWN_COLUMN, "column '" + names.get(0) + "' is not part of the cube schema");
            }
            return;
        }
        String qualifier = qualified(id, names.size() - 1);
        Set<String> cols = scope.findRelation(qualifier);
        if (cols == null) {
            throw violation(SafetyRule.UNKNOWN_TABLE, "table or alias '" + qualifier + "' is not part of the query");
        }
        if (id.isStar()) {
            return;
        }
        String column = fold(id, names.size() - 1);
        if (cols != ANY && !cols.contains(column)) {
            throw violation(SafetyRule.UNKNOWN_COLUMN,
                    "column '" + qualifier + "." + names.get(names.size() - 1) + "' is not part of the cube schema");
        }
    }

    private static boolean isSetOperation(SqlKind kind) {
        return kind == SqlKind.UNION || kind == SqlKind.INTERSECT || kind == SqlKind.EXCEPT;
    }

    /**
     * Name the warehouse resolves one identifier part to: unquoted parts fold to lower case,
     * quoted parts are kept exactly.
     */
    private static String fold(SqlIdentifier id, int i) {
        String name = id.names.get(i);
        return id.getComponentParserPosition(i).isQuoted() ? name : name.toLowerCase(Locale.ROOT);
    }

    private static String qualified(SqlIdentifier id, int parts) {
        List<String> out = new ArrayList<>(parts);
        for (int i = 0; i < parts; i++) {
            out.add(fold(id, i));
        }
        return String.join(".", out);
    }

    private void checkFunction(SqlFunction function) {
        SqlIdentifier name = function.getSqlIdentifier();
        if ((name != null && name.names.size() > 1) || !SqlFunctions.isAllowed(function.getName())) {
            throw violation(SafetyRule.UNKNOWN_FUNCTION,
                    "function '" + (name != null ? name.toString() : function.getName()) + "' is not allowed");
        }
    }

    private static Set<String> names(SqlNode node) {
        Set<String> out = new LinkedHashSet<>();
        if (node instanceof SqlNodeList list) {
            for (SqlNode n : list) {
                out.addAll(names(n));
            }
        } else if (node instanceof SqlIdentifier id) {
            out.add(fold(id, id.names.size() - 1));
        }
        return out;
    }

    private UnsafeQueryException violation(SafetyRule rule, String detail) {
        return new UnsafeQueryException(rule, detail, sql);
    }

    /**
     * Marker for relations whose columns are unknown (derived from {@code SELECT *}).
     */
    private static final Set<String> ANY = Set.of("*");

    private record SelectResult(Scope scope, Set<String> outputs) {
    }

    private static final class Scope {
        final Scope parent;
        final Map<String, Set<String>> relations = new LinkedHashMap<>();
        final Map<String, Set<String>> ctes = new LinkedHashMap<>();
        final Set<String> selectAliases = new HashSet<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        Set<String> findCte(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                Set<String> cols = s.ctes.get(name);
                if (cols != null) {
                    return cols;
                }
            }
            return null;
        }

        Set<String> findRelation(String alias) {
            for (Scope s = this; s != null; s = s.parent) {
                Set<String> cols = s.relations.get(alias);
                if (cols != null) {
                    return cols;
                }
            }
            return null;
        }

        boolean resolvesUnqualified(String column) {
            for (Scope s = this; s != null; s = s.parent) {
                if (s.selectAliases.contains(column)) {
                    return true;
                }
                for (Set<String> cols : s.relations.values()) {
                    if (cols == ANY || cols.contains(column)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
