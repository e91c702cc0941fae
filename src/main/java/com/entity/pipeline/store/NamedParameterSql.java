package com.entity.pipeline.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SQL with {@code :name} placeholders rewritten to positional {@code ?} markers.
 * Placeholders inside string literals, quoted identifiers and comments are left alone.
 */
final class NamedParameterSql {
    private static final Map<String, NamedParameterSql> PARSED = new ConcurrentHashMap<>();

    private final String sql;
    private final List<String> parameterNames;

    private NamedParameterSql(String sql, List<String> parameterNames) {
        this.sql = sql;
        this.parameterNames = Collections.unmodifiableList(parameterNames);
    }

    static NamedParameterSql parse(String namedSql) {
        return PARSED.computeIfAbsent(namedSql, NamedParameterSql::doParse);
    }

    String sql() {
        return sql;
    }

    List<String> parameterNames() {
        return parameterNames;
    }

    /**
     * Resolves the positional values, failing fast on a missing parameter.
     */
    List<Object> bind(Map<String, Object> params) {
        List<Object> values = new ArrayList<>(parameterNames.size());
        for (String name : parameterNames) {
            if (!params.containsKey(name)) {
                throw new StoreException("Missing SQL parameter ':" + name + "'");
            }
            values.add(params.get(name));
        }
        return values;
    }

    private static NamedParameterSql doParse(String namedSql) {
        StringBuilder out = new StringBuilder(namedSql.length());
        List<String> names = new ArrayList<>();
        int length = namedSql.length();
        int i = 0;
        while (i < length) {
            char c = namedSql.charAt(i);
            if (c == '\'' || c == '"') {
                int close = namedSql.indexOf(c, i + 1);
                while (close >= 0 && close + 1 < length && namedSql.charAt(close + 1) == c) {
                    close = namedSql.indexOf(c, close + 2);
                }
                int end = close < 0 ? length : close + 1;
                out.append(namedSql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < length && namedSql.charAt(i + 1) == '-') {
                int end = namedSql.indexOf('\n', i);
                end = end < 0 ? length : end;
                out.append(namedSql, i, end);
                i = end;
            } else if (c == ':' && i + 1 < length && Character.isJavaIdentifierStart(namedSql.charAt(i + 1))) {
                int j = i + 1;
                while (j < length && Character.isJavaIdentifierPart(namedSql.charAt(j))) {
                    j++;
                }
                names.add(namedSql.substring(i + 1, j));
                out.append('?');
                i = j;
            } else {
                out.append(c);
                i++;
            }
        }
        return new NamedParameterSql(out.toString(), names);
    }
}
