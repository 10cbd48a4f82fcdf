package com.schemaops.executor.sql;

import com.schemaops.core.model.LockAnalysis;

import java.util.List;

/**
 * Classifies a statement by the table lock it needs, reading its leading
 * keywords rather than matching patterns anywhere in the text.
 *
 * <ul>
 *   <li>CREATE/DROP INDEX CONCURRENTLY: SHARE UPDATE EXCLUSIVE, one per resource</li>
 *   <li>CREATE/ALTER/DROP TABLE, CREATE/DROP INDEX, TRUNCATE: ACCESS EXCLUSIVE</li>
 *   <li>INSERT/UPDATE/DELETE, and WITH queries that modify data: ROW EXCLUSIVE</li>
 *   <li>SELECT and read-only WITH queries: ACCESS SHARE</li>
 *   <li>anything else: EXCLUSIVE</li>
 * </ul>
 */
public class SqlClassifier {

    public LockAnalysis analyze(String sql) {
        List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
        if (tokens.isEmpty()) {
            return LockAnalysis.unknown();
        }

        return switch (tokens.get(0).keyword()) {
            case "CREATE" -> classifyCreate(tokens);
            case "DROP" -> classifyDrop(tokens);
            case "ALTER" -> classifyAlter(tokens);
            case "TRUNCATE" -> LockAnalysis.ddl();
            case "INSERT", "UPDATE", "DELETE" -> LockAnalysis.dml();
            case "SELECT" -> LockAnalysis.select();
            case "WITH" -> classifyWith(tokens);
            default -> LockAnalysis.unknown();
        };
    }

    private LockAnalysis classifyCreate(List<SqlToken> tokens) {
        int i = 1;
        while (i < tokens.size() && isCreateModifier(tokens.get(i))) {
            i++;
        }
        if (i >= tokens.size()) {
            return LockAnalysis.unknown();
        }
        if (tokens.get(i).is("INDEX")) {
            return i + 1 < tokens.size() && tokens.get(i + 1).is("CONCURRENTLY")
                ? LockAnalysis.concurrentIndex()
                : LockAnalysis.ddl();
        }
        if (tokens.get(i).is("TABLE")) {
            return LockAnalysis.ddl();
        }
        return LockAnalysis.unknown();
    }

    private static boolean isCreateModifier(SqlToken token) {
        return token.is("UNIQUE") || token.is("TEMP") || token.is("TEMPORARY")
            || token.is("UNLOGGED") || token.is("GLOBAL") || token.is("LOCAL");
    }

    private LockAnalysis classifyDrop(List<SqlToken> tokens) {
        if (tokens.size() < 2) {
            return LockAnalysis.unknown();
        }
        SqlToken target = tokens.get(1);
        if (target.is("INDEX")) {
            return tokens.size() > 2 && tokens.get(2).is("CONCURRENTLY")
                ? LockAnalysis.concurrentIndex()
                : LockAnalysis.ddl();
        }
        if (target.is("TABLE")) {
            return LockAnalysis.ddl();
        }
        return LockAnalysis.unknown();
    }

    private LockAnalysis classifyAlter(List<SqlToken> tokens) {
        if (tokens.size() > 1 && tokens.get(1).is("TABLE")) {
            return LockAnalysis.ddl();
        }
        // ADD/DROP CONSTRAINT or COLUMN on other relation kinds
        for (int i = 1; i + 1 < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            SqlToken next = tokens.get(i + 1);
            if ((token.is("ADD") || token.is("DROP")) && (next.is("CONSTRAINT") || next.is("COLUMN"))) {
                return LockAnalysis.ddl();
            }
        }
        return LockAnalysis.unknown();
    }

    // data-modifying CTEs run as DML; the main statement may still be a SELECT
    private LockAnalysis classifyWith(List<SqlToken> tokens) {
        for (SqlToken token : tokens) {
            if (token.is("INSERT") || token.is("UPDATE") || token.is("DELETE")) {
                return LockAnalysis.dml();
            }
        }
        for (SqlToken token : tokens) {
            if (token.is("SELECT")) {
                return LockAnalysis.select();
            }
        }
        return LockAnalysis.unknown();
    }
}
