package com.schemaops.core.test;

import com.schemaops.core.db.DatabaseConnection;
import com.schemaops.core.db.QueryResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * In-memory connection that logs statements and answers from a {@link StatementScript}.
 */
public class FakeConnection implements DatabaseConnection {

    private final int sessionId;
    private final StatementScript script;
    private final Queue<String> sharedLog;
    private final List<String> statements = new ArrayList<>();

    public FakeConnection(int sessionId) {
        this(sessionId, new StatementScript(), StatementScript.newLog());
    }

    FakeConnection(int sessionId, StatementScript script, Queue<String> sharedLog) {
        this.sessionId = sessionId;
        this.script = script;
        this.sharedLog = sharedLog;
    }

    @Override
    public QueryResult query(String sql, List<?> params) {
        synchronized (statements) {
            statements.add(sql);
        }
        sharedLog.add(sql);
        if (sql.startsWith("SELECT pg_backend_pid()")) {
            QueryResult scripted = script.run(sql, params);
            if (!scripted.rows().isEmpty()) {
                return scripted;
            }
            return QueryResult.singleValue("session_id", sessionId);
        }
        return script.run(sql, params);
    }

    public int sessionId() {
        return sessionId;
    }

    public StatementScript script() {
        return script;
    }

    public List<String> statements() {
        synchronized (statements) {
            return new ArrayList<>(statements);
        }
    }
}
