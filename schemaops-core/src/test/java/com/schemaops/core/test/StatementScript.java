package com.schemaops.core.test;

import com.schemaops.core.db.QueryResult;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Scripted responses for {@link FakeConnection}, matched by SQL fragment.
 * Rules are checked in registration order; one-shot rules are consumed
 * when they fire. Unmatched statements return an empty result.
 */
public class StatementScript {

    private final List<Rule> rules = new CopyOnWriteArrayList<>();

    /**
     * Answer every statement containing the fragment.
     */
    public StatementScript respond(String fragment, Function<List<?>, QueryResult> response) {
        rules.add(new Rule(fragment, response, null, false));
        return this;
    }

    public StatementScript respond(String fragment, QueryResult result) {
        return respond(fragment, params -> result);
    }

    /**
     * Fail every statement containing the fragment.
     */
    public StatementScript fail(String fragment, Supplier<? extends RuntimeException> error) {
        rules.add(new Rule(fragment, params -> {
            throw error.get();
        }, null, false));
        return this;
    }

    /**
     * Fail only the next statement containing the fragment.
     */
    public StatementScript failOnce(String fragment, Supplier<? extends RuntimeException> error) {
        rules.add(new Rule(fragment, params -> {
            throw error.get();
        }, null, true));
        return this;
    }

    /**
     * Hold the next statement containing the fragment at the gate.
     */
    public StatementScript hold(String fragment, Gate gate) {
        rules.add(new Rule(fragment, null, gate, true));
        return this;
    }

    QueryResult run(String sql, List<?> params) {
        for (Rule rule : rules) {
            if (!sql.contains(rule.fragment)) {
                continue;
            }
            if (rule.oneShot && !rules.remove(rule)) {
                continue;
            }
            if (rule.gate != null) {
                rule.gate.pass();
                return QueryResult.empty();
            }
            return rule.response.apply(params);
        }
        return QueryResult.empty();
    }

    private record Rule(String fragment, Function<List<?>, QueryResult> response, Gate gate, boolean oneShot) {
    }

    /**
     * Statements in the order they reached any connection sharing this script.
     */
    static Queue<String> newLog() {
        return new ConcurrentLinkedQueue<>();
    }
}
