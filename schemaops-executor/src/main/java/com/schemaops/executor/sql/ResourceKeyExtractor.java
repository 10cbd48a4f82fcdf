package com.schemaops.executor.sql;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives the resource key that groups possibly conflicting statements:
 * the table names a statement references, lower-cased, sorted and
 * comma-joined.
 *
 * Tables are the names following FROM, JOIN, INTO, UPDATE, TABLE and
 * TRUNCATE, and the name after ON in an index statement. Schema-qualified
 * names are kept whole. This is a heuristic: CTE names count as tables,
 * and columns after FROM in expressions such as EXTRACT are picked up.
 * Statements naming no table share the empty key.
 */
public class ResourceKeyExtractor {

    private static final Set<String> TABLE_KEYWORDS = Set.of(
        "FROM", "JOIN", "INTO", "UPDATE", "TABLE", "TRUNCATE");

    // words that can sit between a table keyword and the table name
    private static final Set<String> SKIPPED = Set.of("ONLY", "IF", "NOT", "EXISTS", "LATERAL");

    // words that end the search for a name, e.g. ON CONFLICT DO UPDATE SET
    private static final Set<String> NOT_A_TABLE = Set.of("SET", "SELECT", "VALUES", "DEFAULT", "WHERE");

    public String resourceKey(String sql) {
        return String.join(",", tableNames(sql));
    }

    public Set<String> tableNames(String sql) {
        List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
        Set<String> tables = new TreeSet<>();
        boolean indexStatement = false;

        for (int i = 0; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.kind() != SqlToken.Kind.WORD) {
                continue;
            }
            String keyword = token.keyword();
            if (keyword.equals("INDEX")) {
                indexStatement = true;
            }
            if (TABLE_KEYWORDS.contains(keyword) || (indexStatement && keyword.equals("ON"))) {
                String name = readName(tokens, i + 1);
                if (name != null) {
                    tables.add(name);
                }
            }
        }
        return tables;
    }

    private static String readName(List<SqlToken> tokens, int start) {
        int i = start;
        while (i < tokens.size() && tokens.get(i).kind() == SqlToken.Kind.WORD
                && SKIPPED.contains(tokens.get(i).keyword())) {
            i++;
        }
        if (i >= tokens.size() || !tokens.get(i).isName()) {
            return null;
        }
        SqlToken first = tokens.get(i);
        if (first.kind() == SqlToken.Kind.WORD
                && (NOT_A_TABLE.contains(first.keyword()) || TABLE_KEYWORDS.contains(first.keyword()))) {
            return null;
        }

        StringBuilder name = new StringBuilder(first.text());
        while (i + 2 < tokens.size() && tokens.get(i + 1).isSymbol('.') && tokens.get(i + 2).isName()) {
            name.append('.').append(tokens.get(i + 2).text());
            i += 2;
        }
        return name.toString().toLowerCase(Locale.ROOT);
    }
}
