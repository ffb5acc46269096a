package com.shardql.query;

import java.util.regex.Pattern;

/**
 * Builds the metadata and data queries issued by the aggregation engine.
 *
 * <p>Dataset and table names may come from request parameters, so every identifier is checked
 * against a conservative pattern before it is quoted into query text. String literals are
 * escaped by doubling single quotes.
 */
public class QueryBuilder {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_$\\-]*");
    private static final int MAX_IDENTIFIER_LENGTH = 1024;

    private final String catalog;
    private final char quote;

    /**
     * @param catalog optional project qualifier for dataset-scoped metadata, may be blank
     * @param quote identifier quote character, {@code "} for ANSI or {@code `} for BigQuery
     */
    public QueryBuilder(String catalog, char quote) {
        if (quote != '"' && quote != '`') {
            throw new IllegalArgumentException("Unsupported identifier quote: " + quote);
        }
        this.catalog = catalog != null && !catalog.isBlank() ? requireIdentifier(catalog.trim(), "catalog") : null;
        this.quote = quote;
    }

    /**
     * Lists the tables of one dataset. The result has a {@code table_name} column.
     *
     * <p>With a catalog the dataset-scoped {@code INFORMATION_SCHEMA} is read, as BigQuery
     * requires; without one, the ANSI {@code information_schema.tables} is filtered by schema.
     */
    public String listTables(String dataset) {
        requireIdentifier(dataset, "dataset");
        if (catalog != null) {
            return "SELECT table_name FROM " + quoteIdentifier(catalog) + "." + quoteIdentifier(dataset)
                    + ".INFORMATION_SCHEMA.TABLES ORDER BY table_name";
        }
        return "SELECT table_name FROM information_schema.tables WHERE table_schema = " + literal(dataset)
                + " ORDER BY table_name";
    }

    /**
     * Selects every column of a table, capped at {@code rowLimit} rows when positive.
     */
    public String selectAll(String dataset, String table, int rowLimit) {
        requireIdentifier(dataset, "dataset");
        requireIdentifier(table, "table");
        StringBuilder sql = new StringBuilder("SELECT * FROM ");
        if (catalog != null) {
            sql.append(quoteIdentifier(catalog)).append('.');
        }
        sql.append(quoteIdentifier(dataset)).append('.').append(quoteIdentifier(table));
        if (rowLimit > 0) {
            sql.append(" LIMIT ").append(rowLimit);
        }
        return sql.toString();
    }

    public static boolean isValidIdentifier(String name) {
        return name != null
                && name.length() <= MAX_IDENTIFIER_LENGTH
                && IDENTIFIER.matcher(name).matches();
    }

    static String requireIdentifier(String name, String kind) {
        if (!isValidIdentifier(name)) {
            throw new InvalidIdentifierException("Invalid " + kind + " identifier: " + name);
        }
        return name;
    }

    private String quoteIdentifier(String name) {
        String q = String.valueOf(quote);
        return q + name.replace(q, q + q) + q;
    }

    private static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
