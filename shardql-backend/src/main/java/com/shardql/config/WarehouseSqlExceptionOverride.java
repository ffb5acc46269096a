package com.shardql.config;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * Keeps pooled warehouse connections alive for errors that belong to one query rather than to
 * the connection: unsupported features (SQLSTATE class 0A) and syntax or access rule
 * violations (class 42, e.g. a table missing from one shard).
 */
public class WarehouseSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }
        String sqlState = sqlException != null ? sqlException.getSQLState() : null;
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("42"))) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
