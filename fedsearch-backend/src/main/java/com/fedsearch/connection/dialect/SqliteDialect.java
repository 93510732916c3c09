package com.fedsearch.connection.dialect;

import com.fedsearch.config.FedSearchProperties.ConnectionProperties;
import com.zaxxer.hikari.HikariConfig;

public class SqliteDialect implements SqlDialect {

    private static final String SQLITE_OPEN_READONLY = "1";

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    public String driverClassName() {
        return "org.sqlite.JDBC";
    }

    /**
     * File databases carry no credentials. The driver refuses to flip the read-only flag on an
     * open connection, so the file is opened read-only instead.
     */
    @Override
    public void configure(HikariConfig config, ConnectionProperties props) {
        config.addDataSourceProperty("open_mode", SQLITE_OPEN_READONLY);
    }
}
