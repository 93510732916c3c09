package com.fedsearch.connection.dialect;

import com.fedsearch.config.FedSearchProperties.ConnectionProperties;
import com.zaxxer.hikari.HikariConfig;

import java.util.Set;

public class PostgresDialect implements SqlDialect {

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public String driverClassName() {
        return "org.postgresql.Driver";
    }

    @Override
    public void configure(HikariConfig config, ConnectionProperties props) {
        SqlDialect.super.configure(config, props);
        // Shows up as pg_stat_activity.application_name.
        config.addDataSourceProperty("ApplicationName", "fedsearch");
    }

    @Override
    public Set<String> systemSchemas() {
        return Set.of("pg_catalog", "information_schema", "pg_toast");
    }
}
