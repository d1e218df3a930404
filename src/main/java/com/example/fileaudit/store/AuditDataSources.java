package com.example.fileaudit.store;

import com.example.fileaudit.AuditConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public final class AuditDataSources {

    private AuditDataSources() {
    }

    public static HikariDataSource create(AuditConfig.Database settings) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("file-audit");
        hikari.setJdbcUrl(settings.url());
        hikari.setUsername(settings.username());
        hikari.setPassword(settings.password());
        hikari.setMaximumPoolSize(settings.maximumPoolSize());
        hikari.setConnectionTimeout(30_000);
        return new HikariDataSource(hikari);
    }
}
