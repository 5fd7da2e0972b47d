package com.example.pms.router.config;

import com.pgvector.PGvector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Registers the pgvector type with the driver so embedding columns can be read and written as
 * {@link PGvector}.
 */
@Slf4j
@Configuration
@Profile("!test")
@RequiredArgsConstructor
public class PgvectorConfig {

    private final DataSource dataSource;

    @PostConstruct
    public void registerPgvectorTypes() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            String driverName = conn.getMetaData().getDriverName();
            if (driverName != null && driverName.toLowerCase(Locale.ROOT).contains("postgresql")) {
                PGvector.registerTypes(conn);
                log.info("[pgvector] Registered vector type");
            } else {
                log.debug("Skip pgvector type registration for non-PostgreSQL connection: {}", driverName);
            }
        }
    }
}
