package com.lodestar.core.persistence;

import com.lodestar.core.config.LodestarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the {@link StateStore} bean
 * selected by {@code lodestar.store.type}:
 * <ul>
 *   <li>{@code file} (default): {@link FileSystemStateStore} under {@code lodestar.store.root}</li>
 *   <li>{@code memory}: {@link InMemoryStateStore}, lost on restart</li>
 *   <li>{@code jdbc}: {@link JdbcStateStore} on the {@code lodestar.store.jdbc.*} connection;
 *       tables are created on startup</li>
 * </ul>
 */
@Configuration
public class StateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StateStoreConfig.class);

    @Bean
    public FactCodec factCodec() {
        return new FactCodec();
    }

    @Bean
    @ConditionalOnProperty(name = "lodestar.store.type", havingValue = "memory")
    public StateStore inMemoryStateStore() {
        log.info("Using in-memory state store (state will not persist across restarts)");
        return new InMemoryStateStore();
    }

    @Bean
    @ConditionalOnProperty(name = "lodestar.store.type", havingValue = "file", matchIfMissing = true)
    public StateStore fileSystemStateStore(LodestarProperties properties, FactCodec codec) {
        Path root = Path.of(properties.getStore().getRoot()).toAbsolutePath();
        log.info("Using file-system state store at {}", root);
        return new FileSystemStateStore(root, codec);
    }

    @Bean
    @ConditionalOnProperty(name = "lodestar.store.type", havingValue = "jdbc")
    public DataSource lodestarDataSource(LodestarProperties properties) {
        var jdbc = properties.getStore().getJdbc();
        return DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "lodestar.store.type", havingValue = "jdbc")
    public StateStore jdbcStateStore(DataSource lodestarDataSource, FactCodec codec) {
        log.info("Using JDBC state store");
        var store = new JdbcStateStore(lodestarDataSource, codec);
        store.createTables();
        return store;
    }
}
