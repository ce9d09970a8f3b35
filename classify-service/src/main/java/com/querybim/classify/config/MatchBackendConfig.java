package com.querybim.classify.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querybim.classify.service.JdbcMatchClient;
import com.querybim.classify.service.SimilarityMatchClient;
import com.querybim.classify.service.SupabaseRpcMatchClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class MatchBackendConfig {

    @Bean
    @ConditionalOnProperty(name = "match.backend.mode", havingValue = "rest", matchIfMissing = true)
    public SimilarityMatchClient supabaseRpcMatchClient(
            @Value("${supabase.url}") String supabaseUrl,
            @Value("${supabase.anon-key}") String anonKey,
            @Value("${match.rpc-function:querybim_batch_match}") String functionName,
            @Value("${match.request-timeout-ms:30000}") long requestTimeoutMs,
            @Value("${match.max-response-bytes:16777216}") int maxResponseBytes,
            ObjectMapper objectMapper
    ) {
        return new SupabaseRpcMatchClient(supabaseUrl, anonKey, functionName, requestTimeoutMs, maxResponseBytes, objectMapper);
    }

    @Configuration
    @ConditionalOnProperty(name = "match.backend.mode", havingValue = "jdbc")
    static class JdbcBackend {

        @Bean
        public DataSource dataSource(
                @Value("${postgres.host}") String host,
                @Value("${postgres.port:5432}") int port,
                @Value("${postgres.db:postgres}") String db,
                @Value("${postgres.user}") String user,
                @Value("${postgres.password}") String password
        ) {
            DriverManagerDataSource ds = new DriverManagerDataSource();
            ds.setDriverClassName("org.postgresql.Driver");
            ds.setUrl("jdbc:postgresql://" + host + ":" + port + "/" + db);
            ds.setUsername(user);
            ds.setPassword(password);
            return ds;
        }

        @Bean
        public JdbcTemplate jdbcTemplate(DataSource dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        public SimilarityMatchClient jdbcMatchClient(
                JdbcTemplate jdbcTemplate,
                @Value("${match.rpc-function:querybim_batch_match}") String functionName
        ) {
            return new JdbcMatchClient(jdbcTemplate, functionName);
        }
    }
}
