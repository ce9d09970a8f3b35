package com.querybim.classify.service;

import com.querybim.classify.model.BackendMatch;
import com.querybim.classify.model.BatchMatchPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Calls the match function directly on the Postgres database behind Supabase.
 */
public class JdbcMatchClient implements SimilarityMatchClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcMatchClient.class);
    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final RowMapper<BackendMatch> MATCH_ROW = (rs, rowNum) -> new BackendMatch(
            rs.getLong("request_id"),
            rs.getString("code"),
            rs.getString("title"),
            rs.getDouble("similarity")
    );

    private final JdbcTemplate jdbcTemplate;
    private final String sql;

    public JdbcMatchClient(JdbcTemplate jdbcTemplate, String functionName) {
        if (functionName == null || !FUNCTION_NAME.matcher(functionName).matches()) {
            throw new IllegalArgumentException("invalid match function name: " + functionName);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.sql = """
                SELECT request_id, code, title, similarity
                FROM %s(
                    p_request_ids => ?,
                    p_query_embeddings => ?,
                    p_uniclass_type_filters => ?,
                    p_depths => ?
                )
                """.formatted(functionName);
    }

    @Override
    public List<BackendMatch> batchMatch(BatchMatchPayload payload) {
        try {
            return jdbcTemplate.query(
                    con -> {
                        PreparedStatement ps = con.prepareStatement(sql);
                        ps.setArray(1, con.createArrayOf("bigint", payload.requestIds().toArray()));
                        ps.setArray(2, con.createArrayOf("text", payload.queryEmbeddings().toArray()));
                        ps.setArray(3, con.createArrayOf("text", payload.uniclassTypeFilters().toArray()));
                        ps.setArray(4, con.createArrayOf("integer", payload.depths().toArray()));
                        return ps;
                    },
                    MATCH_ROW
            );
        } catch (DataAccessException ex) {
            String message = ex.getMostSpecificCause().getMessage();
            log.warn("jdbc batch match failed message=\"{}\"", message);
            throw new MatchBackendException(message == null ? ex.getClass().getSimpleName() : message, ex);
        }
    }
}
