package com.picframe.cache.repository;

import com.picframe.cache.model.SqlCondition;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Runs caller filters against the {@code all_data} view. The ORDER BY text is assembled by
 * {@code QueryExpressionTranslator} from allowlisted column names only; filter values are bound.
 */
@Repository
public class ImageRecordRepositoryImpl implements ImageRecordRepositoryCustom {

    private final JdbcTemplate jdbcTemplate;

    public ImageRecordRepositoryImpl(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Long> findFileIds(SqlCondition filter, String orderBy) {
        String sql = "SELECT file_id FROM all_data " +
                "WHERE " + filter.sql() + " " +
                "ORDER BY " + orderBy;
        return jdbcTemplate.queryForList(sql, Long.class, filter.parameterArray());
    }

    @Override
    public List<Long> findFileIdsMaskingPortraits(SqlCondition filter, String orderBy) {
        // rows without metadata have a null is_portrait and count as landscape
        String sql = "SELECT CASE WHEN is_portrait THEN " + PORTRAIT_SLOT + " ELSE file_id END " +
                "FROM all_data " +
                "WHERE " + filter.sql() + " " +
                "ORDER BY " + orderBy;
        return jdbcTemplate.queryForList(sql, Long.class, filter.parameterArray());
    }

    @Override
    public List<Long> findPortraitFileIds(SqlCondition filter, String orderBy) {
        String sql = "SELECT file_id FROM all_data " +
                "WHERE (" + filter.sql() + ") AND is_portrait " +
                "ORDER BY " + orderBy;
        return jdbcTemplate.queryForList(sql, Long.class, filter.parameterArray());
    }
}
