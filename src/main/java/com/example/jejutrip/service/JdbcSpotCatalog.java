package com.example.jejutrip.service;

import com.example.jejutrip.exception.ExternalDependency;
import com.example.jejutrip.exception.ExternalServiceException;
import com.example.jejutrip.model.CatalogSpot;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/** 스팟 DB 읽기 전용 조회 */
@Service
public class JdbcSpotCatalog implements SpotCatalog {

    static final String SELECT_WITH_COORDINATES =
            "SELECT place_id, place_name, categories, region, address, lat, lng, " +
                    "       average_duration_minutes, operating_hours, business_status, " +
                    "       tags, interest_tags, rainy_day_friendly, is_hidden_gem " +
                    "FROM spots " +
                    "WHERE status = 'published' " +
                    "  AND lat IS NOT NULL AND lng IS NOT NULL " +
                    "ORDER BY place_id";

    private final JdbcTemplate jdbc;
    private final CatalogSpotRowMapper rowMapper = new CatalogSpotRowMapper();

    public JdbcSpotCatalog(JdbcTemplate jdbc) { this.jdbc = jdbc; }

    @Override
    public List<CatalogSpot> listSpotsWithCoordinates() {
        try {
            return jdbc.query(SELECT_WITH_COORDINATES, rowMapper);
        } catch (DataAccessException e) {
            throw new ExternalServiceException(ExternalDependency.SPOT_CATALOG,
                    "spot catalog query failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
