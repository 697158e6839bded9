package com.example.jejutrip.service;

import com.example.jejutrip.model.CatalogSpot;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

public class CatalogSpotRowMapper implements RowMapper<CatalogSpot> {

    private static final Set<String> CLOSED_STATUSES = Set.of("폐업", "휴업", "closed");
    private static final int MAX_STAY_MINUTES = 24 * 60;

    @Override
    public CatalogSpot mapRow(ResultSet rs, int rowNum) throws SQLException {
        CatalogSpot s = new CatalogSpot();

        s.setPlaceId(safeGetString(rs, "place_id"));
        s.setName(safeGetString(rs, "place_name"));
        s.setCategories(safeGetList(rs, "categories"));
        s.setRegion(safeGetString(rs, "region"));
        s.setAddress(safeGetString(rs, "address"));

        s.setLat(safeGetDouble(rs, "lat"));
        s.setLng(safeGetDouble(rs, "lng"));

        Double duration = safeGetDouble(rs, "average_duration_minutes");
        s.setAverageDurationMinutes(toStayMinutes(duration));
        s.setOperatingHours(safeGetString(rs, "operating_hours"));

        String status = safeGetString(rs, "business_status");
        s.setClosed(status != null && CLOSED_STATUSES.contains(status.trim()));

        s.setTags(safeGetList(rs, "tags"));
        s.setInterestTags(safeGetList(rs, "interest_tags"));
        s.setRainyDayFriendly(safeGetBoolean(rs, "rainy_day_friendly"));
        s.setHiddenGem(safeGetBoolean(rs, "is_hidden_gem"));
        return s;
    }

    private String safeGetString(ResultSet rs, String col) {
        try {
            return rs.getString(col);
        } catch (SQLException ignore) {
            return null;
        }
    }

    /** 숫자가 아니거나 비어 있으면 null (좌표 없음과 0 을 구분) */
    private Double safeGetDouble(ResultSet rs, String col) {
        try {
            Object obj = rs.getObject(col);
            if (obj == null) return null;
            if (obj instanceof Number n) return n.doubleValue();
            String v = String.valueOf(obj).trim();
            if (v.isEmpty()) return null;
            try {
                return Double.parseDouble(v);
            } catch (NumberFormatException e) {
                return null;
            }
        } catch (SQLException ignore) {
            return null;
        }
    }

    private Boolean safeGetBoolean(ResultSet rs, String col) {
        try {
            Object obj = rs.getObject(col);
            if (obj == null) return null;
            if (obj instanceof Boolean b) return b;
            return Boolean.parseBoolean(String.valueOf(obj).trim());
        } catch (SQLException ignore) {
            return null;
        }
    }

    /** text[] 컬럼 또는 콤마 구분 문자열 */
    private List<String> safeGetList(ResultSet rs, String col) {
        try {
            Object obj = rs.getObject(col);
            if (obj == null) return new ArrayList<>();
            if (obj instanceof Array arr) {
                Object[] values = (Object[]) arr.getArray();
                List<String> out = new ArrayList<>();
                for (Object v : values) {
                    if (v != null && !String.valueOf(v).isBlank()) out.add(String.valueOf(v).trim());
                }
                return out;
            }
            return new ArrayList<>(Arrays.stream(String.valueOf(obj).split(","))
                    .map(String::trim)
                    .filter(v -> !v.isEmpty())
                    .toList());
        } catch (SQLException ignore) {
            return new ArrayList<>();
        }
    }

    /** 하루를 넘는 체류시간은 잘못된 값으로 보고 미지정(null) 처리 → 기본 체류시간 사용 */
    static Integer toStayMinutes(Double duration) {
        if (duration == null || !Double.isFinite(duration)) return null;
        if (duration <= 0 || duration > MAX_STAY_MINUTES) return null;
        return (int) Math.round(duration);
    }
}
