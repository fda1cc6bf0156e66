package com.demandplanner.data;

import com.demandplanner.domain.BomLine;
import com.demandplanner.domain.FabricColour;
import com.demandplanner.exception.UpstreamDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcPlanningDataSource implements PlanningDataSource {

    private static final String ORDER_LINE_JOINS = """
        FROM "OrderLine" ol
        JOIN "Order" o ON o.id = ol."orderId"
        JOIN "Sku" s ON s.id = ol."skuId"
        JOIN "Variation" v ON v.id = s."variationId"
        JOIN "Product" p ON p.id = v."productId"
        """;

    private static final String BOM_JOINS = """
        JOIN "SkuBomLine" sbl ON sbl."skuId" = s.id
        JOIN "VariationBomLine" vbl ON vbl."variationId" = v.id AND vbl."roleId" = sbl."roleId"
        JOIN "FabricColour" fc ON fc.id = vbl."fabricColourId"
        JOIN "Fabric" f ON f.id = fc."fabricId"
        """;

    private static final String CONSUMPTION = """
        SUM(ol.qty * sbl.quantity * (1 + (CASE WHEN sbl."wastagePercent" > 0
                                              THEN sbl."wastagePercent" ELSE :wastage END) / 100.0))
        """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<WeeklyTotal> weeklyTotals() {
        String sql = """
            SELECT date_trunc('week', "orderDate")::date AS week,
                   COUNT(*) AS orders,
                   SUM("totalAmount") AS revenue,
                   COUNT(DISTINCT "customerId") AS unique_customers,
                   AVG("totalAmount") AS aov
            FROM "Order" WHERE "orderDate" IS NOT NULL
            GROUP BY 1 ORDER BY 1
            """;
        return query("weekly totals", sql, new MapSqlParameterSource(), (rs, i) -> new WeeklyTotal(
            rs.getDate("week").toLocalDate(),
            rs.getLong("orders"),
            nullableDouble(rs, "revenue"),
            rs.getLong("unique_customers"),
            nullableDouble(rs, "aov")));
    }

    @Override
    public List<ProductWeek> weeklyProductUnits() {
        String sql = """
            SELECT date_trunc('week', o."orderDate")::date AS week,
                   p.name AS product_name,
                   SUM(ol.qty) AS units
            """ + ORDER_LINE_JOINS + """
            WHERE o."orderDate" IS NOT NULL
            GROUP BY 1, 2
            ORDER BY 1
            """;
        return query("weekly product units", sql, new MapSqlParameterSource(), (rs, i) -> new ProductWeek(
            rs.getDate("week").toLocalDate(),
            rs.getString("product_name"),
            rs.getDouble("units")));
    }

    @Override
    public List<MixEntry> sizeMix(int lookbackMonths) {
        String sql = """
            SELECT p.name AS product_name, s.size AS mix_key, s.size AS label, SUM(ol.qty) AS units
            """ + ORDER_LINE_JOINS + """
            WHERE o."orderDate" >= NOW() - make_interval(months => :months)
            GROUP BY 1, 2, 3
            """;
        return query("size mix", sql, new MapSqlParameterSource("months", lookbackMonths), this::mixEntry);
    }

    @Override
    public List<MixEntry> variationMix(int lookbackMonths) {
        String sql = """
            SELECT p.name AS product_name, v.id::text AS mix_key, v."colorName" AS label, SUM(ol.qty) AS units
            """ + ORDER_LINE_JOINS + """
            WHERE o."orderDate" >= NOW() - make_interval(months => :months)
            GROUP BY 1, 2, 3
            """;
        return query("variation mix", sql, new MapSqlParameterSource("months", lookbackMonths), this::mixEntry);
    }

    @Override
    public List<BomLine> bomLines() {
        String sql = """
            SELECT p.name AS product_name, v.id::text AS variation_key, s.size,
                   fc.code AS fc_code, f.name AS fabric_name, f.unit AS fabric_unit,
                   fc."colourName" AS fabric_colour, fc."costPerUnit" AS cost_per_unit,
                   sbl.quantity AS qty_per_unit, sbl."wastagePercent" AS wastage_percent
            FROM "SkuBomLine" sbl
            JOIN "Sku" s ON s.id = sbl."skuId"
            JOIN "Variation" v ON v.id = s."variationId"
            JOIN "VariationBomLine" vbl ON vbl."variationId" = v.id AND vbl."roleId" = sbl."roleId"
            JOIN "FabricColour" fc ON fc.id = vbl."fabricColourId"
            JOIN "Fabric" f ON f.id = fc."fabricId"
            JOIN "Product" p ON p.id = v."productId"
            WHERE sbl.quantity IS NOT NULL AND sbl.quantity > 0
            """;
        return query("BOM lines", sql, new MapSqlParameterSource(), (rs, i) -> new BomLine(
            rs.getString("product_name"),
            rs.getString("variation_key"),
            rs.getString("size"),
            fabricColour(rs),
            rs.getDouble("qty_per_unit"),
            nullableDouble(rs, "wastage_percent")));
    }

    @Override
    public List<FabricStock> fabricStock() {
        String sql = """
            SELECT fc.code AS fc_code, fc."currentBalance" AS current_balance
            FROM "FabricColour" fc
            WHERE fc."currentBalance" IS NOT NULL
            """;
        return query("fabric stock", sql, new MapSqlParameterSource(), (rs, i) -> new FabricStock(
            rs.getString("fc_code"),
            nullableDouble(rs, "current_balance")));
    }

    @Override
    public List<FabricWeek> weeklyFabricConsumption(double defaultWastagePercent) {
        String sql = """
            SELECT date_trunc('week', o."orderDate")::date AS week,
                   fc.code AS fc_code, f.name AS fabric_name, f.unit AS fabric_unit,
                   fc."colourName" AS fabric_colour, fc."costPerUnit" AS cost_per_unit,
            """ + CONSUMPTION + " AS qty\n" + ORDER_LINE_JOINS + BOM_JOINS + """
            WHERE o."orderDate" IS NOT NULL AND sbl.quantity > 0
            GROUP BY 1, 2, 3, 4, 5, 6
            ORDER BY 1
            """;
        return query("weekly fabric consumption", sql,
            new MapSqlParameterSource("wastage", defaultWastagePercent), (rs, i) -> new FabricWeek(
                rs.getDate("week").toLocalDate(),
                fabricColour(rs),
                rs.getDouble("qty")));
    }

    @Override
    public List<ProductFabricUsage> productFabricConsumption(int lookbackWeeks, double defaultWastagePercent) {
        String sql = """
            SELECT p.name AS product_name, fc.code AS fc_code, SUM(ol.qty) AS units,
            """ + CONSUMPTION + " AS qty\n" + ORDER_LINE_JOINS + BOM_JOINS + """
            WHERE o."orderDate" >= NOW() - make_interval(weeks => :weeks) AND sbl.quantity > 0
            GROUP BY 1, 2
            """;
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("weeks", lookbackWeeks)
            .addValue("wastage", defaultWastagePercent);
        return query("product fabric consumption", sql, params, (rs, i) -> new ProductFabricUsage(
            rs.getString("product_name"),
            rs.getString("fc_code"),
            rs.getDouble("qty"),
            rs.getDouble("units")));
    }

    private <T> List<T> query(String dataset, String sql, MapSqlParameterSource params, RowMapper<T> mapper) {
        try {
            List<T> rows = jdbc.query(sql, params, mapper);
            log.debug("Loaded {} | rows={}", dataset, rows.size());
            return rows;
        } catch (DataAccessException ex) {
            log.error("Upstream query failed | dataset={} | error={}", dataset, ex.getMessage());
            throw new UpstreamDataException(dataset, ex);
        }
    }

    private MixEntry mixEntry(ResultSet rs, int rowNum) throws SQLException {
        return new MixEntry(
            rs.getString("product_name"),
            rs.getString("mix_key"),
            rs.getString("label"),
            rs.getDouble("units"));
    }

    private static FabricColour fabricColour(ResultSet rs) throws SQLException {
        return new FabricColour(
            rs.getString("fc_code"),
            rs.getString("fabric_name"),
            rs.getString("fabric_unit"),
            rs.getString("fabric_colour"),
            nullableDouble(rs, "cost_per_unit"));
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
