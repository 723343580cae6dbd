package com.stockdesk.catalogsync.infrastructure.persistence;

import com.stockdesk.catalogsync.domain.model.CatalogItem;
import com.stockdesk.catalogsync.domain.port.out.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;

/**
 * PostgreSQL copy of the synchronized catalogs.
 * Listing order puts items in stock first, then the most recently synced, then by name.
 */
@Repository
public class JdbcCatalogStore implements CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcCatalogStore.class);

    private static final String LISTING_ORDER = "ORDER BY (stock > 0) DESC, synced_at DESC, name, external_id";

    private static final RowMapper<CatalogItem> ITEM_ROW_MAPPER = (rs, rowNum) -> new CatalogItem(
            rs.getString("external_id"),
            rs.getString("offer_id"),
            rs.getString("name"),
            rs.getBigDecimal("price"),
            rs.getInt("stock")
    );

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcCatalogStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void saveAll(String scopeKey, List<CatalogItem> items) {
        List<CatalogItem> storable = items.stream()
                .filter(item -> item.externalId() != null)
                .toList();
        if (storable.size() < items.size()) {
            logger.warn("Skipping {} item(s) without external id for scope {}",
                    items.size() - storable.size(), scopeKey);
        }
        if (storable.isEmpty()) {
            logger.debug("No items to save for scope {}", scopeKey);
            return;
        }

        String sql = """
            INSERT INTO catalog_items (scope_key, external_id, offer_id, name, price, stock, synced_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (scope_key, external_id) DO UPDATE SET
                offer_id = EXCLUDED.offer_id,
                name = EXCLUDED.name,
                price = EXCLUDED.price,
                stock = EXCLUDED.stock,
                synced_at = EXCLUDED.synced_at
            """;

        Timestamp syncedAt = Timestamp.from(clock.instant());
        try {
            List<Object[]> batch = storable.stream()
                    .map(item -> new Object[] {
                            scopeKey,
                            item.externalId(),
                            item.offerId(),
                            item.name() != null ? item.name() : "",
                            item.price(),
                            item.stock(),
                            syncedAt
                    })
                    .toList();

            jdbcTemplate.batchUpdate(sql, batch);
            logger.debug("Saved {} catalog items for scope {}", storable.size(), scopeKey);

        } catch (DataAccessException e) {
            logger.error("Error saving catalog items for scope {}", scopeKey, e);
            throw e;
        }
    }

    @Override
    public List<CatalogItem> findPage(String scopeKey, int offset, int limit) {
        String sql = "SELECT external_id, offer_id, name, price, stock FROM catalog_items "
                + "WHERE scope_key = ? " + LISTING_ORDER + " LIMIT ? OFFSET ?";
        try {
            return jdbcTemplate.query(sql, ITEM_ROW_MAPPER, scopeKey, limit, offset);
        } catch (DataAccessException e) {
            logger.error("Database error reading catalog page for scope {}", scopeKey, e);
            throw e;
        }
    }

    @Override
    public List<CatalogItem> findAll(String scopeKey, int limit) {
        return findPage(scopeKey, 0, limit);
    }
}
