package com.stockdesk.catalogsync.infrastructure.adapter;

import com.stockdesk.catalogsync.domain.port.out.SyncMetadataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Per-scope sync metadata in Redis. Failures are logged and never reach the sync run.
 */
@Repository
public class RedisSyncMetadataRepository implements SyncMetadataService {

    private static final Logger logger = LoggerFactory.getLogger(RedisSyncMetadataRepository.class);

    private static final String KEY_PREFIX = "catalogsync:";
    private static final String LAST_SYNC_SUFFIX = ":last_sync";
    private static final String SYNC_STATUS_SUFFIX = ":status";
    private static final String ITEM_COUNT_SUFFIX = ":item_count";
    private static final long METADATA_TTL_HOURS = 24;

    private final StringRedisTemplate redisTemplate;

    public RedisSyncMetadataRepository(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void updateSyncStatus(String scopeKey, String status) {
        try {
            redisTemplate.opsForValue().set(key(scopeKey, SYNC_STATUS_SUFFIX), status, METADATA_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Updated sync status for {}: {}", scopeKey, status);
        } catch (Exception e) {
            logger.error("Failed to update sync status for {}", scopeKey, e);
        }
    }

    @Override
    public void updateLastSyncTime(String scopeKey, Instant syncTime) {
        try {
            redisTemplate.opsForValue().set(key(scopeKey, LAST_SYNC_SUFFIX), syncTime.toString(),
                    METADATA_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Updated last sync time for {}: {}", scopeKey, syncTime);
        } catch (Exception e) {
            logger.error("Failed to update last sync time for {}", scopeKey, e);
        }
    }

    @Override
    public void updateItemCount(String scopeKey, int count) {
        try {
            redisTemplate.opsForValue().set(key(scopeKey, ITEM_COUNT_SUFFIX), String.valueOf(count),
                    METADATA_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Updated item count for {}: {}", scopeKey, count);
        } catch (Exception e) {
            logger.error("Failed to update item count for {}", scopeKey, e);
        }
    }

    @Override
    public Instant getLastSyncTime(String scopeKey) {
        try {
            String lastSync = redisTemplate.opsForValue().get(key(scopeKey, LAST_SYNC_SUFFIX));
            if (lastSync != null) {
                return Instant.parse(lastSync);
            }
        } catch (Exception e) {
            logger.error("Failed to get last sync time for {}", scopeKey, e);
        }
        return null;
    }

    @Override
    public int getItemCount(String scopeKey) {
        try {
            String count = redisTemplate.opsForValue().get(key(scopeKey, ITEM_COUNT_SUFFIX));
            if (count != null) {
                return Integer.parseInt(count);
            }
        } catch (Exception e) {
            logger.error("Failed to get item count for {}", scopeKey, e);
        }
        return 0;
    }

    private static String key(String scopeKey, String suffix) {
        return KEY_PREFIX + scopeKey + suffix;
    }
}
