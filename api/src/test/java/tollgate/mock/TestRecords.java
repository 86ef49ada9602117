package tollgate.mock;

import java.time.Instant;

import tollgate.core.model.tier.Tier;
import tollgate.core.model.usage.UsageRecord;

/**
 * Stamped usage records for storage and aggregation tests.
 */
public final class TestRecords {

    private TestRecords() {}

    public static UsageRecord record(String id, String identity, String category, String timestamp, String recordedAt) {
        return new UsageRecord(
                id,
                identity,
                Tier.BASIC,
                category,
                Instant.parse(timestamp),
                500,
                100,
                200,
                0.5,
                1024,
                true,
                Instant.parse(recordedAt));
    }

    public static UsageRecord failed(String id, String identity, String category, String timestamp, String recordedAt) {
        return new UsageRecord(
                id,
                identity,
                Tier.BASIC,
                category,
                Instant.parse(timestamp),
                50,
                10,
                0,
                0.05,
                0,
                false,
                Instant.parse(recordedAt));
    }
}
