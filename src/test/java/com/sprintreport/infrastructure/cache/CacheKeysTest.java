package com.sprintreport.infrastructure.cache;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeysTest {

    @Test
    void testKeyFormats() {
        assertEquals("sprint:44298:state", CacheKeys.sprintState("44298").getValue());
        assertEquals("sprint:44298:issues:all", CacheKeys.sprintIssues("44298").getValue());
        assertEquals("sprint:44298:metrics:summary", CacheKeys.sprintMetrics("44298").getValue());
        assertEquals("sprints:closed:6306", CacheKeys.closedSprints("6306").getValue());
        assertEquals("sprints:all:6306", CacheKeys.allSprints("6306").getValue());
        assertEquals("comprehensive:44298:acme:web", CacheKeys.comprehensive("44298", "acme", "web").getValue());
        assertEquals("analytics:velocity:6306:10", CacheKeys.velocity("6306", 10).getValue());
        assertEquals("analytics:team-performance:6306:10", CacheKeys.teamPerformance("6306", 10).getValue());
        assertEquals("analytics:issue-types:6306:6", CacheKeys.issueTypes("6306", 6).getValue());
        assertEquals("analytics:commit-trends:acme:web:6months",
                CacheKeys.commitTrends("acme", "web", "6months").getValue());
    }

    @Test
    void testRefreshMetadata_SharesPrefixOfItsKey() {
        CacheKey<?> metadata = CacheKeys.refreshMetadata(CacheKeys.velocity("6306", 10));

        assertEquals("analytics:velocity:6306:10:metadata", metadata.getValue());
        assertEquals(CacheNamespace.ANALYTICS, metadata.getNamespace());
    }

    @Test
    void testInvalidationPatterns_CoverEverySprintKey() {
        // Given
        List<Pattern> patterns = CacheKeys.sprintInvalidationPatterns("44298").stream()
                .map(KeyPatterns::compile)
                .toList();

        // Then
        List<String> covered = List.of(
                CacheKeys.sprintIssues("44298").getValue(),
                CacheKeys.refreshMetadata(CacheKeys.sprintIssues("44298")).getValue(),
                CacheKeys.sprintMetrics("44298").getValue(),
                CacheKeys.comprehensive("44298", "acme", "web").getValue(),
                CacheKeys.sprintState("44298").getValue());
        for (String key : covered) {
            assertTrue(patterns.stream().anyMatch(p -> p.matcher(key).matches()), key);
        }

        List<String> untouched = List.of(
                CacheKeys.sprintIssues("442980").getValue(),
                CacheKeys.sprintState("4429").getValue(),
                CacheKeys.velocity("44298", 10).getValue());
        for (String key : untouched) {
            assertTrue(patterns.stream().noneMatch(p -> p.matcher(key).matches()), key);
        }
    }

    @Test
    void testSegments_WithSeparatorOrGlobRejected() {
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.sprintIssues("1*"));
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.sprintState("1:2"));
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.sprintInvalidationPatterns("?"));
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.commitTrends("acme", "api:*", "3months"));
    }

    @Test
    void testBlankSegment_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.sprintState(" "));
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.velocity(null, 10));
    }

    @Test
    void testKeysEqualByRenderedValue() {
        assertEquals(CacheKeys.sprintState("1"), CacheKeys.sprintState(" 1 "));
        assertNotEquals(CacheKeys.sprintState("1"), CacheKeys.sprintState("2"));
    }
}
