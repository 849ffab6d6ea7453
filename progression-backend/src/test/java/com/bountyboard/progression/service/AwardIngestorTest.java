package com.bountyboard.progression.service;

import com.bountyboard.progression.dto.AwardEventDTO;
import com.bountyboard.progression.entity.ActionKind;
import com.bountyboard.progression.entity.Award;
import com.bountyboard.progression.entity.Tier;
import com.bountyboard.progression.exception.DuplicateEventException;
import com.bountyboard.progression.exception.InvalidAwardEventException;
import com.bountyboard.progression.exception.UnknownActionKindException;
import com.bountyboard.progression.repository.AwardRepository;
import com.bountyboard.progression.support.TestFixtures;
import com.bountyboard.progression.util.IdempotencyKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AwardIngestorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private AwardRepository awardRepository;

    private AwardIngestor ingestor;

    @BeforeEach
    void setUp() {
        ingestor = new AwardIngestor(TestFixtures.defaultTables(), awardRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AwardEventDTO event(String hunter, String kind, String amount, String source) {
        return AwardEventDTO.builder()
                .hunterId(hunter)
                .actionKind(kind)
                .referenceAmount(amount)
                .sourceRef(source)
                .build();
    }

    @Test
    void testStandardMergeIsClassifiedAndScored() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);

        Award award = ingestor.ingest(event("@Alice", "pr-merged", "25 RTC", " repo#12 "), false);

        assertEquals("alice", award.getHunterId());
        assertEquals(ActionKind.PR_MERGED, award.getActionKind());
        assertEquals(Tier.STANDARD, award.getTier());
        assertEquals(100, award.getXpAmount());
        assertEquals(0, new BigDecimal("25").compareTo(award.getReferenceAmount()));
        assertEquals("repo#12", award.getSourceRef());
        assertEquals("PR merged, standard tier", award.getReason());
        assertFalse(award.isDegraded());
        assertFalse(award.isBackfilled());
        // 实时事件默认使用当前时钟
        assertEquals(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC), award.getOccurredTime());
        assertEquals(IdempotencyKeys.compute("alice", ActionKind.PR_MERGED, "repo#12"), award.getIdempotencyKey());
        assertNull(award.getAwardId());
    }

    @Test
    void testUpperCaseActionNameIsAccepted() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);

        Award award = ingestor.ingest(event("bob", "PR_SUBMITTED", "150", "repo#3"), false);

        assertEquals(Tier.CRITICAL, award.getTier());
        assertEquals(300, award.getXpAmount());
    }

    @Test
    void testMalformedAmountIsDegradedNotRejected() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);

        Award award = ingestor.ingest(event("bob", "pr-merged", "a lot", "repo#4"), false);

        assertTrue(award.isDegraded());
        assertEquals(Tier.MICRO, award.getTier());
        assertEquals(100, award.getXpAmount());
        assertNull(award.getReferenceAmount());
        assertTrue(award.getReason().contains("unverified"));
    }

    @Test
    void testMissingAndNegativeAmountsAreDegraded() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);

        assertTrue(ingestor.ingest(event("bob", "pr-submitted", null, "repo#5"), false).isDegraded());
        assertTrue(ingestor.ingest(event("bob", "pr-submitted", "-3", "repo#6"), false).isDegraded());
    }

    @Test
    void testAmountBeyondColumnRangeIsDegraded() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);

        Award huge = ingestor.ingest(event("bob", "pr-merged", "1e20", "repo#10"), false);
        assertTrue(huge.isDegraded());
        assertEquals(Tier.MICRO, huge.getTier());
        assertNull(huge.getReferenceAmount());

        // 14 位整数仍可保存
        Award large = ingestor.ingest(event("bob", "pr-merged", "99999999999999", "repo#11"), false);
        assertFalse(large.isDegraded());
        assertEquals(Tier.CRITICAL, large.getTier());
    }

    @Test
    void testExtraDecimalsAreRounded() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);

        Award award = ingestor.ingest(event("bob", "pr-submitted", "10.00004", "repo#12"), false);

        assertEquals(new BigDecimal("10.0000"), award.getReferenceAmount());
        assertEquals(Tier.MICRO, award.getTier());
        assertFalse(award.isDegraded());
    }

    @Test
    void testOversizeFieldsAreInvalid() {
        String longSource = "https://github.com/org/repo/pull/1?" + "x".repeat(200);
        assertThatThrownBy(() -> ingestor.ingest(event("erin", "claim", null, longSource), false))
                .isInstanceOf(InvalidAwardEventException.class)
                .hasMessageContaining("sourceRef");

        assertThatThrownBy(() -> ingestor.ingest(event("h".repeat(101), "claim", null, "repo#1"), false))
                .isInstanceOf(InvalidAwardEventException.class)
                .hasMessageContaining("hunterId");

        AwardEventDTO longKey = event("erin", "claim", null, "repo#1");
        longKey.setIdempotencyKey("k".repeat(129));
        assertThatThrownBy(() -> ingestor.ingest(longKey, false))
                .isInstanceOf(InvalidAwardEventException.class)
                .hasMessageContaining("idempotencyKey");

        AwardEventDTO longWallet = event("erin", "claim", null, "repo#1");
        longWallet.setWalletRef("w".repeat(201));
        assertThatThrownBy(() -> ingestor.ingest(longWallet, false))
                .isInstanceOf(InvalidAwardEventException.class)
                .hasMessageContaining("walletRef");

        verifyNoInteractions(awardRepository);
    }

    @Test
    void testFieldsAtColumnWidthAreAccepted() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);
        AwardEventDTO event = event("@" + "h".repeat(100), "claim", null, "s".repeat(200));
        event.setIdempotencyKey("k".repeat(128));

        Award award = ingestor.ingest(event, false);

        assertEquals(100, award.getHunterId().length());
        assertEquals(200, award.getSourceRef().length());
    }

    @Test
    void testFlatActionIgnoresAmount() {
        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);

        Award award = ingestor.ingest(event("carol", "tutorial-accepted", "garbage", "docs#1"), false);

        assertFalse(award.isDegraded());
        assertNull(award.getTier());
        assertEquals(150, award.getXpAmount());
    }

    @Test
    void testUnknownActionKindIsRejected() {
        assertThatThrownBy(() -> ingestor.ingest(event("carol", "code-review", null, "repo#7"), false))
                .isInstanceOf(UnknownActionKindException.class)
                .hasMessageContaining("code-review");
        verifyNoInteractions(awardRepository);
    }

    @Test
    void testDuplicateKeyIsRejected() {
        String key = IdempotencyKeys.compute("carol", ActionKind.CLAIM, "repo#8");
        when(awardRepository.existsByIdempotencyKey(key)).thenReturn(true);

        DuplicateEventException e = assertThrows(DuplicateEventException.class,
                () -> ingestor.ingest(event("Carol", "claim", null, "repo#8"), false));
        assertEquals("repo#8", e.getSourceRef());
        assertEquals(key, e.getIdempotencyKey());
    }

    @Test
    void testSuppliedIdempotencyKeyIsUsed() {
        when(awardRepository.existsByIdempotencyKey("delivery-42")).thenReturn(false);
        AwardEventDTO event = event("dave", "claim", null, "repo#9");
        event.setIdempotencyKey("delivery-42");

        assertEquals("delivery-42", ingestor.ingest(event, false).getIdempotencyKey());
    }

    @Test
    void testMissingFieldsAreInvalid() {
        assertThrows(InvalidAwardEventException.class, () -> ingestor.ingest(event(" @ ", "claim", null, "repo#1"), false));
        assertThrows(InvalidAwardEventException.class, () -> ingestor.ingest(event("dave", "claim", null, "  "), false));
        assertThrows(InvalidAwardEventException.class, () -> ingestor.ingest(null, false));
    }

    @Test
    void testBackfillRequiresTimestamp() {
        assertThrows(InvalidAwardEventException.class, () -> ingestor.ingest(event("dave", "claim", null, "repo#1"), true));

        when(awardRepository.existsByIdempotencyKey(anyString())).thenReturn(false);
        AwardEventDTO event = event("dave", "claim", null, "repo#1");
        event.setTimestamp(LocalDateTime.of(2023, 1, 10, 8, 0));
        Award award = ingestor.ingest(event, true);

        assertTrue(award.isBackfilled());
        assertEquals(LocalDateTime.of(2023, 1, 10, 8, 0), award.getOccurredTime());
    }

    @Test
    void testParseAmount() {
        assertEquals(0, new BigDecimal("12.5").compareTo(AwardIngestor.parseAmount(" 12.5 rtc ")));
        assertNull(AwardIngestor.parseAmount("RTC"));
        assertNull(AwardIngestor.parseAmount("ten"));
    }
}
