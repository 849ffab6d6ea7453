package com.bountyboard.progression.service;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerServiceImplTest {

    // H2：唯一索引冲突
    @Test
    void testIdempotencyKeyViolationIsDuplicate() {
        DataIntegrityViolationException e = new DataIntegrityViolationException("could not execute statement",
                new SQLException("Unique index or primary key violation: \"PUBLIC.UK_AWARD_IDEMPOTENCY_KEY_INDEX_3 "
                        + "ON PUBLIC.AWARD(IDEMPOTENCY_KEY NULLS FIRST) VALUES ( /* 1 */ 'abc' )\""));

        assertTrue(LedgerServiceImpl.isIdempotencyKeyViolation(e));
    }

    // MySQL：Duplicate entry
    @Test
    void testMysqlDuplicateEntryIsDuplicate() {
        DataIntegrityViolationException e = new DataIntegrityViolationException("could not execute statement",
                new SQLException("Duplicate entry 'abc' for key 'award.uk_award_idempotency_key'"));

        assertTrue(LedgerServiceImpl.isIdempotencyKeyViolation(e));
    }

    // 列宽溢出等其他完整性错误不能当成重复事件
    @Test
    void testOtherViolationsAreNotDuplicates() {
        DataIntegrityViolationException tooLong = new DataIntegrityViolationException("could not execute statement",
                new SQLException("Value too long for column \"SOURCE_REF CHARACTER VARYING(200)\""));
        DataIntegrityViolationException overflow = new DataIntegrityViolationException("could not execute statement",
                new SQLException("Numeric value out of range: \"100000000000000000000\""));
        DataIntegrityViolationException noMessage = new DataIntegrityViolationException(null);

        assertFalse(LedgerServiceImpl.isIdempotencyKeyViolation(tooLong));
        assertFalse(LedgerServiceImpl.isIdempotencyKeyViolation(overflow));
        assertFalse(LedgerServiceImpl.isIdempotencyKeyViolation(noMessage));
    }
}
