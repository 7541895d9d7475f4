package com.flagship.practice_ledger.journal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostingLocksTest {

    @Test
    void lockKeyIsStableAndScoped() {
        long key = PostingLocks.lockKey(7L, "source:invoice", "42");

        assertEquals(key, PostingLocks.lockKey(7L, "source:invoice", "42"));
        assertNotEquals(key, PostingLocks.lockKey(8L, "source:invoice", "42"));
        assertNotEquals(key, PostingLocks.lockKey(7L, "source:payment", "42"));
        assertNotEquals(key, PostingLocks.lockKey(7L, "source:invoice", "43"));
    }
}
