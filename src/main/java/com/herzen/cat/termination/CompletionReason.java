package com.herzen.cat.termination;

public enum CompletionReason {
    MAX_ITEMS,
    TARGET_STANDARD_ERROR,
    MASTERY,
    STALLED,
    POOL_EXHAUSTED
}
