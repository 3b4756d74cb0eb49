package com.herzen.cat.analytics;

import java.util.Set;

public final class LearningEventTypes {
    public static final String SESSION_START = "session_start";
    public static final String ITEM_PRESENTED = "item_presented";
    public static final String RESPONSE_RECORDED = "response_recorded";
    public static final String SESSION_COMPLETE = "session_complete";

    public static final Set<String> SUPPORTED = Set.of(
            SESSION_START,
            ITEM_PRESENTED,
            RESPONSE_RECORDED,
            SESSION_COMPLETE
    );

    private LearningEventTypes() {}
}
