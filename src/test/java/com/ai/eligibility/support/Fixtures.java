package com.ai.eligibility.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public final class Fixtures {

    /** 2026-03-15T10:00:00Z */
    public static final Clock CLOCK_2026 = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {
    }
}
