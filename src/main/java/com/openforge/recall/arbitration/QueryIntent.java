package com.openforge.recall.arbitration;

import java.util.Locale;

/** What kind of answer a query is after. */
public enum QueryIntent {
    /** A stored fact or event. The default. */
    FACT,
    /** A procedure: steps, instructions, a way to do something. */
    HOW,
    /** A reason or cause. */
    WHY;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
