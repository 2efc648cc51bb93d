package com.shardstats.core.stat;

import java.util.Set;

/**
 * A statically known stat field. Implemented by the stat table enums; the enum ordinal is the field's index inside
 * its block.
 */
public interface StatDefinition {

    /** Primary name, as reported to callers. */
    String statName();

    /** Every name the field answers to, including {@link #statName()}. Matching is exact and case-sensitive. */
    Set<String> aliases();

    int ordinal();
}
