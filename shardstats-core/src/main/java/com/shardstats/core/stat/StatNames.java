package com.shardstats.core.stat;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

final class StatNames {

    private StatNames() {}

    static Set<String> aliases(String statName, String... shortNames) {
        Set<String> names = new LinkedHashSet<>();
        names.add(statName);
        Collections.addAll(names, shortNames);
        return Collections.unmodifiableSet(names);
    }
}
