package com.flagship.cash_ledger.matching;

/**
 * One matching strategy over a tenant's graph.
 *
 * A pass only adds edges and raises exceptions; it never removes anything, so
 * running it again over unchanged state changes nothing.
 */
public interface Matcher {

    String name();

    MatcherReport run(MatchingContext context);
}
