package com.flagship.cash_ledger.graph;

public enum EdgeOrigin {
    MATCHER,
    REVIEW
}
