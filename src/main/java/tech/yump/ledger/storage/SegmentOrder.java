package tech.yump.ledger.storage;

public enum SegmentOrder {
    OLDEST_FIRST,
    NEWEST_FIRST
}
