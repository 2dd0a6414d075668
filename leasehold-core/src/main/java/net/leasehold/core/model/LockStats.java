package net.leasehold.core.model;

public record LockStats(long acquired, long released, long expired) {
    public long total() { return acquired + released + expired; }
}
