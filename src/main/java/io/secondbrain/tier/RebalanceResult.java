package io.secondbrain.tier;

/** Outcome of one tier sweep. */
public record RebalanceResult(int scanned, int promoted, int demoted) {
}
