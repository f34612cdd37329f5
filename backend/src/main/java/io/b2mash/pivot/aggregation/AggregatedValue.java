package io.b2mash.pivot.aggregation;

/** The result of one value spec over one bucket, with the number of contributing rows. */
public record AggregatedValue(Number value, long rowCount) {}
