package org.learningjava.biasscore.domain.model;

public record AggregationResult(double score, double confidence) { }
