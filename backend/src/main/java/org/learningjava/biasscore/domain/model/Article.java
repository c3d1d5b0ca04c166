package org.learningjava.biasscore.domain.model;

/** The only article fields the scoring layer reads. */
public record Article(long id, String content) { }
