package it.aw.collectionindex.index;

/**
 * Elemento di un sorted set: score e member da scrivere per una collection.
 */
public record IndexEntry(double score, String member) {}
