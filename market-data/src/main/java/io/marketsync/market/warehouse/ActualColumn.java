package io.marketsync.market.warehouse;

/** A column as reported by the database metadata. */
public record ActualColumn(String name, int jdbcType, String typeName) {}
