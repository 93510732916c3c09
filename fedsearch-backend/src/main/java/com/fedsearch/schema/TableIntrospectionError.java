package com.fedsearch.schema;

/**
 * A table omitted from a snapshot because it could not be introspected.
 *
 * @param table table name
 * @param reason failure message
 */
public record TableIntrospectionError(String table, String reason) {
}
