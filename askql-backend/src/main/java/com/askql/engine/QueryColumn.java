package com.askql.engine;

/**
 * Name and engine type of one result column.
 *
 * @param name column name
 * @param type engine-specific type name
 */
public record QueryColumn(String name, String type) {
}
