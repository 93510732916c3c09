package com.fedsearch.sql;

import com.fedsearch.schema.SchemaSnapshot;
import com.fedsearch.schema.TableMatch;

import java.util.List;

/**
 * Input to a generation strategy: the question and the schema context it may use.
 *
 * @param nlQuery natural-language query
 * @param connectionId target connection
 * @param dialect target dialect name
 * @param matches relevant tables, best first; never empty
 * @param snapshot full schema snapshot
 */
public record GenerationContext(String nlQuery,
                                String connectionId,
                                String dialect,
                                List<TableMatch> matches,
                                SchemaSnapshot snapshot) {
}
