package com.pgost.migration.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Correspondence between source columns and shadow columns.
 * Same-named columns map to each other. When exactly one source column and one shadow column
 * are left unmatched, they are taken to be a rename. Any other unmatched source column is dropped
 * and unmatched shadow columns are left to their defaults.
 */
public class ColumnMap {
    
    private final List<Mapping> mappings;
    
    private ColumnMap(List<Mapping> mappings) {
        this.mappings = Collections.unmodifiableList(mappings);
    }
    
    /**
     * Column map for a source table without generated columns.
     */
    public static ColumnMap between(List<String> sourceColumns, List<String> shadowColumns) {
        return between(sourceColumns, shadowColumns, Collections.emptySet());
    }
    
    /**
     * @param sourceColumns columns of the source table in ordinal order
     * @param shadowColumns writable (non-generated) columns of the shadow table
     * @param generatedSourceColumns source columns computed by the server; they are copied by name only
     *                               and never taken as one side of a rename
     */
    public static ColumnMap between(List<String> sourceColumns, List<String> shadowColumns,
                                    Collection<String> generatedSourceColumns) {
        List<String> unmatchedSource = sourceColumns.stream()
            .filter(column -> !shadowColumns.contains(column))
            .filter(column -> !generatedSourceColumns.contains(column))
            .collect(Collectors.toList());
        List<String> unmatchedShadow = shadowColumns.stream()
            .filter(column -> !sourceColumns.contains(column))
            .collect(Collectors.toList());
        boolean singleRename = unmatchedSource.size() == 1 && unmatchedShadow.size() == 1;
        
        List<Mapping> mappings = new ArrayList<>();
        for (String sourceColumn : sourceColumns) {
            if (shadowColumns.contains(sourceColumn)) {
                mappings.add(new Mapping(sourceColumn, sourceColumn));
            } else if (singleRename && unmatchedSource.get(0).equals(sourceColumn)) {
                mappings.add(new Mapping(sourceColumn, unmatchedShadow.get(0)));
            } else {
                mappings.add(new Mapping(sourceColumn, null));
            }
        }
        return new ColumnMap(mappings);
    }
    
    /**
     * Source columns that are copied, in the same order as {@link #shadowColumns()}.
     */
    public List<String> sourceColumns() {
        return mappings.stream()
            .filter(Mapping::isCopied)
            .map(Mapping::getSourceColumn)
            .collect(Collectors.toList());
    }
    
    public List<String> shadowColumns() {
        return mappings.stream()
            .filter(Mapping::isCopied)
            .map(Mapping::getShadowColumn)
            .collect(Collectors.toList());
    }
    
    public List<String> droppedColumns() {
        return mappings.stream()
            .filter(mapping -> !mapping.isCopied())
            .map(Mapping::getSourceColumn)
            .collect(Collectors.toList());
    }
    
    /**
     * Shadow column receiving the given source column, or null when it is dropped.
     */
    public String shadowColumnFor(String sourceColumn) {
        return mappings.stream()
            .filter(mapping -> mapping.getSourceColumn().equals(sourceColumn))
            .map(Mapping::getShadowColumn)
            .findFirst()
            .orElse(null);
    }
    
    /**
     * Quoted, comma-separated shadow column list for INSERT targets.
     */
    public String shadowColumnList() {
        return shadowColumns().stream().map(TableName::quote).collect(Collectors.joining(", "));
    }
    
    /**
     * Quoted, comma-separated source column list for SELECTs, optionally qualified by an alias.
     */
    public String sourceColumnList(String alias) {
        String prefix = alias == null ? "" : alias + ".";
        return sourceColumns().stream().map(column -> prefix + TableName.quote(column)).collect(Collectors.joining(", "));
    }
    
    @Override
    public String toString() {
        return mappings.toString();
    }
    
    @Value
    public static class Mapping {
        String sourceColumn;
        String shadowColumn;
        
        public boolean isCopied() {
            return shadowColumn != null;
        }
        
        @Override
        public String toString() {
            return sourceColumn + "->" + (shadowColumn == null ? "(dropped)" : shadowColumn);
        }
    }
}
