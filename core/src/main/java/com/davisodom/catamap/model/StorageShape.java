package com.davisodom.catamap.model;

/**
 * How a content category keeps its definitions.
 */
public enum StorageShape {
    
    /** Keyed by id (or abstract id); later loads replace earlier ones. Takes part in copy-from resolution. */
    INDEXED,
    
    /** Append-only list; ids are ignored and nothing is resolved. */
    SEQUENTIAL
}
