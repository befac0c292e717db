package com.davisodom.catamap.overmap;

/**
 * Thrown when content required for resolution was never loaded.
 */
public class MissingCategoryException extends RuntimeException {
    
    private final String category;
    
    public MissingCategoryException(String category) {
        super(category + " not loaded");
        this.category = category;
    }
    
    public String getCategory() {
        return category;
    }
}
