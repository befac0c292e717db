package com.davisodom.catamap.overmap;

import java.io.IOException;

/**
 * A save tile file that cannot be decoded.
 */
public class TileFormatException extends IOException {
    
    public TileFormatException(String message) {
        super(message);
    }
    
    public TileFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
