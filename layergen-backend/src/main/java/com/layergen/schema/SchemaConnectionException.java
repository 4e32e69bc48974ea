package com.layergen.schema;

/**
 * The schema source could not be reached or its catalog could not be read. Fatal to a run: it is
 * raised before any generated file is touched.
 */
public class SchemaConnectionException extends RuntimeException {
    public SchemaConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
