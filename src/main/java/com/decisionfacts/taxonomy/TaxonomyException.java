package com.decisionfacts.taxonomy;

/**
 * Thrown while a taxonomy is being built when one of its entries is malformed.
 * A taxonomy that fails to build must stop the application from starting.
 */
public class TaxonomyException extends RuntimeException {

    public TaxonomyException(String message) {
        super(message);
    }

    public TaxonomyException(String message, Throwable cause) {
        super(message, cause);
    }
}
