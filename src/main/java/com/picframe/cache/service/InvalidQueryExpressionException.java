package com.picframe.cache.service;

public class InvalidQueryExpressionException extends RuntimeException {
    /**
     * Creates an exception describing a rejected filter or sort expression.
     */
    public InvalidQueryExpressionException(String m) { super(m); }
}
