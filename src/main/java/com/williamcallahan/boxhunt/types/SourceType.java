package com.williamcallahan.boxhunt.types;

/**
 * Variants of source client, for call sites that branch on variant-specific configuration
 */
public enum SourceType {
    /**
     * One authenticated search request per query against a provider API
     */
    KEYWORD_API,

    /**
     * Breadth-first traversal of a website
     */
    WEBSITE
}
