package com.product.curation.rules;

/**
 * Kind of value a normalization rule applies to.
 */
public enum NormalizationTarget {
    NAME,
    URL
}
