package com.specintel.core.model;

/**
 * Coverage of one domain category.
 *
 * @param category category name as declared by the domain
 * @param weight weight of the category in the coverage score
 * @param specificationCount live specifications in the category
 */
public record CategoryCoverage(
    String category,
    double weight,
    int specificationCount
) {
    /**
     * @return true if at least one live specification covers the category
     */
    public boolean covered() {
        return specificationCount > 0;
    }
}
