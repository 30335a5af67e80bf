package com.hdltree;

import java.util.List;

/**
 * Two or more derivations of the same span survived every tie-break rule.
 */
public class AmbiguityException extends ParseException {

    private final List<String> productionIds;

    public AmbiguityException(String message, Span span, List<String> productionIds) {
        super(message + " " + productionIds, span);
        this.productionIds = List.copyOf(productionIds);
    }

    public List<String> getProductionIds() {
        return productionIds;
    }
}
