package org.carball.sqladvisor.model.fact;

import lombok.Builder;
import lombok.Value;
import org.carball.sqladvisor.error.InvalidFactException;

/**
 * Declared shape of a query fragment, used to pick a T-SQL construct.
 * {@code relationOptional} marks that rows of the related set may be absent
 * and the outer row must still be returned.
 */
@Value
@Builder(toBuilder = true)
public class QueryShapeFact implements AdvisoryFact {

    public static final String NEEDS_RECURSION = "needsRecursion";
    public static final String IS_CORRELATED = "isCorrelated";
    public static final String INVOKES_TVF = "invokesTableValuedFunction";
    public static final String REUSE_COUNT = "reuseCount";
    public static final String CARDINALITY_HINT = "resultCardinalityHint";
    public static final String RELATION_OPTIONAL = "relationOptional";

    boolean needsRecursion;
    boolean correlated;
    boolean invokesTableValuedFunction;
    int reuseCount;
    CardinalityHint resultCardinalityHint;
    boolean relationOptional;

    @Override
    public FactType getFactType() {
        return FactType.QUERY_SHAPE;
    }

    @Override
    public Object attribute(String name) {
        switch (name) {
            case NEEDS_RECURSION:
                return needsRecursion;
            case IS_CORRELATED:
                return correlated;
            case INVOKES_TVF:
                return invokesTableValuedFunction;
            case REUSE_COUNT:
                return reuseCount;
            case CARDINALITY_HINT:
                return resultCardinalityHint == null ? null : resultCardinalityHint.name();
            case RELATION_OPTIONAL:
                return relationOptional;
            default:
                throw new IllegalArgumentException("Unknown query shape attribute: " + name);
        }
    }

    @Override
    public void validate() {
        if (reuseCount < 0) {
            throw new InvalidFactException(this, "reuseCount must not be negative");
        }
        if (resultCardinalityHint == null) {
            throw new InvalidFactException(this, "resultCardinalityHint is required");
        }
    }
}
