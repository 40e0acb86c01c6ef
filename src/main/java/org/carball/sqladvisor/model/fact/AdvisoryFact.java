package org.carball.sqladvisor.model.fact;

/**
 * A caller-declared description the rule engine reasons over. Attribute values
 * are exposed as {@link Boolean}, {@link Number} or, for enumerated attributes,
 * the constant's name.
 */
public interface AdvisoryFact {

    FactType getFactType();

    Object attribute(String name);

    /**
     * Checks the fact's own domain constraints.
     *
     * @throws org.carball.sqladvisor.error.InvalidFactException if a value is out of domain
     */
    void validate();
}
