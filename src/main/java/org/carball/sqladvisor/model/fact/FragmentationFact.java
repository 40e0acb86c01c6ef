package org.carball.sqladvisor.model.fact;

import lombok.Value;
import org.carball.sqladvisor.error.InvalidFactException;

/**
 * Average fragmentation of an index, as reported by
 * {@code sys.dm_db_index_physical_stats}, in percent.
 */
@Value
public class FragmentationFact implements AdvisoryFact {

    public static final String FRAGMENTATION_PERCENT = "fragmentationPercent";

    double fragmentationPercent;

    public static FragmentationFact of(double fragmentationPercent) {
        return new FragmentationFact(fragmentationPercent);
    }

    @Override
    public FactType getFactType() {
        return FactType.FRAGMENTATION;
    }

    @Override
    public Object attribute(String name) {
        if (FRAGMENTATION_PERCENT.equals(name)) {
            return fragmentationPercent;
        }
        throw new IllegalArgumentException("Unknown fragmentation attribute: " + name);
    }

    @Override
    public void validate() {
        // NaN fails both comparisons
        if (!(fragmentationPercent >= 0.0 && fragmentationPercent <= 100.0)) {
            throw new InvalidFactException(this, "fragmentationPercent must be within [0, 100]");
        }
    }
}
