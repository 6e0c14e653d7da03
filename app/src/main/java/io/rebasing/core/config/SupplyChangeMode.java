package io.rebasing.core.config;

import io.rebasing.core.supply.DerivedSupplyChange;
import io.rebasing.core.supply.NominalSupplyChange;
import io.rebasing.core.supply.SupplyChangeStrategy;

public enum SupplyChangeMode {
    /** Cache the supply derived back from the new multiplier. */
    DERIVED,
    /** Cache the requested supply. */
    NOMINAL;

    public SupplyChangeStrategy strategy() {
        return this == DERIVED ? new DerivedSupplyChange() : new NominalSupplyChange();
    }
}
