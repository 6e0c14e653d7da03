package io.rebasing.core.config;

import io.rebasing.core.transfer.DerivedSideRounding;
import io.rebasing.core.transfer.IndependentRounding;
import io.rebasing.core.transfer.TransferRoundingStrategy;

public enum TransferRoundingMode {
    DERIVED_SIDE,
    INDEPENDENT;

    public TransferRoundingStrategy strategy() {
        return this == DERIVED_SIDE ? new DerivedSideRounding() : new IndependentRounding();
    }
}
