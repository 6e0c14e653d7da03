package io.rebasing.core.config;

import io.rebasing.core.issuance.BurnPolicy;
import io.rebasing.core.issuance.NaiveBurnPolicy;
import io.rebasing.core.issuance.StrictBurnPolicy;

public enum BurnMode {
    /** Reject burns that remove no credits. */
    STRICT,
    NAIVE;

    public BurnPolicy policy() {
        return this == STRICT ? new StrictBurnPolicy() : new NaiveBurnPolicy();
    }
}
