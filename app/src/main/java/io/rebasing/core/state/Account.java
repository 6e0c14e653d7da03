package io.rebasing.core.state;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Credit record of a single account.
 * {@code lockedCreditsPerToken} is non-null exactly when the account is non-rebasing.
 */
public record Account(BigInteger credits, boolean nonRebasing, BigInteger lockedCreditsPerToken) {

    /** State of an account that was never touched. */
    public static final Account EMPTY = new Account(BigInteger.ZERO, false, null);

    public Account {
        Objects.requireNonNull(credits, "credits");
        if (credits.signum() < 0) {
            throw new IllegalArgumentException("credits must be >= 0");
        }
        if (nonRebasing) {
            if (lockedCreditsPerToken == null || lockedCreditsPerToken.signum() <= 0) {
                throw new IllegalArgumentException("non-rebasing account needs a positive locked multiplier");
            }
        } else if (lockedCreditsPerToken != null) {
            throw new IllegalArgumentException("rebasing account cannot hold a locked multiplier");
        }
    }

    public static Account rebasing(BigInteger credits) {
        return new Account(credits, false, null);
    }

    public static Account nonRebasing(BigInteger credits, BigInteger lockedCreditsPerToken) {
        return new Account(credits, true, lockedCreditsPerToken);
    }

    public Account withCredits(BigInteger newCredits) {
        return new Account(newCredits, nonRebasing, lockedCreditsPerToken);
    }
}
