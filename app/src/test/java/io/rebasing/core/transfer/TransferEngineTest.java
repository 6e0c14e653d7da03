package io.rebasing.core.transfer;

import io.rebasing.core.config.BurnMode;
import io.rebasing.core.config.LedgerConfig;
import io.rebasing.core.config.SupplyChangeMode;
import io.rebasing.core.config.TransferRoundingMode;
import io.rebasing.core.ledger.Ledger;
import io.rebasing.core.ledger.LedgerAuditor;
import io.rebasing.core.math.FixedPointMath;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerResult;
import io.rebasing.core.protocol.TransferReceipt;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class TransferEngineTest {

    private static final BigInteger HALF = FixedPointMath.PRECISION.divide(BigInteger.TWO);

    /** A opted out at 1.0, B rebasing at 0.5 after the supply doubled from 200 to 300. */
    private static Ledger mixedMultipliers(TransferRoundingMode rounding) {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal()
                .withModes(SupplyChangeMode.DERIVED, rounding, BurnMode.STRICT));
        ledger.mint("A", BigInteger.valueOf(100));
        ledger.optOut("A");
        ledger.mint("B", BigInteger.valueOf(100));
        assertEquals(HALF, ledger.changeSupply(BigInteger.valueOf(300)).value());
        assertEquals(BigInteger.valueOf(200), ledger.balanceOf("B"));
        assertEquals(BigInteger.valueOf(300), ledger.totalSupply());
        return ledger;
    }

    @Test
    void transferBetweenEqualMultipliersIsSymmetric() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("A", BigInteger.valueOf(500));
        ledger.mint("B", BigInteger.valueOf(500));
        ledger.changeSupply(BigInteger.valueOf(2_000));
        assertEquals(BigInteger.valueOf(1_000), ledger.balanceOf("A"));

        LedgerResult<TransferReceipt> result = ledger.transfer("A", "B", BigInteger.valueOf(250));

        assertTrue(result.isOk());
        assertEquals(BigInteger.valueOf(750), result.value().fromBalance());
        assertEquals(BigInteger.valueOf(1_250), result.value().toBalance());
        assertTrue(LedgerAuditor.audit(ledger).balanced());
    }

    @Test
    void oddAmountAtHalfMultiplierLosesAUnitOnTheSender() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("A", BigInteger.valueOf(500));
        ledger.mint("B", BigInteger.valueOf(500));
        ledger.changeSupply(BigInteger.valueOf(2_000));

        TransferReceipt receipt = ledger.transfer("A", "B", BigInteger.valueOf(3)).value();

        assertEquals(BigInteger.valueOf(998), receipt.fromBalance());
        assertEquals(BigInteger.valueOf(1_002), receipt.toBalance());
    }

    @Test
    void derivedRoundingCreditsWhatWasDebitedIntoFinerSide() {
        Ledger ledger = mixedMultipliers(TransferRoundingMode.DERIVED_SIDE);

        TransferReceipt receipt = ledger.transfer("B", "A", BigInteger.valueOf(3)).value();

        assertEquals(BigInteger.valueOf(198), receipt.fromBalance());
        assertEquals(BigInteger.valueOf(102), receipt.toBalance());
        assertEquals(BigInteger.valueOf(102), ledger.nonRebasingSupply());
        assertTrue(LedgerAuditor.audit(ledger).balanced());
    }

    @Test
    void independentRoundingCreatesAUnit() {
        Ledger ledger = mixedMultipliers(TransferRoundingMode.INDEPENDENT);

        TransferReceipt receipt = ledger.transfer("B", "A", BigInteger.valueOf(3)).value();

        assertEquals(BigInteger.valueOf(198), receipt.fromBalance());
        assertEquals(BigInteger.valueOf(103), receipt.toBalance());
        assertEquals(BigInteger.ONE.negate(), LedgerAuditor.audit(ledger).drift());
    }

    @Test
    void derivedRoundingDebitsOnlyWhatTheCoarseSideReceives() {
        Ledger derived = mixedMultipliers(TransferRoundingMode.DERIVED_SIDE);
        TransferReceipt d = derived.transfer("A", "B", BigInteger.valueOf(3)).value();
        assertEquals(BigInteger.valueOf(98), d.fromBalance());
        assertEquals(BigInteger.valueOf(202), d.toBalance());
        assertEquals(BigInteger.valueOf(98), derived.nonRebasingSupply());

        Ledger independent = mixedMultipliers(TransferRoundingMode.INDEPENDENT);
        TransferReceipt i = independent.transfer("A", "B", BigInteger.valueOf(3)).value();
        assertEquals(BigInteger.valueOf(97), i.fromBalance());
        assertEquals(BigInteger.valueOf(202), i.toBalance());
    }

    @Test
    void transferMoreThanBalanceIsRejected() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("A", BigInteger.TEN);

        LedgerResult<TransferReceipt> result = ledger.transfer("A", "B", BigInteger.valueOf(11));

        assertEquals(LedgerError.INSUFFICIENT_BALANCE, result.error());
        assertEquals(BigInteger.TEN, ledger.balanceOf("A"));
        assertFalse(ledger.accountIds().contains("B"));
    }

    @Test
    void selfTransferKeepsTheBalance() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("A", BigInteger.TEN);

        TransferReceipt receipt = ledger.transfer("A", "A", BigInteger.valueOf(4)).value();

        assertEquals(BigInteger.TEN, receipt.fromBalance());
        assertEquals(BigInteger.TEN, receipt.toBalance());
        assertEquals(BigInteger.TEN, ledger.rebasingCredits());
    }

    @Test
    void strategiesPlanTheSameMovementForEqualMultipliers() {
        BigInteger amount = BigInteger.valueOf(7);
        CreditMovement derived = new DerivedSideRounding().plan(amount, HALF, HALF);
        CreditMovement independent = new IndependentRounding().plan(amount, HALF, HALF);
        assertEquals(derived, independent);
        assertEquals(BigInteger.valueOf(3), derived.deducted());
    }
}
