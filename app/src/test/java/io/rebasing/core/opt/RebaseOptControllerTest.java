package io.rebasing.core.opt;

import io.rebasing.core.config.LedgerConfig;
import io.rebasing.core.ledger.Ledger;
import io.rebasing.core.ledger.LedgerAuditor;
import io.rebasing.core.protocol.AccountView;
import io.rebasing.core.protocol.LedgerError;
import io.rebasing.core.protocol.LedgerResult;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RebaseOptControllerTest {

    @Test
    void optOutThenInWithoutRebaseRestoresTheAccount() {
        BigInteger awkward = new BigInteger("1300000000000000000");
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal().withInitialCreditsPerToken(awkward));
        ledger.mint("A", BigInteger.TEN);
        ledger.mint("B", BigInteger.valueOf(5));
        BigInteger credits = ledger.creditsBalanceOf("A").credits();
        assertEquals(BigInteger.valueOf(13), credits);

        AccountView out = ledger.optOut("A").value();
        assertTrue(out.nonRebasing());
        assertEquals(BigInteger.TEN, out.balance());
        assertEquals(awkward, ledger.creditsBalanceOf("A").creditsPerToken());
        assertEquals(BigInteger.TEN, ledger.nonRebasingSupply());

        AccountView in = ledger.optIn("A").value();
        assertFalse(in.nonRebasing());
        assertEquals(BigInteger.TEN, in.balance());
        assertEquals(credits, ledger.creditsBalanceOf("A").credits());
        assertEquals(BigInteger.ZERO, ledger.nonRebasingSupply());
        assertEquals(BigInteger.valueOf(15), ledger.totalSupply());
    }

    @Test
    void repeatedOptChangesAreRejected() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("A", BigInteger.TEN);

        assertEquals(LedgerError.ALREADY_IN_STATE, ledger.optIn("A").error());
        assertTrue(ledger.optOut("A").isOk());
        LedgerResult<AccountView> again = ledger.optOut("A");
        assertEquals(LedgerError.ALREADY_IN_STATE, again.error());
        assertTrue(ledger.isNonRebasing("A"));
    }

    @Test
    void nonRebasingBalanceIgnoresSupplyChanges() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("A", BigInteger.valueOf(100));
        ledger.mint("B", BigInteger.valueOf(100));
        ledger.optOut("A");

        assertEquals(new BigInteger("497512437810945273"), ledger.changeSupply(BigInteger.valueOf(301)).value());

        assertEquals(BigInteger.valueOf(100), ledger.balanceOf("A"));
        assertEquals(BigInteger.valueOf(201), ledger.balanceOf("B"));
        assertEquals(BigInteger.valueOf(301), ledger.totalSupply());
    }

    @Test
    void optInAfterRebaseReexpressesCreditsAndAdjustsSupply() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("A", BigInteger.valueOf(100));
        ledger.mint("B", BigInteger.valueOf(100));
        ledger.optOut("A");
        ledger.changeSupply(BigInteger.valueOf(301));

        AccountView view = ledger.optIn("A").value();

        assertEquals(BigInteger.valueOf(98), view.balance());
        assertEquals(BigInteger.valueOf(49), ledger.creditsBalanceOf("A").credits());
        assertEquals(BigInteger.ZERO, ledger.nonRebasingSupply());
        assertEquals(BigInteger.valueOf(149), ledger.rebasingCredits());
        assertEquals(BigInteger.valueOf(299), ledger.totalSupply());
        assertTrue(LedgerAuditor.audit(ledger).balanced());
    }

    @Test
    void optOutOfUnknownAccountCreatesEmptyFrozenAccount() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());

        AccountView view = ledger.optOut("ghost").value();

        assertEquals(BigInteger.ZERO, view.balance());
        assertTrue(ledger.isNonRebasing("ghost"));
        assertEquals(BigInteger.ZERO, ledger.totalSupply());
    }
}
