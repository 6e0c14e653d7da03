package io.rebasing.core.storage;

import io.rebasing.core.state.Account;
import io.rebasing.core.state.GlobalState;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Binary encoding of ledger records: a version byte followed by length-prefixed two's-complement
 * big integers.
 */
public final class LedgerCodec {
    private LedgerCodec(){}

    private static final byte VERSION = 1;

    public static byte[] encodeAccount(Account account) {
        byte[] credits = account.credits().toByteArray();
        byte[] locked = account.nonRebasing() ? account.lockedCreditsPerToken().toByteArray() : new byte[0];
        ByteBuffer buf = ByteBuffer.allocate(1 + 1 + 4 + credits.length + 4 + locked.length);
        buf.put(VERSION);
        buf.put((byte) (account.nonRebasing() ? 1 : 0));
        putBytes(buf, credits);
        putBytes(buf, locked);
        return buf.array();
    }

    public static Account decodeAccount(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            checkVersion(buf.get());
            boolean nonRebasing = buf.get() == 1;
            BigInteger credits = new BigInteger(readBytes(buf));
            byte[] locked = readBytes(buf);
            return nonRebasing
                    ? Account.nonRebasing(credits, new BigInteger(locked))
                    : Account.rebasing(credits);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Account bytes", ex);
        }
    }

    public static byte[] encodeGlobal(GlobalState g) {
        byte[][] fields = {
                g.rebasingCredits().toByteArray(),
                g.rebasingCreditsPerToken().toByteArray(),
                g.nonRebasingSupply().toByteArray(),
                g.totalSupply().toByteArray(),
                g.roundingErrorAccumulator().toByteArray()
        };
        int size = 1;
        for (byte[] f : fields) size += 4 + f.length;
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put(VERSION);
        for (byte[] f : fields) putBytes(buf, f);
        return buf.array();
    }

    public static GlobalState decodeGlobal(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            checkVersion(buf.get());
            return new GlobalState(
                    new BigInteger(readBytes(buf)),
                    new BigInteger(readBytes(buf)),
                    new BigInteger(readBytes(buf)),
                    new BigInteger(readBytes(buf)),
                    new BigInteger(readBytes(buf)));
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed GlobalState bytes", ex);
        }
    }

    private static void checkVersion(byte version) {
        if (version != VERSION) {
            throw new IllegalArgumentException("Unsupported record version: " + version);
        }
    }

    private static void putBytes(ByteBuffer buf, byte[] b) {
        buf.putInt(b.length);
        buf.put(b);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
