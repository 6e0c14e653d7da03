package io.rebasing.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rebasing.core.math.FixedPointMath;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/** Construction-time settings of a ledger: starting multiplier, supply cap and rounding variants. */
public final class LedgerConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    /** Cap on total supply: 2^128 - 1. */
    public static final BigInteger DEFAULT_MAX_SUPPLY = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    public final BigInteger initialCreditsPerToken;
    public final BigInteger maxSupply;
    public final SupplyChangeMode supplyChangeMode;
    public final TransferRoundingMode transferRoundingMode;
    public final BurnMode burnMode;
    public final boolean trackRoundingError;

    public LedgerConfig(BigInteger initialCreditsPerToken,
                        BigInteger maxSupply,
                        SupplyChangeMode supplyChangeMode,
                        TransferRoundingMode transferRoundingMode,
                        BurnMode burnMode,
                        boolean trackRoundingError) {
        Objects.requireNonNull(initialCreditsPerToken, "initialCreditsPerToken");
        Objects.requireNonNull(maxSupply, "maxSupply");
        if (initialCreditsPerToken.signum() <= 0) {
            throw new IllegalArgumentException("initialCreditsPerToken must be > 0");
        }
        if (maxSupply.signum() <= 0 || maxSupply.compareTo(FixedPointMath.MAX_UINT256) > 0) {
            throw new IllegalArgumentException("maxSupply must be in (0, 2^256)");
        }
        this.initialCreditsPerToken = initialCreditsPerToken;
        this.maxSupply = maxSupply;
        this.supplyChangeMode = Objects.requireNonNull(supplyChangeMode, "supplyChangeMode");
        this.transferRoundingMode = Objects.requireNonNull(transferRoundingMode, "transferRoundingMode");
        this.burnMode = Objects.requireNonNull(burnMode, "burnMode");
        this.trackRoundingError = trackRoundingError;
    }

    /** Improved rounding everywhere, multiplier 1.0, tracking off. */
    public static LedgerConfig defaultLocal() {
        return new LedgerConfig(
                FixedPointMath.PRECISION,   // one credit per token
                DEFAULT_MAX_SUPPLY,
                SupplyChangeMode.DERIVED,
                TransferRoundingMode.DERIVED_SIDE,
                BurnMode.STRICT,
                false
        );
    }

    /** The behaviour before the rounding fixes, kept for side-by-side comparison. */
    public static LedgerConfig historical() {
        return defaultLocal().withModes(SupplyChangeMode.NOMINAL, TransferRoundingMode.INDEPENDENT, BurnMode.NAIVE);
    }

    public LedgerConfig withModes(SupplyChangeMode supplyChange, TransferRoundingMode transferRounding, BurnMode burn) {
        return new LedgerConfig(initialCreditsPerToken, maxSupply, supplyChange, transferRounding, burn, trackRoundingError);
    }

    public LedgerConfig withBurnMode(BurnMode burn) {
        return withModes(supplyChangeMode, transferRoundingMode, burn);
    }

    public LedgerConfig withTracking(boolean track) {
        return new LedgerConfig(initialCreditsPerToken, maxSupply, supplyChangeMode, transferRoundingMode, burnMode, track);
    }

    public LedgerConfig withInitialCreditsPerToken(BigInteger creditsPerToken) {
        return new LedgerConfig(creditsPerToken, maxSupply, supplyChangeMode, transferRoundingMode, burnMode, trackRoundingError);
    }

    public LedgerConfig withMaxSupply(BigInteger supply) {
        return new LedgerConfig(initialCreditsPerToken, supply, supplyChangeMode, transferRoundingMode, burnMode, trackRoundingError);
    }

    /**
     * Reads a JSON config file. Missing keys keep their {@link #defaultLocal()} value;
     * big numbers may be given as JSON numbers or decimal strings.
     */
    public static LedgerConfig load(Path path) {
        JsonNode root;
        try {
            root = JSON.readTree(path.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger config from " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Ledger config " + path + " must be a JSON object");
        }
        LedgerConfig d = defaultLocal();
        return new LedgerConfig(
                bigInteger(root, "initialCreditsPerToken", d.initialCreditsPerToken),
                bigInteger(root, "maxSupply", d.maxSupply),
                mode(root, "supplyChange", SupplyChangeMode.class, d.supplyChangeMode),
                mode(root, "transferRounding", TransferRoundingMode.class, d.transferRoundingMode),
                mode(root, "burn", BurnMode.class, d.burnMode),
                root.path("trackRoundingError").asBoolean(d.trackRoundingError)
        );
    }

    public void save(Path path) {
        ObjectNode node = JSON.createObjectNode();
        node.put("initialCreditsPerToken", initialCreditsPerToken.toString());
        node.put("maxSupply", maxSupply.toString());
        node.put("supplyChange", supplyChangeMode.name());
        node.put("transferRounding", transferRoundingMode.name());
        node.put("burn", burnMode.name());
        node.put("trackRoundingError", trackRoundingError);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), node);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist ledger config to " + path, e);
        }
    }

    private static BigInteger bigInteger(JsonNode root, String key, BigInteger fallback) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return fallback;
        }
        try {
            return value.isNumber() ? value.bigIntegerValue() : new BigInteger(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
        }
    }

    private static <E extends Enum<E>> E mode(JsonNode root, String key, Class<E> type, E fallback) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.asText().trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value.asText());
        }
    }

    @Override public String toString() {
        return "LedgerConfig{cpt=" + initialCreditsPerToken
                + ", supplyChange=" + supplyChangeMode
                + ", transferRounding=" + transferRoundingMode
                + ", burn=" + burnMode
                + ", tracking=" + trackRoundingError + "}";
    }
}
