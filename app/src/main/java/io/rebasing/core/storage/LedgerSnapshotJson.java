package io.rebasing.core.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rebasing.core.state.Account;
import io.rebasing.core.state.GlobalState;
import io.rebasing.core.state.LedgerState;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable snapshot of a whole ledger. Quantities are written as decimal strings so
 * 256-bit values survive any JSON reader.
 */
public final class LedgerSnapshotJson {
    private static final ObjectMapper JSON = new ObjectMapper();

    private LedgerSnapshotJson() {}

    public static ObjectNode toJson(LedgerState state) {
        ObjectNode root = JSON.createObjectNode();
        GlobalState g = state.global();
        ObjectNode global = root.putObject("global");
        global.put("rebasingCredits", g.rebasingCredits().toString());
        global.put("rebasingCreditsPerToken", g.rebasingCreditsPerToken().toString());
        global.put("nonRebasingSupply", g.nonRebasingSupply().toString());
        global.put("totalSupply", g.totalSupply().toString());
        global.put("roundingErrorAccumulator", g.roundingErrorAccumulator().toString());

        ObjectNode accounts = root.putObject("accounts");
        for (Map.Entry<String, Account> entry : new TreeMap<>(state.accounts()).entrySet()) {
            Account a = entry.getValue();
            ObjectNode node = accounts.putObject(entry.getKey());
            node.put("credits", a.credits().toString());
            node.put("nonRebasing", a.nonRebasing());
            if (a.nonRebasing()) {
                node.put("lockedCreditsPerToken", a.lockedCreditsPerToken().toString());
            }
        }
        return root;
    }

    public static LedgerState fromJson(JsonNode root) {
        JsonNode g = require(root, "global");
        GlobalState global = new GlobalState(
                number(g, "rebasingCredits"),
                number(g, "rebasingCreditsPerToken"),
                number(g, "nonRebasingSupply"),
                number(g, "totalSupply"),
                g.has("roundingErrorAccumulator") ? number(g, "roundingErrorAccumulator") : BigInteger.ZERO);

        Map<String, Account> accounts = new LinkedHashMap<>();
        JsonNode accountsNode = root.path("accounts");
        Iterator<Map.Entry<String, JsonNode>> it = accountsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode a = entry.getValue();
            BigInteger credits = number(a, "credits");
            Account account = a.path("nonRebasing").asBoolean(false)
                    ? Account.nonRebasing(credits, number(a, "lockedCreditsPerToken"))
                    : Account.rebasing(credits);
            accounts.put(entry.getKey(), account);
        }
        return new LedgerState(accounts, global);
    }

    public static void export(LedgerState state, Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toJson(state));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to export ledger snapshot to " + path, e);
        }
    }

    public static LedgerState read(Path path) {
        try {
            return fromJson(JSON.readTree(path.toFile()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger snapshot from " + path, e);
        }
    }

    private static JsonNode require(JsonNode node, String key) {
        JsonNode value = node == null ? null : node.get(key);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Snapshot is missing '" + key + "'");
        }
        return value;
    }

    private static BigInteger number(JsonNode node, String key) {
        JsonNode value = require(node, key);
        try {
            return value.isNumber() ? value.bigIntegerValue() : new BigInteger(value.asText());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for '" + key + "': " + value);
        }
    }
}
