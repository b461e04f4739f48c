package com.meterpay.ledger.solana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meterpay.common.NativeUnits;
import com.meterpay.ledger.EndpointFailoverPool;
import com.meterpay.ledger.LedgerStatus;
import com.meterpay.ledger.RpcException;
import com.meterpay.ledger.SettlementLedger;
import com.meterpay.ledger.TransactionRejectedException;
import com.meterpay.ledger.TransferDetails;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SettlementLedger} over Solana JSON-RPC. Each call is one pool operation; JSON-RPC errors count as
 * endpoint failures except a sendTransaction preflight rejection, which is final.
 */
@Slf4j
public class SolanaSettlementLedger implements SettlementLedger {

    /** Pyth price account layout: int64 LE aggregate price at 208, int32 LE exponent at 220. */
    static final int PYTH_PRICE_OFFSET = 208;
    static final int PYTH_EXPONENT_OFFSET = 220;

    /** JSON-RPC code for "transaction simulation failed" on sendTransaction. */
    private static final int SEND_TRANSACTION_PREFLIGHT_FAILURE = -32002;

    private final SolanaRpcClient rpcClient;
    private final EndpointFailoverPool pool;
    private final ObjectMapper objectMapper;
    private final String commitment;

    public SolanaSettlementLedger(SolanaRpcClient rpcClient, EndpointFailoverPool pool,
                                  ObjectMapper objectMapper, String commitment) {
        this.rpcClient = rpcClient;
        this.pool = pool;
        this.objectMapper = objectMapper;
        this.commitment = commitment;
    }

    @Override
    public String submitTransaction(String signedTransactionBase64) {
        Object[] params = {signedTransactionBase64, Map.of("encoding", "base64", "preflightCommitment", commitment)};
        JsonNode result = pool.execute("sendTransaction", endpoint -> {
            JsonNode root = call(endpoint, "sendTransaction", params);
            JsonNode error = root.path("error");
            if (!error.isMissingNode() && !error.isNull() && error.path("code").asInt() == SEND_TRANSACTION_PREFLIGHT_FAILURE) {
                String message = error.path("message").asText("transaction rejected");
                throw new TransactionRejectedException(message, isInsufficientFunds(error));
            }
            JsonNode signature = result(root, "sendTransaction", endpoint);
            if (!signature.isTextual() || signature.asText().isBlank()) {
                throw new RpcException("sendTransaction returned no signature from " + endpoint);
            }
            return signature;
        });
        return result.asText();
    }

    @Override
    public LedgerStatus getTransactionStatus(String signature) {
        Object[] params = {List.of(signature), Map.of("searchTransactionHistory", true)};
        JsonNode result = pool.execute("getSignatureStatuses",
                endpoint -> result(call(endpoint, "getSignatureStatuses", params), "getSignatureStatuses", endpoint));
        JsonNode status = result.path("value").path(0);
        if (status.isMissingNode() || status.isNull()) {
            return LedgerStatus.notFound();
        }
        JsonNode err = status.path("err");
        if (!err.isMissingNode() && !err.isNull()) {
            return LedgerStatus.failed(err.toString());
        }
        String confirmation = status.path("confirmationStatus").asText("");
        if ("confirmed".equals(confirmation) || "finalized".equals(confirmation)) {
            return LedgerStatus.confirmed();
        }
        return LedgerStatus.pending();
    }

    @Override
    public BigDecimal getBalance(String address) {
        Object[] params = {address, Map.of("commitment", commitment)};
        JsonNode result = pool.execute("getBalance",
                endpoint -> result(call(endpoint, "getBalance", params), "getBalance", endpoint));
        JsonNode value = result.path("value");
        if (!value.canConvertToLong()) {
            throw new RpcException("getBalance returned no lamports value for " + address);
        }
        return NativeUnits.toSol(value.asLong());
    }

    @Override
    public Optional<BigDecimal> getLatestReferencePrice(String priceAccount) {
        Object[] params = {priceAccount, Map.of("encoding", "base64", "commitment", commitment)};
        JsonNode result = pool.execute("getAccountInfo",
                endpoint -> result(call(endpoint, "getAccountInfo", params), "getAccountInfo", endpoint));
        JsonNode data = result.path("value").path("data").path(0);
        if (!data.isTextual()) {
            return Optional.empty();
        }
        return decodePythPrice(Base64.getDecoder().decode(data.asText()));
    }

    @Override
    public String getLatestBlockhash() {
        Object[] params = {Map.of("commitment", commitment)};
        JsonNode result = pool.execute("getLatestBlockhash",
                endpoint -> result(call(endpoint, "getLatestBlockhash", params), "getLatestBlockhash", endpoint));
        String blockhash = result.path("value").path("blockhash").asText(null);
        if (blockhash == null || blockhash.isBlank()) {
            throw new RpcException("getLatestBlockhash returned no blockhash");
        }
        return blockhash;
    }

    @Override
    public Optional<TransferDetails> getTransfer(String signature) {
        Object[] params = {signature, Map.of(
                "encoding", "jsonParsed",
                "commitment", "confirmed",
                "maxSupportedTransactionVersion", 0)};
        JsonNode result = pool.execute("getTransaction",
                endpoint -> result(call(endpoint, "getTransaction", params), "getTransaction", endpoint));
        if (result.isMissingNode() || result.isNull()) {
            return Optional.empty();
        }
        JsonNode meta = result.path("meta");
        JsonNode err = meta.path("err");
        String error = err.isMissingNode() || err.isNull() ? null : err.toString();
        List<String> accountKeys = new ArrayList<>();
        for (JsonNode key : result.path("transaction").path("message").path("accountKeys")) {
            accountKeys.add(key.isTextual() ? key.asText() : key.path("pubkey").asText());
        }
        return Optional.of(new TransferDetails(signature, error, accountKeys,
                longs(meta.path("preBalances")), longs(meta.path("postBalances"))));
    }

    /**
     * Price scaled by its exponent; empty when the account is too short or the price is not positive.
     */
    static Optional<BigDecimal> decodePythPrice(byte[] accountData) {
        if (accountData == null || accountData.length < PYTH_EXPONENT_OFFSET + Integer.BYTES) {
            return Optional.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(accountData).order(ByteOrder.LITTLE_ENDIAN);
        long rawPrice = buffer.getLong(PYTH_PRICE_OFFSET);
        int exponent = buffer.getInt(PYTH_EXPONENT_OFFSET);
        if (rawPrice <= 0) {
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(rawPrice).scaleByPowerOfTen(exponent));
    }

    private JsonNode call(String endpoint, String method, Object params) {
        String body = rpcClient.call(endpoint, method, params).block();
        if (body == null || body.isBlank()) {
            throw new RpcException(method + " returned empty body from " + endpoint);
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new RpcException(method + " returned unparseable body from " + endpoint, e);
        }
    }

    private static JsonNode result(JsonNode root, String method, String endpoint) {
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error from " + endpoint + ": " + error.path("message").asText(error.toString()));
        }
        return root.path("result");
    }

    private static boolean isInsufficientFunds(JsonNode error) {
        String text = error.toString().toLowerCase(Locale.ROOT);
        return text.contains("insufficient") || text.contains("accountnotfound");
    }

    private static List<Long> longs(JsonNode array) {
        List<Long> values = new ArrayList<>();
        for (JsonNode n : array) {
            values.add(n.asLong());
        }
        return values;
    }
}
