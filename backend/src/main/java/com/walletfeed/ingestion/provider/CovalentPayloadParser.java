package com.walletfeed.ingestion.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletfeed.ingestion.provider.HistoryProviderClient.HistoryPage;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderErc20Transfer;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderErc721Transfer;
import com.walletfeed.ingestion.provider.HistoryProviderClient.ProviderTransaction;
import com.walletfeed.ingestion.provider.HistoryProviderClient.TokenContract;
import com.walletfeed.wallet.WalletAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses Covalent {@code transactions_v2} payloads into {@link HistoryPage}s.
 * <p>
 * Transfers come from decoded {@code Transfer} log events: an indexed third
 * parameter means ERC-721 (token id), otherwise ERC-20 (amount). A flat
 * {@code transfers} array with an explicit {@code type} is accepted as well.
 * Log events whose parameters are not addresses and integers are skipped. All addresses are returned in checksum form.
 */
public final class CovalentPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(CovalentPayloadParser.class);

    private static final String FIELD_DATA = "data";
    private static final String FIELD_ERROR = "error";
    private static final String FIELD_ERROR_MESSAGE = "error_message";
    private static final String FIELD_ITEMS = "items";
    private static final String FIELD_PAGINATION = "pagination";
    private static final String FIELD_HAS_MORE = "has_more";
    private static final String FIELD_NEXT_UPDATE_AT = "next_update_at";
    private static final String FIELD_CHAIN_ID = "chain_id";

    private static final String FIELD_TX_HASH = "tx_hash";
    private static final String FIELD_BLOCK_SIGNED_AT = "block_signed_at";
    private static final String FIELD_TX_OFFSET = "tx_offset";
    private static final String FIELD_SUCCESSFUL = "successful";
    private static final String FIELD_FROM = "from_address";
    private static final String FIELD_TO = "to_address";
    private static final String FIELD_VALUE = "value";

    private static final String FIELD_LOG_EVENTS = "log_events";
    private static final String FIELD_DECODED = "decoded";
    private static final String FIELD_PARAMS = "params";
    private static final String FIELD_SENDER_ADDRESS = "sender_address";
    private static final String FIELD_SENDER_NAME = "sender_name";
    private static final String FIELD_SENDER_TICKER = "sender_contract_ticker_symbol";
    private static final String FIELD_SENDER_LOGO = "sender_logo_url";
    private static final String FIELD_SENDER_DECIMALS = "sender_contract_decimals";

    private static final String FIELD_TRANSFERS = "transfers";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_CONTRACT_ADDRESS = "contract_address";
    private static final String FIELD_CONTRACT_NAME = "contract_name";
    private static final String FIELD_CONTRACT_TICKER = "contract_ticker";
    private static final String FIELD_LOGO_URL = "logo_url";
    private static final String FIELD_AMOUNT = "amount";
    private static final String FIELD_DECIMALS = "decimals";
    private static final String FIELD_TOKEN_ID = "token_id";

    private static final String TRANSFER_EVENT = "Transfer";

    private CovalentPayloadParser() {
    }

    public static HistoryPage fromJson(JsonNode payload, int defaultChainId) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("History payload must be an object");
        }
        if (payload.path(FIELD_ERROR).asBoolean(false)) {
            throw new IllegalArgumentException("Provider reported an error: "
                    + payload.path(FIELD_ERROR_MESSAGE).asText("unknown"));
        }

        JsonNode data = payload.has(FIELD_DATA) ? payload.get(FIELD_DATA) : payload;
        if (data == null || !data.isObject()) {
            throw new IllegalArgumentException("History payload missing object field 'data'");
        }

        JsonNode items = data.get(FIELD_ITEMS);
        if (items == null || !items.isArray()) {
            throw new IllegalArgumentException("History payload missing array field 'items'");
        }

        int chainId = data.hasNonNull(FIELD_CHAIN_ID) ? data.get(FIELD_CHAIN_ID).asInt() : defaultChainId;

        JsonNode pagination = data.hasNonNull(FIELD_PAGINATION) ? data.get(FIELD_PAGINATION) : payload.get(FIELD_PAGINATION);
        boolean hasMore = pagination != null && pagination.path(FIELD_HAS_MORE).asBoolean(false);

        JsonNode nextUpdateNode = data.hasNonNull(FIELD_NEXT_UPDATE_AT)
                ? data.get(FIELD_NEXT_UPDATE_AT)
                : payload.get(FIELD_NEXT_UPDATE_AT);
        OffsetDateTime nextUpdateAt = nextUpdateNode == null || nextUpdateNode.isNull()
                ? null
                : parseTimestamp(nextUpdateNode, FIELD_NEXT_UPDATE_AT);

        List<ProviderTransaction> transactions = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            transactions.add(parseTransaction(item, chainId));
        }
        return new HistoryPage(transactions, hasMore, nextUpdateAt);
    }

    private static ProviderTransaction parseTransaction(JsonNode item, int pageChainId) {
        if (item == null || !item.isObject()) {
            throw new IllegalArgumentException("History item must be an object");
        }
        int chainId = item.hasNonNull(FIELD_CHAIN_ID) ? item.get(FIELD_CHAIN_ID).asInt() : pageChainId;

        List<ProviderErc20Transfer> erc20 = new ArrayList<>();
        List<ProviderErc721Transfer> erc721 = new ArrayList<>();
        collectLogEventTransfers(item.get(FIELD_LOG_EVENTS), erc20, erc721);
        collectFlatTransfers(item.get(FIELD_TRANSFERS), erc20, erc721);

        String toAddress = optionalText(item, FIELD_TO);
        return new ProviderTransaction(
                chainId,
                requireText(item, FIELD_TX_HASH).toLowerCase(Locale.ROOT),
                parseTimestamp(item.get(FIELD_BLOCK_SIGNED_AT), FIELD_BLOCK_SIGNED_AT),
                requireInt(item, FIELD_TX_OFFSET),
                item.path(FIELD_SUCCESSFUL).asBoolean(false),
                checksum(requireText(item, FIELD_FROM), FIELD_FROM),
                toAddress == null ? null : checksum(toAddress, FIELD_TO),
                optionalBigInteger(item, FIELD_VALUE, BigInteger.ZERO),
                erc20,
                erc721
        );
    }

    private static void collectLogEventTransfers(
            JsonNode logEvents,
            List<ProviderErc20Transfer> erc20,
            List<ProviderErc721Transfer> erc721
    ) {
        if (logEvents == null || !logEvents.isArray()) {
            return;
        }
        for (JsonNode logEvent : logEvents) {
            JsonNode decoded = logEvent.get(FIELD_DECODED);
            if (decoded == null || !TRANSFER_EVENT.equals(decoded.path("name").asText(null))) {
                continue;
            }
            JsonNode params = decoded.get(FIELD_PARAMS);
            if (params == null || !params.isArray() || params.size() < 3) {
                continue;
            }
            String from = params.get(0).path(FIELD_VALUE).asText(null);
            String to = params.get(1).path(FIELD_VALUE).asText(null);
            JsonNode third = params.get(2);
            String rawValue = third.path(FIELD_VALUE).asText(null);
            String contractAddress = logEvent.path(FIELD_SENDER_ADDRESS).asText(null);
            if (from == null || to == null || rawValue == null || contractAddress == null) {
                continue;
            }

            try {
                TokenContract contract = new TokenContract(
                        checksum(contractAddress, FIELD_SENDER_ADDRESS),
                        optionalText(logEvent, FIELD_SENDER_NAME),
                        optionalText(logEvent, FIELD_SENDER_TICKER),
                        optionalText(logEvent, FIELD_SENDER_LOGO)
                );
                String fromAddress = checksum(from, FIELD_FROM);
                String toAddress = checksum(to, FIELD_TO);
                BigInteger number = parseBigInteger(rawValue, FIELD_VALUE);
                if (third.path("indexed").asBoolean(false)) {
                    erc721.add(new ProviderErc721Transfer(contract, fromAddress, toAddress, number));
                } else {
                    int decimals = logEvent.path(FIELD_SENDER_DECIMALS).asInt(0);
                    erc20.add(new ProviderErc20Transfer(contract, fromAddress, toAddress, number, decimals));
                }
            } catch (IllegalArgumentException ex) {
                // Transfer events from non-token contracts reuse the name with other param types.
                log.debug("Skipping Transfer log event from {}: {}", contractAddress, ex.getMessage());
            }
        }
    }

    private static void collectFlatTransfers(
            JsonNode transfers,
            List<ProviderErc20Transfer> erc20,
            List<ProviderErc721Transfer> erc721
    ) {
        if (transfers == null || !transfers.isArray()) {
            return;
        }
        for (JsonNode transfer : transfers) {
            String type = requireText(transfer, FIELD_TYPE).toLowerCase(Locale.ROOT);
            TokenContract contract = new TokenContract(
                    checksum(requireText(transfer, FIELD_CONTRACT_ADDRESS), FIELD_CONTRACT_ADDRESS),
                    optionalText(transfer, FIELD_CONTRACT_NAME),
                    optionalText(transfer, FIELD_CONTRACT_TICKER),
                    optionalText(transfer, FIELD_LOGO_URL)
            );
            String from = checksum(requireText(transfer, FIELD_FROM), FIELD_FROM);
            String to = checksum(requireText(transfer, FIELD_TO), FIELD_TO);
            switch (type) {
                case "erc20" -> erc20.add(new ProviderErc20Transfer(
                        contract,
                        from,
                        to,
                        parseBigInteger(requireText(transfer, FIELD_AMOUNT), FIELD_AMOUNT),
                        requireInt(transfer, FIELD_DECIMALS)
                ));
                case "erc721" -> erc721.add(new ProviderErc721Transfer(
                        contract,
                        from,
                        to,
                        parseBigInteger(requireText(transfer, FIELD_TOKEN_ID), FIELD_TOKEN_ID)
                ));
                default -> throw new IllegalArgumentException("Unsupported transfer type '" + type + "'");
            }
        }
    }

    private static String checksum(String address, String fieldName) {
        try {
            return WalletAddresses.toChecksum(address);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("History field '" + fieldName + "' is not a valid address", ex);
        }
    }

    private static OffsetDateTime parseTimestamp(JsonNode node, String fieldName) {
        if (node == null || !node.isTextual()) {
            throw new IllegalArgumentException("History payload missing timestamp field '" + fieldName + "'");
        }
        try {
            return OffsetDateTime.parse(node.textValue());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("History field '" + fieldName + "' is not ISO-8601", ex);
        }
    }

    private static String requireText(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (field == null || field.isNull() || field.asText().isBlank()) {
            throw new IllegalArgumentException("History payload missing field '" + fieldName + "'");
        }
        return field.asText();
    }

    private static String optionalText(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (field == null || field.isNull()) {
            return null;
        }
        return field.asText();
    }

    private static int requireInt(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (field == null || !field.canConvertToInt()) {
            throw new IllegalArgumentException("History payload missing integer field '" + fieldName + "'");
        }
        return field.intValue();
    }

    private static BigInteger optionalBigInteger(JsonNode node, String fieldName, BigInteger fallback) {
        JsonNode field = node.get(fieldName);
        if (field == null || field.isNull()) {
            return fallback;
        }
        if (field.isIntegralNumber()) {
            return field.bigIntegerValue();
        }
        return parseBigInteger(field.asText(), fieldName);
    }

    private static BigInteger parseBigInteger(String raw, String fieldName) {
        try {
            return new BigInteger(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("History field '" + fieldName + "' must be an integer", ex);
        }
    }
}
