package com.neorpc.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neorpc.domain.Block;
import com.neorpc.domain.Transaction;
import com.neorpc.domain.Vout;
import com.neorpc.domain.WalletBalance;
import com.neorpc.rpc.JsonRpcResponses;
import com.neorpc.rpc.NeoRpcClient;
import com.neorpc.rpc.RpcException;
import com.neorpc.rpc.WebClientNeoRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for NEO node RPC calls. Every operation is a single synchronous call against the
 * currently selected node; there is no retry. Wallet operations ({@link #getBalance},
 * {@link #getNewAddress}, {@link #sendToAddress}) need a wallet opened on the node.
 */
@Slf4j
public class NeoClient {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /** Verbose flag for getblock / getrawtransaction. */
    private static final int VERBOSE = 1;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final NeoRpcClient rpcClient;
    private final JsonRpcResponses responses;
    private final RateLimiter rateLimiter;
    private final NodeEndpoints nodes;
    private final BestNodeSelector bestNodeSelector;
    private final Duration connectTimeout;

    /**
     * @param rateLimiter    local throttle applied before every call; null for none
     * @param connectTimeout TCP connect timeout used by {@link #ping()}
     */
    public NeoClient(NeoRpcClient rpcClient,
                     ObjectMapper objectMapper,
                     RateLimiter rateLimiter,
                     NodeEndpoints nodes,
                     Duration connectTimeout) {
        this.rpcClient = rpcClient;
        this.responses = new JsonRpcResponses(objectMapper);
        this.rateLimiter = rateLimiter;
        this.nodes = nodes;
        this.bestNodeSelector = new BestNodeSelector(this::getBlockCount);
        this.connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
    }

    /**
     * Client bound to a single node. No RPC is made.
     */
    public static NeoClient create(String nodeUri) {
        return new NeoClient(defaultRpcClient(), new ObjectMapper(), null,
                new NodeEndpoints(List.of(nodeUri)), DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * Client over several nodes; queries each and selects the one with the highest block count.
     *
     * @throws IllegalArgumentException if nodeUris is empty
     */
    public static NeoClient createUsingMultipleNodes(List<String> nodeUris) {
        return connect(defaultRpcClient(), new ObjectMapper(), null, nodeUris, DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * Builds a client and runs node selection. A selection failure is logged and leaves the client
     * without a selected node; calls then fail until {@link #selectBestNode()} succeeds.
     */
    public static NeoClient connect(NeoRpcClient rpcClient,
                                    ObjectMapper objectMapper,
                                    RateLimiter rateLimiter,
                                    List<String> nodeUris,
                                    Duration connectTimeout) {
        NeoClient client = new NeoClient(rpcClient, objectMapper, rateLimiter,
                new NodeEndpoints(nodeUris), connectTimeout);
        try {
            client.selectBestNode();
        } catch (RpcException e) {
            log.warn("No NEO node selected out of {}: {}", nodeUris, e.getMessage());
        }
        return client;
    }

    private static NeoRpcClient defaultRpcClient() {
        return new WebClientNeoRpcClient(WebClient.builder());
    }

    /** Currently selected node URI, or null when selection has not succeeded. */
    public String getNode() {
        return nodes.getSelected().orElse(null);
    }

    public List<String> getNodeUris() {
        return nodes.getNodeUris();
    }

    /**
     * Selects the node with the highest block count; with one node URI that node is used as-is.
     *
     * @throws RpcException if no node could be queried; the current node is kept
     */
    public void selectBestNode() {
        String best = bestNodeSelector.select(nodes.getNodeUris());
        nodes.select(best);
        log.info("Using NEO node {}", best);
    }

    /** Hash of the best block in the chain. */
    public String getBestBlockHash() {
        return read("getbestblockhash", List.of(), String.class);
    }

    public Block getBlockByHash(String hash) {
        return read("getblock", List.of(hash, VERBOSE), Block.class);
    }

    public Block getBlockByIndex(long index) {
        return read("getblock", List.of(index, VERBOSE), Block.class);
    }

    /** Number of blocks in the chain (height + 1). */
    public long getBlockCount() {
        return getBlockCount(requireNode());
    }

    private long getBlockCount(String nodeUri) {
        return responses.read("getblockcount", callRpc(nodeUri, "getblockcount", List.of()), Long.class);
    }

    public String getBlockHash(long index) {
        return read("getblockhash", List.of(index), String.class);
    }

    public long getConnectionCount() {
        return read("getconnectioncount", List.of(), Long.class);
    }

    /**
     * Storage value (hex) of a contract for the given key. The key is sent hex-encoded as UTF-8.
     *
     * @return empty when the contract has no value under the key
     */
    public Optional<String> getStorage(String scriptHash, String storageKey) {
        String method = "getstorage";
        String hexKey = HexFormat.of().formatHex(storageKey.getBytes(StandardCharsets.UTF_8));
        return responses.readOptional(method, callRpc(requireNode(), method, List.of(scriptHash, hexKey)), String.class);
    }

    public Transaction getTransaction(String hash) {
        return read("getrawtransaction", List.of(hash, VERBOSE), Transaction.class);
    }

    /**
     * Unspent output {@code index} of transaction {@code hash}.
     *
     * @return empty when the output is already spent or does not exist
     */
    public Optional<Vout> getTransactionOutput(String hash, long index) {
        String method = "gettxout";
        return responses.readOptional(method, callRpc(requireNode(), method, List.of(hash, index)), Vout.class);
    }

    /** Hashes of the transactions in the node's memory pool. */
    public List<String> getUnconfirmedTransactions() {
        String method = "getrawmempool";
        return responses.read(method, callRpc(requireNode(), method, List.of()), STRING_LIST);
    }

    /**
     * True only when the node echoes the same address and reports it valid. A result missing either
     * field, or with the wrong type, is treated as invalid.
     */
    public boolean validateAddress(String address) {
        String method = "validateaddress";
        JsonNode result = responses.result(method, callRpc(requireNode(), method, List.of(address)));
        JsonNode returnedAddress = result.path("address");
        JsonNode valid = result.path("isvalid");
        if (!returnedAddress.isTextual() || !valid.isBoolean()) {
            return false;
        }
        return address.equals(returnedAddress.asText()) && valid.asBoolean();
    }

    public WalletBalance getBalance(String assetId) {
        return read("getbalance", List.of(assetId), WalletBalance.class);
    }

    public String getNewAddress() {
        return read("getnewaddress", List.of(), String.class);
    }

    /**
     * Transfers {@code amount} of an asset from the open wallet.
     *
     * @return id of the created transaction
     */
    public String sendToAddress(String assetId, String toAddress, BigDecimal amount) {
        Transaction tx = read("sendtoaddress", List.of(assetId, toAddress, amount), Transaction.class);
        return tx.getId();
    }

    /**
     * Whether a TCP connection to the selected node's host and port can be opened. The port defaults to
     * the scheme's (80 / 443) when the URI has none.
     */
    public boolean ping() {
        String node = getNode();
        if (node == null) {
            return false;
        }
        InetSocketAddress address;
        try {
            address = socketAddress(new URI(node));
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Cannot ping {}: {}", node, e.getMessage());
            return false;
        }
        if (address == null) {
            return false;
        }
        try (Socket socket = new Socket()) {
            socket.connect(address, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
            return true;
        } catch (IOException e) {
            log.debug("Ping {} failed: {}", node, e.getMessage());
            return false;
        }
    }

    static InetSocketAddress socketAddress(URI uri) {
        String host = uri.getHost();
        if (host == null) {
            return null;
        }
        int port = uri.getPort();
        if (port == -1) {
            if ("https".equalsIgnoreCase(uri.getScheme())) {
                port = 443;
            } else if ("http".equalsIgnoreCase(uri.getScheme())) {
                port = 80;
            } else {
                return null;
            }
        }
        return new InetSocketAddress(host, port);
    }

    private <T> T read(String method, List<?> params, Class<T> type) {
        return responses.read(method, callRpc(requireNode(), method, params), type);
    }

    private String requireNode() {
        return nodes.getSelected()
                .orElseThrow(() -> new RpcException("No NEO node selected"));
    }

    private String callRpc(String nodeUri, String method, List<?> params) {
        if (rateLimiter != null && !rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + nodeUri);
        }
        return rpcClient.call(nodeUri, method, params).block();
    }
}
