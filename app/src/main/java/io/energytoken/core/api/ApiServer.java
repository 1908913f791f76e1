package io.energytoken.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.energytoken.core.config.LedgerConfig;
import io.energytoken.core.error.AuthorizationException;
import io.energytoken.core.error.LedgerException;
import io.energytoken.core.error.ProofException;
import io.energytoken.core.error.StateException;
import io.energytoken.core.error.SupplyException;
import io.energytoken.core.error.TransferException;
import io.energytoken.core.error.ValidationException;
import io.energytoken.core.metrics.LedgerMetrics;
import io.energytoken.core.mint.ProofStatus;
import io.energytoken.core.node.Node;
import io.energytoken.core.protocol.MintRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-over-HTTP access to the ledger.
 * <p>
 * Reads are GETs with query parameters; every mutating call is a POST whose acting
 * principal is taken from the {@code X-Caller} header. When a token is configured, every
 * request must carry {@code Authorization: Bearer <token>}.
 */
public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    static final String CALLER_HEADER = "X-Caller";

    private final Node node;
    private final ObjectMapper mapper;
    private final String bindAddress;
    private final int port;
    private final String apiToken;
    private HttpServer httpServer;

    public ApiServer(Node node, String bindAddress, int port, String apiToken) {
        this.node = node;
        this.bindAddress = bindAddress == null || bindAddress.isBlank() ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.apiToken = apiToken == null || apiToken.isBlank() ? null : apiToken;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/balance", new BalanceHandler());
        httpServer.createContext("/supply", new SupplyHandler());
        httpServer.createContext("/metadata", new MetadataHandler());
        httpServer.createContext("/proofs", new ProofHandler());
        httpServer.createContext("/history", new HistoryHandler());
        httpServer.createContext("/config", new ConfigHandler());
        httpServer.createContext("/mint", new MintHandler());
        httpServer.createContext("/burn", new BurnHandler());
        httpServer.createContext("/transfer", new TransferHandler());
        httpServer.createContext("/admin", new AdminHandler());
        httpServer.createContext("/metrics", new MetricsHandler());
        httpServer.setExecutor(null);
        httpServer.start();
        LOG.info("API HTTP server started on " + bindAddress + ":" + port + (apiToken != null ? " (token auth)" : ""));
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
    }

    /**
     * Shared request plumbing: metrics, method and token checks, and mapping of ledger
     * rejections onto HTTP statuses.
     */
    abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = LedgerMetrics.startRequest();
            int status = 500;
            try {
                if (!authorized(exchange)) {
                    exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
                    status = sendError(exchange, 401, "unauthorized", "Missing or invalid bearer token");
                    return;
                }
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = serve(exchange);
            } catch (LedgerException e) {
                status = sendError(exchange, statusFor(e), e.code().name().toLowerCase(Locale.ROOT), e.getMessage(), e.code().code());
            } catch (BadRequest e) {
                status = sendError(exchange, 400, e.code, e.getMessage());
            } catch (Exception e) {
                LOG.log(Level.WARNING, method + " " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                LedgerMetrics.recordRequest(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int serve(HttpExchange exchange) throws IOException;
    }

    class BalanceHandler extends Endpoint {
        BalanceHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String account = requireQuery(exchange, "account");
            ObjectNode resp = mapper.createObjectNode()
                    .put("account", account)
                    .put("balance", node.ledger().getBalance(account));
            return sendJson(exchange, 200, resp);
        }
    }

    class SupplyHandler extends Endpoint {
        SupplyHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode()
                    .put("totalSupply", node.ledger().getTotalSupply())
                    .put("totalMinted", node.ledger().getTotalMinted())
                    .put("maxSupply", node.params().maxSupply)
                    .put("height", node.height());
            return sendJson(exchange, 200, resp);
        }
    }

    class MetadataHandler extends Endpoint {
        MetadataHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode()
                    .put("name", node.ledger().getName())
                    .put("symbol", node.ledger().getSymbol())
                    .put("decimals", node.ledger().getDecimals())
                    .put("tokenUri", node.ledger().getTokenUri());
            return sendJson(exchange, 200, resp);
        }
    }

    class ProofHandler extends Endpoint {
        ProofHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            long id = parseLong(requireQuery(exchange, "id"), "id");
            ProofStatus status = node.minter().getProofStatus(id);
            ObjectNode resp = mapper.createObjectNode()
                    .put("id", id)
                    .put("mintable", status.mintable())
                    .put("minted", status.minted());
            Optional<MintRecord> record = status.record();
            if (record.isPresent()) {
                resp.putObject("record")
                        .put("cumulativeMinted", record.get().cumulativeMinted())
                        .put("lastMintHeight", record.get().lastMintHeight());
            } else {
                resp.putNull("record");
            }
            return sendJson(exchange, 200, resp);
        }
    }

    class HistoryHandler extends Endpoint {
        HistoryHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String account = requireQuery(exchange, "account");
            ObjectNode resp = mapper.createObjectNode().put("account", account);
            ArrayNode ids = resp.putArray("proofIds");
            for (Long id : node.minter().getMintHistory(account)) {
                ids.add(id);
            }
            return sendJson(exchange, 200, resp);
        }
    }

    class ConfigHandler extends Endpoint {
        ConfigHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            LedgerConfig cfg = node.config().current();
            ObjectNode resp = mapper.createObjectNode()
                    .put("owner", cfg.owner())
                    .put("paused", cfg.paused())
                    .put("attester", cfg.attester())
                    .put("registry", cfg.registry())
                    .put("feeRecipient", cfg.feeRecipient())
                    .put("version", cfg.version());
            return sendJson(exchange, 200, resp);
        }
    }

    class MintHandler extends Endpoint {
        MintHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String caller = requireCaller(exchange);
            MintRequest req = readBody(exchange, MintRequest.class);
            if (req.amount == null || req.proofId == null) {
                throw new BadRequest("missing_fields", "Fields 'amount' and 'proofId' are required");
            }
            long net = node.minter().mint(req.amount, req.proofId, caller);
            ObjectNode resp = mapper.createObjectNode()
                    .put("status", "ok")
                    .put("net", net)
                    .put("fee", req.amount - net);
            return sendJson(exchange, 200, resp);
        }
    }

    class BurnHandler extends Endpoint {
        BurnHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String caller = requireCaller(exchange);
            BurnRequest req = readBody(exchange, BurnRequest.class);
            if (req.amount == null) {
                throw new BadRequest("missing_fields", "Field 'amount' is required");
            }
            long burned = node.minter().burn(req.amount, caller);
            return sendJson(exchange, 200, mapper.createObjectNode().put("status", "ok").put("burned", burned));
        }
    }

    class TransferHandler extends Endpoint {
        TransferHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String caller = requireCaller(exchange);
            TransferRequest req = readBody(exchange, TransferRequest.class);
            if (req.amount == null || req.sender == null || req.recipient == null) {
                throw new BadRequest("missing_fields", "Fields 'amount', 'sender' and 'recipient' are required");
            }
            boolean ok = node.ledger().transfer(req.amount, req.sender, req.recipient, caller);
            return sendJson(exchange, 200, mapper.createObjectNode().put("status", "ok").put("result", ok));
        }
    }

    /** /admin/pause, /admin/unpause, /admin/fee-recipient, /admin/attester, /admin/registry, /admin/owner */
    class AdminHandler extends Endpoint {
        AdminHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String caller = requireCaller(exchange);
            String command = exchange.getRequestURI().getPath().substring("/admin".length());
            boolean ok;
            switch (command) {
                case "/pause":
                    ok = node.config().pause(caller);
                    break;
                case "/unpause":
                    ok = node.config().unpause(caller);
                    break;
                case "/fee-recipient":
                    ok = node.config().setFeeRecipient(requireAddressBody(exchange), caller);
                    break;
                case "/attester":
                    ok = node.config().setAttester(requireAddressBody(exchange), caller);
                    break;
                case "/registry":
                    ok = node.config().setRegistry(requireAddressBody(exchange), caller);
                    break;
                case "/owner":
                    ok = node.config().transferOwnership(requireAddressBody(exchange), caller);
                    break;
                default:
                    return sendError(exchange, 404, "unknown_command", "Unknown admin command: " + command);
            }
            return sendJson(exchange, 200, mapper.createObjectNode().put("status", "ok").put("result", ok));
        }

        private String requireAddressBody(HttpExchange exchange) throws IOException {
            AddressRequest req = readBody(exchange, AddressRequest.class);
            if (req.address == null || req.address.isBlank()) {
                throw new BadRequest("missing_fields", "Field 'address' is required");
            }
            return req.address;
        }
    }

    class MetricsHandler extends Endpoint {
        MetricsHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] out = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
            return 200;
        }
    }

    public static class MintRequest {
        public Long amount;
        public Long proofId;
    }

    public static class BurnRequest {
        public Long amount;
    }

    public static class TransferRequest {
        public Long amount;
        public String sender;
        public String recipient;
    }

    public static class AddressRequest {
        public String address;
    }

    /** Malformed request; answered with 400 and the given error code. */
    static final class BadRequest extends RuntimeException {
        final String code;

        BadRequest(String code, String message) {
            super(message);
            this.code = code;
        }
    }

    static int statusFor(LedgerException e) {
        if (e instanceof AuthorizationException) return 403;
        if (e instanceof ValidationException) return 400;
        if (e instanceof ProofException) return 422;
        if (e instanceof SupplyException) return 409;
        if (e instanceof StateException) return 423;
        if (e instanceof TransferException) return 409;
        return 400;
    }

    private boolean authorized(HttpExchange exchange) {
        if (apiToken == null) {
            return true;
        }
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return false;
        }
        byte[] presented = header.substring("Bearer ".length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(presented, apiToken.getBytes(StandardCharsets.UTF_8));
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try {
            T body = mapper.readValue(exchange.getRequestBody(), type);
            if (body == null) {
                throw new BadRequest("invalid_json", "Request body required");
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new BadRequest("invalid_json", "Failed to parse request body");
        }
    }

    private String requireCaller(HttpExchange exchange) {
        String caller = exchange.getRequestHeaders().getFirst(CALLER_HEADER);
        if (caller == null || caller.isBlank()) {
            throw new BadRequest("missing_caller", "Header '" + CALLER_HEADER + "' is required");
        }
        return caller.trim();
    }

    private String requireQuery(HttpExchange exchange, String key) {
        String value = queryParam(exchange, key);
        if (value == null || value.isBlank()) {
            throw new BadRequest("missing_" + key, "Query parameter '" + key + "' is required");
        }
        return value;
    }

    private static long parseLong(String value, String field) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new BadRequest("invalid_" + field, "'" + field + "' must be an integer");
        }
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String error, String message) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", error);
        body.put("message", message);
        return sendJson(exchange, status, body);
    }

    private int sendError(HttpExchange exchange, int status, String error, String message, int code) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", error);
        body.put("code", code);
        body.put("message", message);
        return sendJson(exchange, status, body);
    }

    private String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
