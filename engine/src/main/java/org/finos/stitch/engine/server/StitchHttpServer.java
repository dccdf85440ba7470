package org.finos.stitch.engine.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.finos.stitch.dsl.IncludeCompiler;
import org.finos.stitch.engine.config.StitchSettings;
import org.finos.stitch.engine.execution.BatchStitcher;
import org.finos.stitch.engine.execution.IncludeController;
import org.finos.stitch.engine.execution.IncludeOutcome;
import org.finos.stitch.engine.execution.JdbcQueryBackend;
import org.finos.stitch.engine.store.RelationGraph;
import org.finos.stitch.engine.transpiler.DuckDBDialect;
import org.finos.stitch.engine.transpiler.SQLDialect;
import org.finos.stitch.engine.transpiler.SQLiteDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stitch HTTP server.
 * 
 * Uses Java's built-in com.sun.net.httpserver.
 * 
 * Endpoints:
 * - POST /{entity}/list - List rows with optional includes
 * - GET /health - Health check
 */
public class StitchHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(StitchHttpServer.class);

    private static final Pattern LIST_PATH = Pattern.compile("^/([A-Za-z_][\\w]*)/list/?$");

    private final HttpServer server;
    private final ListService listService;
    private final Connection connection;

    public StitchHttpServer(int port, ListService listService) throws IOException {
        this(port, listService, null);
    }

    /**
     * @param connection Closed by {@link #stop()}; null when the caller owns the database
     */
    private StitchHttpServer(int port, ListService listService, Connection connection) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.listService = listService;
        this.connection = connection;
        setupRoutes();
    }

    /**
     * Wires a server over a JDBC database.
     * 
     * @param port     Port to bind, 0 for any free port
     * @param jdbcUrl  A DuckDB or SQLite JDBC URL
     * @param graph    The relation graph
     * @param settings Include settings
     * @param executor Runs sibling fetches
     * @return A server that owns the opened connection and closes it on {@link #stop()}
     */
    public static StitchHttpServer create(int port, String jdbcUrl, RelationGraph graph, StitchSettings settings,
            ExecutorService executor) throws IOException, SQLException {
        SQLDialect dialect = dialectFor(jdbcUrl);
        Connection connection = DriverManager.getConnection(jdbcUrl);
        JdbcQueryBackend backend = JdbcQueryBackend.shared(connection);

        BatchStitcher stitcher = new BatchStitcher(graph, backend, dialect, executor, settings.fanOut(),
                LoggerFactory.getLogger(BatchStitcher.class));
        IncludeController controller = new IncludeController(new IncludeCompiler(graph), stitcher, settings);
        try {
            return new StitchHttpServer(port, new ListService(graph, backend, dialect, controller), connection);
        } catch (IOException | RuntimeException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    static SQLDialect dialectFor(String jdbcUrl) {
        if (jdbcUrl.startsWith("jdbc:duckdb:")) {
            return DuckDBDialect.INSTANCE;
        }
        if (jdbcUrl.startsWith("jdbc:sqlite:")) {
            return SQLiteDialect.INSTANCE;
        }
        throw new IllegalArgumentException("Unsupported JDBC URL: " + jdbcUrl);
    }

    private void setupRoutes() {
        server.createContext("/health", exchange -> {
            addCorsHeaders(exchange);
            sendResponse(exchange, 200, "{\"status\":\"ok\"}");
        });
        server.createContext("/", this::handleList);
    }

    private void handleList(HttpExchange exchange) throws IOException {
        addCorsHeaders(exchange);
        String method = exchange.getRequestMethod();
        if ("OPTIONS".equals(method)) {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }
        Matcher matcher = LIST_PATH.matcher(exchange.getRequestURI().getPath());
        if (!matcher.matches()) {
            sendError(exchange, 404, "not-found", "No route for " + exchange.getRequestURI().getPath());
            return;
        }
        if (!"POST".equals(method)) {
            sendError(exchange, 405, "method-not-allowed", "Use POST");
            return;
        }

        String entity = matcher.group(1);
        try {
            Map<String, Object> request = StitchJson.parseObject(readBody(exchange));
            IncludeOutcome outcome = listService.list(entity, request);
            sendResponse(exchange, outcome.httpStatus(), StitchJson.toJson(outcome.responseBody()));
        } catch (StitchJson.JsonSyntaxException e) {
            sendError(exchange, 400, "invalid-json", e.getMessage());
        } catch (ListRequestException e) {
            sendError(exchange, e.getStatus(), e.getStatus() == 404 ? "not-found" : "invalid-request",
                    e.getMessage());
        } catch (SQLException e) {
            LOG.error("List query on {} failed", entity, e);
            sendError(exchange, 500, "query-failed", e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure serving {}", exchange.getRequestURI(), e);
            sendError(exchange, 500, "internal-error", String.valueOf(e.getMessage()));
        }
    }

    public static void addCorsHeaders(HttpExchange exchange) {
        var headers = exchange.getResponseHeaders();
        headers.add("Access-Control-Allow-Origin", "*");
        headers.add("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        headers.add("Access-Control-Allow-Headers", "Content-Type");
    }

    static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static void sendError(HttpExchange exchange, int status, String error, String message)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        sendResponse(exchange, status, StitchJson.toJson(body));
    }

    static void sendResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public void start() {
        server.setExecutor(null);
        server.start();
        LOG.info("Stitch HTTP server started on port {}", getPort());
    }

    public void stop() {
        server.stop(0);
        if (connection != null) {
            try {
                connection.close();
            } catch (SQLException e) {
                LOG.warn("Closing the database connection failed", e);
            }
        }
    }

    Connection connection() {
        return connection;
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Usage: {@code StitchHttpServer <port> <jdbcUrl> <schema.json>}
     */
    public static void main(String[] args) throws IOException, SQLException {
        if (args.length < 3) {
            System.err.println("Usage: StitchHttpServer <port> <jdbcUrl> <schema.json>");
            System.exit(2);
        }
        int port;
        try {
            port = Integer.parseInt(args[0]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid port: " + args[0]);
            System.exit(2);
            return;
        }

        StitchSettings settings = StitchSettings.load();
        RelationGraph graph = SchemaLoader.load(Path.of(args[2]));
        ExecutorService executor = Executors.newFixedThreadPool(settings.fanOut());

        StitchHttpServer server = create(port, args[1], graph, settings, executor);
        server.start();
        LOG.info("Loaded {} entities; settings {}", graph.entities().size(), settings);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            executor.shutdownNow();
        }));
    }
}
