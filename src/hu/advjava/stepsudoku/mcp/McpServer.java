package hu.advjava.stepsudoku.mcp;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.server.ServerProperties;

/** Serves {@link McpResource} over HTTP until the JVM is stopped. */
public class McpServer {

    private static final Logger log = LogManager.getLogger(McpServer.class);

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.load();
        HttpServer server = start(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::shutdownNow));
        log.info("Sudoku JSON-RPC server listening on {}", config.baseUri().resolve("/mcp"));
        Thread.currentThread().join();
    }

    static ResourceConfig resourceConfig() {
        return new ResourceConfig()
                .register(McpResource.class)
                .register(org.glassfish.jersey.jsonp.JsonProcessingFeature.class)
                .property(ServerProperties.WADL_FEATURE_DISABLE, true);
    }

    public static HttpServer start(ServerConfig config) {
        return GrizzlyHttpServerFactory.createHttpServer(config.baseUri(), resourceConfig());
    }
}
