package hu.advjava.stepsudoku.mcp;

import java.net.URI;
import java.util.Map;
import java.util.Properties;

/** Where the JSON-RPC server listens. */
public record ServerConfig(URI baseUri) {

    public static final String PROPERTY = "sudoku.mcp.uri";
    public static final String ENV = "SUDOKU_MCP_URI";
    public static final String DEFAULT_URI = "http://127.0.0.1:8080";

    public static ServerConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    /**
     * System property first, then environment variable, then {@link #DEFAULT_URI}.
     *
     * @throws IllegalStateException if the chosen value is blank or not an absolute http URI
     */
    static ServerConfig load(Properties props, Map<String, String> env) {
        String value = props.getProperty(PROPERTY);
        String source = PROPERTY;
        if (value == null) {
            value = env.get(ENV);
            source = ENV;
        }
        if (value == null) return new ServerConfig(URI.create(DEFAULT_URI));

        if (value.isBlank())
            throw new IllegalStateException("Set " + source + " to the server URI, e.g. " + DEFAULT_URI);
        try {
            URI uri = URI.create(value.trim());
            if (!"http".equals(uri.getScheme()) || uri.getHost() == null)
                throw new IllegalStateException(source + " must be an absolute http URI: " + value);
            return new ServerConfig(uri);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(source + " is not a valid URI: " + value, e);
        }
    }
}
