package de.t14d3.dbexecutor.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import de.t14d3.dbexecutor.exceptions.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves the connection target from either a JDBC URL or the path of an XML
 * connection document.
 * <p>
 * The document holds a {@code ConnectionString} element (as the root or anywhere
 * below it):
 * <pre>{@code
 * <Configuration>
 *   <ConnectionString>
 *     <Server>db01</Server>
 *     <Instance>SQLEXPRESS</Instance>
 *     <Port/>
 *     <Database>Fleet</Database>
 *     <Username>app</Username>
 *     <Password>secret</Password>
 *     <IntegratedSecurity>false</IntegratedSecurity>
 *   </ConnectionString>
 * </Configuration>
 * }</pre>
 * {@code Instance}, {@code Port} and {@code Password} may be empty or missing.
 */
public class ConnectionSettingsLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionSettingsLoader.class);

    private static final String ROOT_ELEMENT = "ConnectionString";

    private final XmlMapper xmlMapper;

    public ConnectionSettingsLoader() {
        this.xmlMapper = new XmlMapper();
    }

    /**
     * Builds a connection factory for the given connection string: the settings
     * document it points to if it names an existing file, otherwise the string itself
     * as a JDBC URL.
     */
    public ConnectionFactory resolve(String connectionStringOrPath) {
        if (connectionStringOrPath == null || connectionStringOrPath.isBlank()) {
            throw new IllegalArgumentException("Connection string must not be blank");
        }

        Path path = asExistingFile(connectionStringOrPath);
        if (path == null) {
            return new DriverManagerConnectionFactory(connectionStringOrPath);
        }

        ConnectionSettings settings = load(path);
        return new DriverManagerConnectionFactory(settings.toJdbcUrl(), settings.toProperties());
    }

    /**
     * Reads connection settings from an XML document.
     *
     * @throws ConfigurationException if the file cannot be read or lacks required elements
     */
    public ConnectionSettings load(Path path) {
        JsonNode root;
        try {
            root = xmlMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read connection settings from " + path, e);
        }

        JsonNode node = root == null ? null : root.findValue(ROOT_ELEMENT);
        if (node == null && root != null && root.has("Server")) {
            // the document root is the ConnectionString element itself
            node = root;
        }
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("No " + ROOT_ELEMENT + " element found in " + path);
        }

        String server = required(node, "Server", path);
        String database = required(node, "Database", path);
        String port = text(node, "Port");

        ConnectionSettings settings;
        try {
            settings = new ConnectionSettings(
                    server,
                    text(node, "Instance"),
                    port == null ? null : Integer.valueOf(port),
                    database,
                    text(node, "Username"),
                    text(node, "Password"),
                    Boolean.parseBoolean(text(node, "IntegratedSecurity")));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid Port '" + port + "' in " + path, e);
        }

        LOG.info("Loaded connection settings from {}: {}", path, settings);
        return settings;
    }

    private static Path asExistingFile(String candidate) {
        try {
            Path path = Path.of(candidate);
            return Files.isRegularFile(path) ? path : null;
        } catch (InvalidPathException e) {
            LOG.trace("'{}' is not a file path, using it as a JDBC URL", candidate);
            return null;
        }
    }

    private static String required(JsonNode node, String name, Path path) {
        String value = text(node, name);
        if (value == null) {
            throw new ConfigurationException("Missing " + name + " in " + ROOT_ELEMENT + " of " + path);
        }
        return value;
    }

    private static String text(JsonNode node, String name) {
        JsonNode child = node.get(name);
        if (child == null || child.isNull()) {
            return null;
        }
        String value = child.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
