package org.zhelev.avroconsumer.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.avro.SchemaParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zhelev.avroconsumer.AvroConsumerConfig;
import org.zhelev.avroconsumer.ConsumerConnectionException;
import org.zhelev.avroconsumer.SchemaResolutionException;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Read-only client of a Confluent compatible schema registry. Schemas fetched by id are cached for the lifetime of
 * the client, registry ids never change their schema.
 *
 * <p>Requests rotate over the configured servers. When a server cannot be reached or answers with a 5xx status the
 * next one is tried; every server is asked at most once per lookup.
 */
public class CachedSchemaRegistryClient implements SchemaResolver {

    private static final Logger log = LoggerFactory.getLogger(CachedSchemaRegistryClient.class);

    public static final String SCHEMA_REGISTRY_CONTENT_TYPE = "application/vnd.schemaregistry.v1+json";

    private static final int NO_SCHEMA_ID = -1;

    private final List<String> servers;

    private final HttpClient httpClient;

    private final Duration requestTimeout;

    private final String authorization;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final AtomicInteger nextServer = new AtomicInteger();

    private final Map<Integer, AvroSchemaCodec> codecsById = new ConcurrentHashMap<>();

    public CachedSchemaRegistryClient(List<String> servers) {
        this(servers, new AvroConsumerConfig());
    }

    public CachedSchemaRegistryClient(List<String> servers, AvroConsumerConfig config) {
        this.servers = validateServers(servers);
        this.requestTimeout = config.getRegistryRequestTimeout();
        this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
        if (config.getRegistryUsername() != null) {
            String credentials = config.getRegistryUsername() + ":" + config.getRegistryPassword();
            this.authorization = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        } else {
            this.authorization = null;
        }
        log.info("Schema registry client created for {}", this.servers);
    }

    private static List<String> validateServers(List<String> servers) {
        if (servers == null || servers.isEmpty()) {
            throw new ConsumerConnectionException("At least one schema registry server is required");
        }
        List<String> validated = new ArrayList<>();
        for (String server : servers) {
            if (server == null || server.isBlank()) {
                throw new ConsumerConnectionException("Schema registry server must not be blank");
            }
            try {
                URI uri = new URI(server);
                if (uri.getHost() == null || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
                    throw new ConsumerConnectionException("Schema registry server must be an http(s) url: " + server);
                }
            } catch (URISyntaxException e) {
                throw new ConsumerConnectionException("Invalid schema registry server: " + server, e);
            }
            validated.add(server.endsWith("/") ? server.substring(0, server.length() - 1) : server);
        }
        return List.copyOf(validated);
    }

    @Override
    public SchemaCodec resolve(int schemaId) throws SchemaResolutionException {
        return getSchema(schemaId);
    }

    /**
     * Returns the codec of the schema registered under {@code schemaId}, fetching it on first use.
     */
    public AvroSchemaCodec getSchema(int schemaId) throws SchemaResolutionException {
        AvroSchemaCodec codec = codecsById.get(schemaId);
        if (codec != null) {
            return codec;
        }
        JsonNode body = get("/schemas/ids/" + schemaId, schemaId);
        codec = parseSchema(body, schemaId);
        AvroSchemaCodec previous = codecsById.putIfAbsent(schemaId, codec);
        if (log.isDebugEnabled()) {
            log.debug("Cached schema {} => {}", schemaId, codec.getSchema().getFullName());
        }
        return previous != null ? previous : codec;
    }

    public List<String> getSubjects() throws SchemaResolutionException {
        JsonNode body = get("/subjects", NO_SCHEMA_ID);
        List<String> subjects = new ArrayList<>();
        body.forEach(subject -> subjects.add(subject.asText()));
        return subjects;
    }

    public List<Integer> getVersions(String subject) throws SchemaResolutionException {
        JsonNode body = get("/subjects/" + encode(subject) + "/versions", NO_SCHEMA_ID);
        List<Integer> versions = new ArrayList<>();
        body.forEach(version -> versions.add(version.asInt()));
        return versions;
    }

    /**
     * Returns the codec of the newest version registered under {@code subject}; it is cached under its id.
     */
    public AvroSchemaCodec getLatestSchema(String subject) throws SchemaResolutionException {
        JsonNode body = get("/subjects/" + encode(subject) + "/versions/latest", NO_SCHEMA_ID);
        int schemaId = body.path("id").asInt(NO_SCHEMA_ID);
        AvroSchemaCodec codec = parseSchema(body, schemaId);
        if (schemaId != NO_SCHEMA_ID) {
            AvroSchemaCodec previous = codecsById.putIfAbsent(schemaId, codec);
            return previous != null ? previous : codec;
        }
        return codec;
    }

    private AvroSchemaCodec parseSchema(JsonNode body, int schemaId) {
        JsonNode schema = body.get("schema");
        if (schema == null || !schema.isTextual()) {
            throw new SchemaResolutionException("Schema registry response has no schema for id " + schemaId, schemaId);
        }
        try {
            return AvroSchemaCodec.parse(schema.asText());
        } catch (SchemaParseException e) {
            throw new SchemaResolutionException("Schema " + schemaId + " is not a valid avro schema", e, schemaId);
        }
    }

    private static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private JsonNode get(String path, int schemaId) {
        int serverCount = servers.size();
        int first = Math.floorMod(nextServer.getAndIncrement(), serverCount);
        SchemaResolutionException failure = null;

        for (int attempt = 0; attempt < serverCount; attempt++) {
            URI uri = URI.create(servers.get((first + attempt) % serverCount) + path);
            HttpResponse<String> response;
            try {
                response = httpClient.send(newRequest(uri), HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                log.warn("Schema registry {} unreachable: {}", uri, e.getMessage());
                failure = new SchemaResolutionException("Schema registry unreachable: " + uri, e, schemaId);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SchemaResolutionException("Interrupted while calling schema registry " + uri, e, schemaId);
            }

            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return readBody(response.body(), uri, schemaId);
            }
            failure = registryError(response, uri, schemaId);
            if (status < 500) {
                throw failure;
            }
            log.warn("Schema registry {} answered {}, trying next server", uri, status);
        }
        throw failure;
    }

    private HttpRequest newRequest(URI uri) {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", SCHEMA_REGISTRY_CONTENT_TYPE)
                .GET();
        if (authorization != null) {
            request.header("Authorization", authorization);
        }
        return request.build();
    }

    private JsonNode readBody(String body, URI uri, int schemaId) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SchemaResolutionException("Schema registry " + uri + " returned malformed json", e, schemaId);
        }
    }

    private SchemaResolutionException registryError(HttpResponse<String> response, URI uri, int schemaId) {
        int errorCode = SchemaResolutionException.NO_ERROR_CODE;
        String message = response.body();
        try {
            JsonNode error = objectMapper.readTree(response.body());
            errorCode = error.path("error_code").asInt(SchemaResolutionException.NO_ERROR_CODE);
            message = error.path("message").asText(message);
        } catch (JsonProcessingException e) {
            log.trace("Schema registry error body is not json", e);
        }
        return new SchemaResolutionException("Schema registry " + uri + " failed with status " + response.statusCode()
                + ": " + message, null, schemaId, errorCode, response.statusCode());
    }

    /**
     * @return the number of schemas currently cached by id
     */
    public int cacheSize() {
        return codecsById.size();
    }
}
