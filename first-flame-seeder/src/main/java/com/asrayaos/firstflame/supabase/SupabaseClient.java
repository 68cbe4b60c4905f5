package com.asrayaos.firstflame.supabase;

import com.asrayaos.firstflame.config.SeedingConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Thin blocking client for the parts of the Supabase HTTP API the seeder uses:
 * PostgREST upserts and RPCs, and Storage downloads.
 *
 * <p>Every request is authenticated with the service key and bounded by the configured
 * connect and response timeouts. The client is thread safe and meant to be shared.
 */
public class SupabaseClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(SupabaseClient.class);

    private static final int MAX_CONNECTIONS = 50;
    private static final int MAX_LOGGED_BODY = 500;

    private final String baseUrl;
    private final String serviceKey;
    private final String schema;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    public SupabaseClient(SeedingConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, createHttpClient(config.getConnectTimeout(), config.getResponseTimeout()));
    }

    SupabaseClient(SeedingConfig config, ObjectMapper objectMapper, CloseableHttpClient httpClient) {
        this.baseUrl = config.getSupabaseUrl().toString();
        this.serviceKey = config.getServiceKey();
        this.schema = config.getSchema();
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Inserts rows into a table, resolving conflicts on the given columns.
     *
     * @param table                the table name inside the configured schema
     * @param rows                 a JSON object or array of objects
     * @param onConflict           comma separated conflict target columns
     * @param resolution           what to do with rows that already exist
     * @param returnRepresentation whether the affected rows should be returned
     * @return the returned rows, or a missing node when no representation was requested
     * @throws SupabaseException if the store rejects the write or cannot be reached
     */
    public JsonNode upsert(String table, JsonNode rows, String onConflict, Resolution resolution,
                           boolean returnRepresentation) throws SupabaseException {
        String url = baseUrl + "/rest/v1/" + encodeSegment(table) + "?on_conflict=" + encodeQuery(onConflict);
        HttpPost request = new HttpPost(url);
        applyRestHeaders(request, schema);
        request.setHeader("Prefer", resolution.getPreference() + ","
                + (returnRepresentation ? "return=representation" : "return=minimal"));
        request.setEntity(jsonEntity(rows));

        logger.debug("Upserting into {}.{} on_conflict={} ({})", schema, table, onConflict, resolution);
        return readJson(execute(request, "upsert " + table));
    }

    /**
     * Calls a stored procedure through PostgREST.
     *
     * @param function the function name inside the configured schema
     * @param args     the named arguments
     * @return the function result
     * @throws SupabaseException if the call fails
     */
    public JsonNode rpc(String function, JsonNode args) throws SupabaseException {
        return rpc(schema, function, args);
    }

    /**
     * Calls a stored procedure that lives in another schema than the configured one.
     *
     * @param functionSchema the schema holding the function
     * @param function       the function name
     * @param args           the named arguments
     * @return the function result
     * @throws SupabaseException if the call fails
     */
    public JsonNode rpc(String functionSchema, String function, JsonNode args) throws SupabaseException {
        HttpPost request = new HttpPost(baseUrl + "/rest/v1/rpc/" + encodeSegment(function));
        applyRestHeaders(request, functionSchema);
        request.setEntity(jsonEntity(args));

        logger.debug("Calling rpc {}.{}", functionSchema, function);
        return readJson(execute(request, "rpc " + function));
    }

    /**
     * Downloads an object from Storage.
     *
     * @param bucket the bucket name
     * @param path   the object key, may contain {@code /}
     * @return the raw object bytes
     * @throws SupabaseException if the object is missing or the download fails
     */
    public byte[] download(String bucket, String path) throws SupabaseException {
        StringBuilder url = new StringBuilder(baseUrl).append("/storage/v1/object/").append(encodeSegment(bucket));
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                url.append('/').append(encodeSegment(segment));
            }
        }
        HttpGet request = new HttpGet(url.toString());
        request.setHeader("apikey", serviceKey);
        request.setHeader("Authorization", "Bearer " + serviceKey);

        logger.debug("Downloading {}/{}", bucket, path);
        return execute(request, "download " + bucket + "/" + path);
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private byte[] execute(HttpUriRequestBase request, String operation) throws SupabaseException {
        RawResponse response;
        try {
            response = httpClient.execute(request, httpResponse -> {
                HttpEntity entity = httpResponse.getEntity();
                byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
                return new RawResponse(httpResponse.getCode(), body);
            });
        } catch (IOException e) {
            throw new SupabaseException(operation + " failed: " + e.getMessage(), e);
        }

        if (response.status < 200 || response.status >= 300) {
            String body = new String(response.body, StandardCharsets.UTF_8);
            logger.debug("{} returned HTTP {}: {}", operation, response.status, abbreviate(body));
            throw new SupabaseException(operation + " returned HTTP " + response.status, response.status, body);
        }
        return response.body;
    }

    private JsonNode readJson(byte[] body) throws SupabaseException {
        if (body.length == 0) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SupabaseException("Response is not valid JSON: " + e.getMessage(), e);
        }
    }

    private void applyRestHeaders(HttpUriRequestBase request, String profile) {
        request.setHeader("apikey", serviceKey);
        request.setHeader("Authorization", "Bearer " + serviceKey);
        request.setHeader("Content-Profile", profile);
        request.setHeader("Accept-Profile", profile);
    }

    private StringEntity jsonEntity(JsonNode body) throws SupabaseException {
        try {
            return new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON);
        } catch (JsonProcessingException e) {
            throw new SupabaseException("Could not serialize request body: " + e.getMessage(), e);
        }
    }

    private static CloseableHttpClient createHttpClient(Duration connectTimeout, Duration responseTimeout) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
            .setSocketTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
            .build();
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(connectionConfig)
            .setMaxConnTotal(MAX_CONNECTIONS)
            .setMaxConnPerRoute(MAX_CONNECTIONS)
            .build();
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
            .setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
            .build();
        return HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries()
            .build();
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String encodeQuery(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }

    private static final class RawResponse {
        private final int status;
        private final byte[] body;

        private RawResponse(int status, byte[] body) {
            this.status = status;
            this.body = body;
        }
    }
}
