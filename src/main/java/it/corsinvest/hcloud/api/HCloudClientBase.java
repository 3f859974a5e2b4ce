/*
 * SPDX-FileCopyrightText: Copyright Corsinvest Srl
 * SPDX-License-Identifier: GPL-3.0-only
 */
package it.corsinvest.hcloud.api;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.HttpURLConnection;
import java.net.Proxy;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.corsinvest.hcloud.api.schema.Schema;

/**
 * Hetzner Cloud Client Base
 */
public class HCloudClientBase {

    private static final Logger logger = Logger.getLogger(HCloudClientBase.class.getName());

    /**
     * Default API endpoint.
     */
    public static final String DEFAULT_ENDPOINT = "https://api.hetzner.cloud/v1";

    /**
     * Client version sent in the User-Agent header.
     */
    public static final String VERSION = "1.0.0";

    private String _token;
    private String _endpoint = DEFAULT_ENDPOINT;
    private Proxy _proxy = Proxy.NO_PROXY;
    private int _timeout = 0;
    private boolean _validateCertificate = true;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public HCloudClientBase(String token) {
        _token = token;
    }

    public HCloudClientBase(String token, String endpoint) {
        _token = token;
        setEndpoint(endpoint);
    }

    /**
     * Get API token
     *
     * @return String API token
     */
    public String getToken() {
        return _token;
    }

    /**
     * Set API token, sent as bearer token on every request.
     *
     * @param token API token
     */
    public void setToken(String token) {
        _token = token;
    }

    /**
     * Get endpoint
     *
     * @return String API endpoint without trailing slash
     */
    public String getEndpoint() {
        return _endpoint;
    }

    /**
     * Set endpoint
     *
     * @param endpoint API endpoint, for example {@value #DEFAULT_ENDPOINT}
     */
    public void setEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint can not be empty");
        }
        _endpoint = endpoint.endsWith("/")
                ? endpoint.substring(0, endpoint.length() - 1)
                : endpoint;
    }

    /**
     * Get Validate Certificate
     *
     * @return boolean Whether SSL certificate validation is enabled
     */
    public boolean getValidateCertificate() {
        return _validateCertificate;
    }

    /**
     * Set Validate Certificate
     *
     * @param validateCertificate Whether to validate SSL certificates
     */
    public void setValidateCertificate(boolean validateCertificate) {
        _validateCertificate = validateCertificate;
    }

    /**
     * Get proxy
     *
     * @return Proxy Current proxy configuration
     */
    public Proxy getProxy() {
        return _proxy;
    }

    /**
     * Set proxy
     *
     * @param proxy Proxy configuration to use
     */
    public void setProxy(Proxy proxy) {
        _proxy = proxy != null ? proxy : Proxy.NO_PROXY;
    }

    /**
     * Set timeout, applied to both connect and read
     *
     * @param timeout Timeout in milliseconds, 0 means no timeout
     */
    public void setTimeout(int timeout) {
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout can not be negative");
        }
        _timeout = timeout;
    }

    /**
     * Return timeout
     *
     * @return int Timeout in milliseconds
     */
    public int getTimeout() {
        return _timeout;
    }

    /**
     * Returns the base URL used to interact with the API.
     *
     * @return The API URL.
     */
    public String getApiUrl() {
        return _endpoint;
    }

    /**
     * Execute method GET
     *
     * @param resource   URL request
     * @param parameters Query string parameters
     * @return Response
     * @throws HCloudException on transport or API error
     */
    public Response get(String resource, Map<String, Object> parameters) throws HCloudException {
        return executeAction(resource, MethodType.GET, parameters);
    }

    /**
     * Execute method PUT
     *
     * @param resource   URL request
     * @param parameters JSON body
     * @return Response
     * @throws HCloudException on transport or API error
     */
    public Response set(String resource, Map<String, Object> parameters) throws HCloudException {
        return executeAction(resource, MethodType.SET, parameters);
    }

    /**
     * Execute method POST
     *
     * @param resource   URL request
     * @param parameters JSON body
     * @return Response
     * @throws HCloudException on transport or API error
     */
    public Response create(String resource, Map<String, Object> parameters) throws HCloudException {
        return executeAction(resource, MethodType.CREATE, parameters);
    }

    /**
     * Execute method DELETE
     *
     * @param resource   URL request
     * @param parameters Query string parameters
     * @return Response
     * @throws HCloudException on transport or API error
     */
    public Response delete(String resource, Map<String, Object> parameters) throws HCloudException {
        return executeAction(resource, MethodType.DELETE, parameters);
    }

    /**
     * Fetch every page, starting at page 1, until the response carries no
     * pagination metadata or reports the last page.
     *
     * @param <T>     domain type of the items
     * @param fetcher page fetcher
     * @return List all items in page order
     * @throws HCloudException the first error of any page; items read so far are dropped
     */
    public <T> List<T> all(PageFetcher<T> fetcher) throws HCloudException {
        var items = new ArrayList<T>();
        var page = 1;
        while (true) {
            var result = fetcher.fetch(page);
            items.addAll(result.getItems());

            var pagination = result.getResponse() != null
                    ? result.getResponse().getPagination()
                    : null;
            if (pagination == null || pagination.isLastPage(page)) {
                return items;
            }
            page++;
        }
    }

    /**
     * Convert a field of the response body into a wire type.
     *
     * @param <T>      wire type
     * @param response response
     * @param field    top level field name
     * @param type     wire type class
     * @return T or null when the field is absent or null
     * @throws HCloudExceptionTransport when the field does not match the wire type
     */
    public <T> T readField(Response response, String field, Class<T> type) throws HCloudExceptionTransport {
        var body = response.getBody();
        if (body == null || !body.hasNonNull(field)) {
            return null;
        }
        try {
            return objectMapper.treeToValue(body.get(field), type);
        } catch (JsonProcessingException ex) {
            throw new HCloudExceptionTransport("Invalid '" + field + "' in response", ex);
        }
    }

    /**
     * Convert an array field of the response body into a list of wire types.
     *
     * @param <T>      wire type
     * @param response response
     * @param field    top level field name
     * @param type     wire type class
     * @return List empty when the field is absent
     * @throws HCloudExceptionTransport when an element does not match the wire type
     */
    public <T> List<T> readList(Response response, String field, Class<T> type) throws HCloudExceptionTransport {
        var ret = new ArrayList<T>();
        var body = response.getBody();
        if (body == null || !body.hasNonNull(field)) {
            return ret;
        }
        try {
            for (JsonNode item : body.get(field)) {
                ret.add(objectMapper.treeToValue(item, type));
            }
        } catch (JsonProcessingException ex) {
            throw new HCloudExceptionTransport("Invalid '" + field + "' in response", ex);
        }
        return ret;
    }

    private void setHeaders(HttpURLConnection httpCon) {
        if (_token != null && !_token.isEmpty()) {
            httpCon.setRequestProperty("Authorization", "Bearer " + _token);
        }
        httpCon.setRequestProperty("User-Agent", "cv4hcloud-api-java/" + VERSION);
        httpCon.setRequestProperty("Accept", "application/json");
    }

    private void setConnectionTimeout(HttpURLConnection httpCon) {
        if (_timeout > 0) {
            httpCon.setConnectTimeout(_timeout);
            httpCon.setReadTimeout(_timeout);
        }
    }

    /**
     * Configure SSL context for a specific HTTPS connection (not global)
     *
     * @param httpsConn The HTTPS connection to configure
     */
    private void configureTrustAllSSL(HttpsURLConnection httpsConn) {
        if (!_validateCertificate) {
            try {
                var trustAllCerts = new TrustManager[] {
                    new X509TrustManager() {
                        @Override
                        public X509Certificate[] getAcceptedIssuers() {
                            return new X509Certificate[0];
                        }
                        @Override
                        public void checkClientTrusted(X509Certificate[] certs, String authType) {
                        }
                        @Override
                        public void checkServerTrusted(X509Certificate[] certs, String authType) {
                        }
                    }
                };

                var sc = SSLContext.getInstance("TLS");
                sc.init(null, trustAllCerts, new java.security.SecureRandom());

                httpsConn.setSSLSocketFactory(sc.getSocketFactory());
                httpsConn.setHostnameVerifier((hostname, session) -> true);

            } catch (NoSuchAlgorithmException | KeyManagementException ex) {
                logger.log(Level.SEVERE, "Failed to configure SSL", ex);
            }
        }
    }

    /**
     * Build URL-encoded query string from parameters
     *
     * @param params Parameters to encode
     * @return URL-encoded query string
     */
    private String buildQueryString(Map<String, Object> params) {
        var query = new StringBuilder();
        params.forEach((key, value) -> {
            if (query.length() > 0) {
                query.append("&");
            }
            query.append(URLEncoder.encode(key, StandardCharsets.UTF_8))
                 .append("=")
                 .append(URLEncoder.encode(value.toString(), StandardCharsets.UTF_8));
        });
        return query.toString();
    }

    /**
     * Read response from HTTP connection, handling both success and error streams
     *
     * @param httpCon HTTP connection
     * @param statusCode HTTP status code
     * @return Response body as string
     * @throws IOException if reading fails
     */
    private String readResponse(HttpURLConnection httpCon, int statusCode) throws IOException {
        var stream = (statusCode >= 200 && statusCode < 400)
            ? httpCon.getInputStream()
            : httpCon.getErrorStream();

        if (stream == null) {
            return "";
        }

        try (stream) {
            var out = new ByteArrayOutputStream();
            stream.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        }
    }

    private Pagination readPagination(JsonNode body) throws HCloudExceptionTransport {
        if (body == null || !body.path("meta").hasNonNull("pagination")) {
            return null;
        }
        try {
            var meta = objectMapper.treeToValue(body.get("meta"), Schema.Meta.class);
            return SchemaConverter.toPagination(meta.pagination);
        } catch (JsonProcessingException ex) {
            throw new HCloudExceptionTransport("Invalid pagination metadata", ex);
        }
    }

    private HCloudException errorFromResponse(Response response) {
        if (response.responseInError()) {
            var error = response.getBody().get("error");
            return new HCloudExceptionApi(response,
                    error.path("code").asText(),
                    error.path("message").asText());
        }
        return new HCloudException(response, "server responded with status code " + response.getStatusCode());
    }

    private Response executeAction(String resource, MethodType methodType, Map<String, Object> parameters)
            throws HCloudException {
        if (Thread.currentThread().isInterrupted()) {
            throw new HCloudExceptionTransport("Request interrupted: " + resource,
                    new InterruptedIOException("thread interrupted"));
        }

        var url = getApiUrl() + resource;
        var httpMethod = methodType.getHttpMethod();

        var params = new LinkedHashMap<String, Object>();
        if (parameters != null) {
            parameters.entrySet().stream().filter((entry) -> (entry.getValue() != null)).forEachOrdered((entry) -> {
                params.put(entry.getKey(), entry.getValue());
            });
        }

        var statusCode = 0;
        var reasonPhrase = "";
        JsonNode body = null;
        Map<String, List<String>> headers = null;

        try {
            HttpURLConnection httpCon;
            switch (methodType) {
                case GET:
                case DELETE: {
                    if (!params.isEmpty()) {
                        url += "?" + buildQueryString(params);
                    }

                    httpCon = openConnection(url);
                    httpCon.setRequestMethod(httpMethod);
                    setConnectionTimeout(httpCon);
                    setHeaders(httpCon);
                    break;
                }

                case SET:
                case CREATE: {
                    var data = objectMapper.writeValueAsBytes(params);
                    httpCon = openConnection(url);
                    httpCon.setRequestMethod(httpMethod);
                    httpCon.setRequestProperty("Content-Type", "application/json; charset=UTF-8");
                    setConnectionTimeout(httpCon);
                    setHeaders(httpCon);

                    httpCon.setDoOutput(true);
                    httpCon.setFixedLengthStreamingMode(data.length);
                    try (var out = httpCon.getOutputStream()) {
                        out.write(data);
                    }
                    break;
                }

                default:
                    throw new AssertionError();
            }

            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Method: {0}, Url: {1}", new Object[] { httpMethod, url });
                if ((methodType == MethodType.SET || methodType == MethodType.CREATE) && !params.isEmpty()) {
                    var paramsStr = new StringBuilder("Parameters:");
                    params.forEach((key, value) -> paramsStr.append("\n  ").append(key).append(" : ").append(value));
                    logger.fine(paramsStr.toString());
                }
            }

            statusCode = httpCon.getResponseCode();
            reasonPhrase = httpCon.getResponseMessage();
            headers = httpCon.getHeaderFields();

            var responseBody = readResponse(httpCon, statusCode);
            if (!responseBody.isBlank()) {
                try {
                    body = objectMapper.readTree(responseBody);
                } catch (JsonProcessingException ex) {
                    // error pages from proxies are not JSON
                    if (statusCode >= 200 && statusCode < 300) {
                        throw ex;
                    }
                }
            }
        } catch (IOException ex) {
            throw new HCloudExceptionTransport("Error executing request " + httpMethod + " " + resource, ex);
        }

        var response = new Response(body,
                statusCode,
                reasonPhrase,
                headers,
                resource,
                Collections.unmodifiableMap(params),
                methodType,
                readPagination(body));

        if (logger.isLoggable(Level.FINER)) {
            logger.log(Level.FINER, """
                    Response: {0}
                    StatusCode: {1}
                    ReasonPhrase: {2}
                    IsSuccessStatusCode: {3}
                    =============================
                    """,
                    new Object[] {
                            body != null ? body.toPrettyString() : "null",
                            response.getStatusCode(),
                            response.getReasonPhrase(),
                            response.isSuccessStatusCode()
                    });
        } else if (logger.isLoggable(Level.FINE)) {
            logger.fine("=============================");
        }

        if (!response.isSuccessStatusCode()) {
            throw errorFromResponse(response);
        }
        return response;
    }

    private HttpURLConnection openConnection(String url) throws IOException {
        var httpCon = (HttpURLConnection) URI.create(url).toURL().openConnection(_proxy);
        if (httpCon instanceof HttpsURLConnection httpsConn) {
            configureTrustAllSSL(httpsConn);
        }
        return httpCon;
    }
}
