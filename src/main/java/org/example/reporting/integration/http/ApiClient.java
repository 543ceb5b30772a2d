package org.example.reporting.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Authenticated JSON GET against the BrowserStack APIs. One instance per report run,
 * bound to the header set produced by the authenticator.
 */
@Slf4j
public class ApiClient {

    private final RestTemplate restTemplate;
    private final HttpHeaders headers;
    private final ObjectMapper objectMapper;

    public ApiClient(RestTemplate restTemplate, HttpHeaders headers, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.headers = headers;
        this.objectMapper = objectMapper;
    }

    /**
     * @param urlTemplate URL with optional {@code {name}} path variables
     * @param query       query parameters; empty or null values are left out
     * @param pathVars    values for the path variables, encoded strictly
     */
    public JsonNode get(String urlTemplate, Map<String, String> query, Map<String, String> pathVars) {
        URI uri = buildUri(urlTemplate, query, pathVars);
        log.debug("GET {}", uri);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
            JsonNode body = response.getBody();
            return body != null ? body : MissingNode.getInstance();
        } catch (HttpStatusCodeException e) {
            throw new TransportException(e.getStatusCode().value(), uri.toString(), e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransportException(0, uri.toString(), null, e);
        } catch (RestClientException e) {
            throw new TransportException(0, uri.toString(), e.getMessage(), e);
        }
    }

    public JsonNode get(String url, Map<String, String> query) {
        return get(url, query, Map.of());
    }

    public <T> T get(String urlTemplate, Map<String, String> query, Map<String, String> pathVars, Class<T> type) {
        return bind(get(urlTemplate, query, pathVars), type);
    }

    public <T> T bind(JsonNode node, Class<T> type) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, type);
    }

    static URI buildUri(String urlTemplate, Map<String, String> query, Map<String, String> pathVars) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(urlTemplate);
        Map<String, String> vars = new HashMap<>(pathVars);
        if (query != null) {
            query.forEach((key, value) -> {
                if (value != null && !value.isEmpty()) {
                    String varName = "q_" + vars.size();
                    builder.queryParam(key, "{" + varName + "}");
                    vars.put(varName, value);
                }
            });
        }
        return builder.encode().buildAndExpand(vars).toUri();
    }
}
