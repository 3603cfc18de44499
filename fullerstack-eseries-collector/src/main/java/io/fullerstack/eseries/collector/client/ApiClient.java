package io.fullerstack.eseries.collector.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Map;

/**
 * Read access to the SANtricity management API.
 */
public interface ApiClient {

    /**
     * Issue a GET request and parse the JSON response.
     *
     * @param path    Path below the API root (e.g., "/devmgr/v2/storage-systems/{id}/failures")
     * @param params  Query parameters, may be empty
     * @param timeout Read timeout of this request
     * @return Parsed response body
     * @throws ApiException on network failure, non-2xx status or unparseable body
     */
    JsonNode get(String path, Map<String, String> params, Duration timeout);

    default JsonNode get(String path, Duration timeout) {
        return get(path, Map.of(), timeout);
    }
}
