package dev.mcpr.server.resource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mcpr.error.McpException;
import dev.mcpr.schema.Resource;
import dev.mcpr.schema.ResourceContents;
import dev.mcpr.schema.ResourceTemplate;
import dev.mcpr.server.ResourcesProvider;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serves canned user and product records as JSON resources.
 * {@code resource://user_info/<id>} and {@code resource://product_info/<id>} address single records;
 * the bare URIs return the record with id {@code 1}.
 */
@Component
@RequiredArgsConstructor
public class InfoResourcesProvider implements ResourcesProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(InfoResourcesProvider.class);

    static final String USER_INFO = "resource://user_info";
    static final String PRODUCT_INFO = "resource://product_info";
    private static final String JSON = "application/json";

    private final ObjectMapper objectMapper;

    @Override
    public List<Resource> getResources() {
        return List.of(
            new Resource(USER_INFO, "user_info", "Information about a user", JSON),
            new Resource(PRODUCT_INFO, "product_info", "Details of a product", JSON));
    }

    @Override
    public List<ResourceTemplate> getResourceTemplates() {
        return List.of(
            new ResourceTemplate(USER_INFO + "/{user_id}", "user_info", "Information about a user by id", JSON),
            new ResourceTemplate(PRODUCT_INFO + "/{product_id}", "product_info", "Details of a product by id", JSON));
    }

    @Override
    public ResourceContents getResource(String uri) throws McpException {
        LOGGER.debug("Reading resource {}", uri);
        ObjectNode record;
        if (uri.equals(USER_INFO) || uri.startsWith(USER_INFO + "/")) {
            record = objectMapper.createObjectNode()
                .put("id", idOf(uri, USER_INFO))
                .put("name", "Test User")
                .put("email", "user@example.com");
        } else if (uri.equals(PRODUCT_INFO) || uri.startsWith(PRODUCT_INFO + "/")) {
            record = objectMapper.createObjectNode()
                .put("id", idOf(uri, PRODUCT_INFO))
                .put("name", "Test Product")
                .put("description", "This is a test product");
        } else {
            throw McpException.notFound("Resource " + uri);
        }
        try {
            return new ResourceContents(uri, JSON, objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw McpException.serialization(e.getOriginalMessage(), e);
        }
    }

    private static String idOf(String uri, String base) {
        return uri.length() > base.length() + 1 ? uri.substring(base.length() + 1) : "1";
    }
}
