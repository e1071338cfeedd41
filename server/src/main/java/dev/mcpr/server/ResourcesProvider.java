package dev.mcpr.server;

import dev.mcpr.error.McpException;
import dev.mcpr.schema.Resource;
import dev.mcpr.schema.ResourceContents;
import dev.mcpr.schema.ResourceTemplate;
import java.util.List;

public interface ResourcesProvider {

    List<Resource> getResources();

    ResourceContents getResource(String uri) throws McpException;

    default List<ResourceTemplate> getResourceTemplates() {
        return List.of();
    }
}
