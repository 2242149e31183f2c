package com.hartwig.varpipe.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

public class DefinitionReader {
    public static final String DEFAULT_TOOLS_RESOURCE = "default-tools.yaml";

    private final ObjectMapper objectMapper;

    public DefinitionReader() {
        objectMapper = new ObjectMapper(new YAMLFactory());
        objectMapper.registerModule(new Jdk8Module());
    }

    public ToolsDefinition readTools(InputStream toolsDefinition) throws IOException {
        return objectMapper.readValue(toolsDefinition, ToolsDefinition.class);
    }

    public ToolsDefinition readDefaultTools() throws IOException {
        try (var stream = DefinitionReader.class.getClassLoader().getResourceAsStream(DEFAULT_TOOLS_RESOURCE)) {
            if (stream == null) {
                throw new IOException("Missing classpath resource " + DEFAULT_TOOLS_RESOURCE);
            }
            return readTools(stream);
        }
    }
}
