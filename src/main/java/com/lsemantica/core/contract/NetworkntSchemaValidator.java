package com.lsemantica.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.PathType;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SchemaValidator} backed by the networknt draft 2020-12 validator. Schemas are loaded
 * once from the classpath and cached.
 */
@Component
public class NetworkntSchemaValidator implements SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(NetworkntSchemaValidator.class);

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private final Map<ContractName, JsonSchema> schemas = new ConcurrentHashMap<>();

    @Override
    public List<ContractValidationIssue> validate(ContractName contract, JsonNode document) {
        JsonSchema schema = schemas.computeIfAbsent(contract, this::loadSchema);
        Set<ValidationMessage> messages = schema.validate(document);
        log.debug("{} schema validation produced {} message(s)", contract.displayName(), messages.size());
        return messages.stream()
                .map(NetworkntSchemaValidator::toIssue)
                .sorted(Comparator.comparing(ContractValidationIssue::instancePath)
                        .thenComparing(ContractValidationIssue::keyword)
                        .thenComparing(ContractValidationIssue::message))
                .toList();
    }

    private JsonSchema loadSchema(ContractName contract) {
        String resource = contract.schemaResource();
        if (resource == null) {
            throw new IllegalArgumentException(contract.displayName() + " has no JSON Schema");
        }
        SchemaValidatorsConfig config = new SchemaValidatorsConfig();
        config.setPathType(PathType.JSON_POINTER);
        try (InputStream in = NetworkntSchemaValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + resource);
            }
            log.debug("Loaded {} schema from {}", contract.displayName(), resource);
            return factory.getSchema(in, config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load schema " + resource, e);
        }
    }

    private static ContractValidationIssue toIssue(ValidationMessage message) {
        String path = message.getPath() == null ? "" : message.getPath();
        if ("/".equals(path) || "$".equals(path)) {
            path = "";
        }
        String text = message.getMessage();
        String prefix = message.getPath() + ": ";
        if (text != null && text.startsWith(prefix)) {
            text = text.substring(prefix.length());
        }
        return new ContractValidationIssue(path, message.getType(), text);
    }
}
