package org.flowdesigner.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class SettingsHelper {
    public static final String DEFAULT_SETTINGS_RESOURCE = "designer-settings.json";
    private static final String SCHEMA_RESOURCE = "schemas/designer_settings_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads settings from a JSON file. The file is validated against the settings schema first.
     *
     * @param settingsFilePath path to the settings file
     * @return the loaded settings, with defaults for absent keys
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the document does not match the schema
     */
    public static DesignerSettings loadSettings(Path settingsFilePath) throws IOException {
        JsonNode settingsNode;
        try (InputStream in = Files.newInputStream(settingsFilePath)) {
            settingsNode = mapper.readTree(in);
        }
        validate(settingsNode, settingsFilePath.toString());
        return mapper.treeToValue(settingsNode, DesignerSettings.class);
    }

    /**
     * Loads the settings bundled on the classpath, falling back to built-in defaults when the resource is absent.
     */
    public static DesignerSettings loadDefaultSettings() {
        try (InputStream in = SettingsHelper.class.getClassLoader().getResourceAsStream(DEFAULT_SETTINGS_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using built-in defaults", DEFAULT_SETTINGS_RESOURCE);
                return DesignerSettings.defaults();
            }
            JsonNode settingsNode = mapper.readTree(in);
            validate(settingsNode, DEFAULT_SETTINGS_RESOURCE);
            return mapper.treeToValue(settingsNode, DesignerSettings.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings resource: " + DEFAULT_SETTINGS_RESOURCE, e);
        }
    }

    /**
     * Validates a settings document against the bundled JSON Schema.
     *
     * @throws IllegalArgumentException listing every schema violation
     */
    public static void validate(JsonNode settingsNode, String sourceName) {
        Set<ValidationMessage> errors = schema().validate(settingsNode);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Settings document '" + sourceName + "' is invalid: " + details);
        }
    }

    private static JsonSchema schema() {
        try (InputStream schemaStream = SettingsHelper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource: " + SCHEMA_RESOURCE, e);
        }
    }
}
