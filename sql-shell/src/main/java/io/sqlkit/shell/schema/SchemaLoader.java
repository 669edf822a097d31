package io.sqlkit.shell.schema;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.sqlkit.core.completion.SchemaField;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the schema of a stream from JSON.
 *
 * <p>Accepted shapes:
 *
 * <pre>
 * {"fields": [{"name": "level", "data_type": "Utf8"}, ...]}
 * [{"name": "level", "data_type": "Utf8"}, ...]
 * </pre>
 *
 * <p>{@code data_type} may be a plain string or any JSON value, e.g. {@code {"Timestamp":
 * ["Millisecond", null]}}; non-string values are kept as compact JSON text.
 */
public final class SchemaLoader {

  private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

  public List<SchemaField> load(Path path) throws SchemaLoadException {
    String json;
    try {
      json = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new SchemaLoadException(
          SchemaLoadException.ErrorType.IO_ERROR, "Cannot read schema file " + path, e);
    }
    List<SchemaField> fields = parse(json);
    log.info("Loaded {} fields from {}", fields.size(), path);
    return fields;
  }

  public List<SchemaField> parse(String json) throws SchemaLoadException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new SchemaLoadException(
          SchemaLoadException.ErrorType.MALFORMED_JSON, "Schema is not valid JSON", e);
    }

    JsonArray array;
    if (root.isJsonArray()) {
      array = root.getAsJsonArray();
    } else if (root.isJsonObject() && root.getAsJsonObject().has("fields")) {
      JsonElement fields = root.getAsJsonObject().get("fields");
      if (!fields.isJsonArray()) {
        throw invalid("'fields' must be an array");
      }
      array = fields.getAsJsonArray();
    } else {
      throw invalid("Expected an array of fields or an object with a 'fields' array");
    }

    List<SchemaField> result = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      result.add(toField(array.get(i), i));
    }
    return result;
  }

  private static SchemaField toField(JsonElement element, int index) throws SchemaLoadException {
    if (!element.isJsonObject()) {
      throw invalid("Field #" + index + " is not an object");
    }
    JsonObject obj = element.getAsJsonObject();
    JsonElement name = obj.get("name");
    if (name == null || !name.isJsonPrimitive()) {
      throw invalid("Field #" + index + " has no name");
    }
    return new SchemaField(name.getAsString(), dataType(obj.get("data_type")));
  }

  private static String dataType(JsonElement type) {
    if (type == null || type.isJsonNull()) {
      return null;
    }
    if (type.isJsonPrimitive() && type.getAsJsonPrimitive().isString()) {
      return type.getAsString();
    }
    return type.toString();
  }

  private static SchemaLoadException invalid(String message) {
    return new SchemaLoadException(SchemaLoadException.ErrorType.INVALID_SCHEMA, message);
  }
}
