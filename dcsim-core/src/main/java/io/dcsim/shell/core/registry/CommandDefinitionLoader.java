package io.dcsim.shell.core.registry;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads tool definitions from the JSON catalogue. The catalogue is either a directory of
 * {@code *.json} files or a classpath index: a JSON array of file names resolved next to the index
 * resource.
 *
 * <p>Objects without a {@code command} key are skipped, as is {@code schema.json}. A later
 * definition for the same command replaces an earlier one.
 */
public class CommandDefinitionLoader {
  private static final Logger LOG = LoggerFactory.getLogger(CommandDefinitionLoader.class);

  /** Bundled catalogue index on the classpath. */
  public static final String DEFAULT_INDEX = "/commands/index.json";

  static final Gson GSON =
      new GsonBuilder()
          .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
          .create();

  private final Path directory;
  private final String indexResource;

  private CommandDefinitionLoader(Path directory, String indexResource) {
    this.directory = directory;
    this.indexResource = indexResource;
  }

  /** Loader for every {@code *.json} file in {@code directory}. */
  public static CommandDefinitionLoader fromDirectory(Path directory) {
    return new CommandDefinitionLoader(Objects.requireNonNull(directory, "directory"), null);
  }

  /** Loader for the files listed by a classpath index resource. */
  public static CommandDefinitionLoader fromClasspath(String indexResource) {
    return new CommandDefinitionLoader(null, Objects.requireNonNull(indexResource, "index"));
  }

  public static CommandDefinitionLoader bundled() {
    return fromClasspath(DEFAULT_INDEX);
  }

  /** Describes where definitions come from, for log and error messages. */
  public String describe() {
    return directory != null ? directory.toString() : "classpath:" + indexResource;
  }

  /**
   * Loads every definition.
   *
   * @return definitions keyed by command name, in load order
   * @throws CommandDefinitionException if the catalogue is missing or a file is malformed
   */
  public Map<String, CommandDefinition> loadAll() throws CommandDefinitionException {
    Map<String, CommandDefinition> out = new LinkedHashMap<>();
    if (directory != null) {
      for (Path file : listDirectory(directory)) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
          add(out, parse(file.toString(), reader));
        } catch (IOException e) {
          throw new CommandDefinitionException(file.toString(), "cannot read", e);
        }
      }
    } else {
      for (String name : readIndex(indexResource)) {
        String resource = resolveSibling(indexResource, name);
        try (InputStream in = CommandDefinitionLoader.class.getResourceAsStream(resource)) {
          if (in == null) {
            throw new CommandDefinitionException(resource, "listed in index but not found");
          }
          add(out, parse(resource, new InputStreamReader(in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
          throw new CommandDefinitionException(resource, "cannot read", e);
        }
      }
    }
    LOG.debug("Loaded {} command definitions from {}", out.size(), describe());
    return out;
  }

  private static void add(Map<String, CommandDefinition> out, CommandDefinition def) {
    if (def == null) {
      return;
    }
    if (out.put(def.command(), def) != null) {
      LOG.warn("Duplicate definition for '{}', keeping the last one", def.command());
    }
  }

  /**
   * Parses one catalogue document.
   *
   * @param source name used in error messages
   * @return the definition, or null if the document is not a command definition
   */
  static CommandDefinition parse(String source, Reader reader) throws CommandDefinitionException {
    try {
      JsonElement root = JsonParser.parseReader(reader);
      if (!root.isJsonObject()) {
        LOG.warn("Skipping {}: not a JSON object", source);
        return null;
      }
      JsonObject obj = root.getAsJsonObject();
      if (!obj.has("command") || !obj.get("command").isJsonPrimitive()) {
        LOG.warn("Skipping {}: no 'command' key", source);
        return null;
      }
      return GSON.fromJson(obj, CommandDefinition.class);
    } catch (JsonParseException | IllegalStateException | NullPointerException e) {
      throw new CommandDefinitionException(source, "malformed definition: " + e.getMessage(), e);
    }
  }

  private static List<Path> listDirectory(Path dir) throws CommandDefinitionException {
    if (!Files.isDirectory(dir)) {
      throw new CommandDefinitionException(dir.toString(), "not a directory");
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(p -> p.getFileName().toString().endsWith(".json"))
          .filter(p -> !p.getFileName().toString().equals("schema.json"))
          .filter(p -> !p.getFileName().toString().equals("index.json"))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new CommandDefinitionException(dir.toString(), "cannot list", e);
    }
  }

  private static List<String> readIndex(String resource) throws CommandDefinitionException {
    try (InputStream in = CommandDefinitionLoader.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new CommandDefinitionException(resource, "catalogue index not found");
      }
      JsonElement root = JsonParser.parseReader(new InputStreamReader(in, StandardCharsets.UTF_8));
      if (!root.isJsonArray()) {
        throw new CommandDefinitionException(resource, "index must be a JSON array of file names");
      }
      JsonArray array = root.getAsJsonArray();
      List<String> names = new ArrayList<>(array.size());
      for (JsonElement e : array) {
        String name = e.getAsString();
        if (!name.equals("schema.json")) {
          names.add(name);
        }
      }
      return names;
    } catch (IOException e) {
      throw new CommandDefinitionException(resource, "cannot read index", e);
    } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
      throw new CommandDefinitionException(resource, "malformed index: " + e.getMessage(), e);
    }
  }

  private static String resolveSibling(String indexResource, String name) {
    int slash = indexResource.lastIndexOf('/');
    return slash < 0 ? name : indexResource.substring(0, slash + 1) + name;
  }
}
