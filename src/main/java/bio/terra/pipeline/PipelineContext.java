package bio.terra.pipeline;

import static bio.terra.pipeline.PipelineMapper.getObjectMapper;

import bio.terra.pipeline.exception.JsonConversionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Data carrier of one pipeline run. Hooks read what earlier hooks wrote and write what later hooks
 * need; nothing else passes between them.
 *
 * <p>Hooks of a run execute one after another, so the context is not synchronized. A direct hook
 * with a timeout works on a private copy whose writes are applied only once the hook has finished.
 */
public class PipelineContext {
  private static final int MAX_LOGGED_VALUE_LENGTH = 500;

  private Map<String, Object> entries;

  public PipelineContext() {
    entries = new HashMap<>();
  }

  private PipelineContext(Map<String, Object> entries) {
    this.entries = entries;
  }

  /**
   * Typed lookup of an entry.
   *
   * @param key entry name
   * @param type expected type of the value
   * @return the value, or null when the context has no entry for the key
   * @throws ClassCastException when the value written by an earlier hook has another type
   */
  public <T> T get(String key, Class<T> type) {
    Object value = entries.get(key);
    if (value == null || type.isInstance(value)) {
      return type.cast(value);
    }
    throw new ClassCastException(
        String.format(
            "Context entry '%s' holds a %s, not a %s",
            key, value.getClass().getName(), type.getName()));
  }

  public <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
    T value = get(key, type);
    return (value == null) ? defaultValue : value;
  }

  public void put(String key, Object value) {
    entries.put(key, value);
  }

  public boolean containsKey(String key) {
    return entries.containsKey(key);
  }

  public Object remove(String key) {
    return entries.remove(key);
  }

  /** @return read-only view of the entry names */
  public Set<String> keySet() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  public int size() {
    return entries.size();
  }

  /** Shallow copy handed to a hook that runs off the run's thread. */
  PipelineContext copy() {
    return new PipelineContext(new HashMap<>(entries));
  }

  /** Take over the entries of a copy once the hook working on it has finished. */
  void replaceWith(PipelineContext finishedCopy) {
    entries = new HashMap<>(finishedCopy.entries);
  }

  /**
   * Render the entries as a JSON object.
   *
   * @throws JsonConversionException if a value cannot be serialized
   */
  public String toJson() {
    try {
      return getObjectMapper().writeValueAsString(entries);
    } catch (JsonProcessingException ex) {
      throw new JsonConversionException("Pipeline context could not be written as JSON", ex);
    }
  }

  /**
   * Replace every entry with the members of a JSON object. Values come back as plain JSON types:
   * maps, lists, strings, numbers and booleans.
   *
   * @param json JSON object
   * @throws JsonConversionException if the text is not a JSON object
   */
  public void fromJson(String json) {
    try {
      entries = getObjectMapper().readValue(json, new TypeReference<HashMap<String, Object>>() {});
    } catch (IOException ex) {
      throw new JsonConversionException("Pipeline context could not be read from JSON", ex);
    }
  }

  @Override
  public String toString() {
    return entries.entrySet().stream()
        .map(
            entry ->
                entry.getKey()
                    + "="
                    + StringUtils.abbreviate(
                        String.valueOf(entry.getValue()), MAX_LOGGED_VALUE_LENGTH))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
