package br.rio.confere.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.regex.Pattern;

/**
 * Shared Jackson configuration for run artifacts.
 */
public final class JsonMappers {
  private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

  private JsonMappers() {
    // Utility
  }

  /**
   * Mapper used for every JSON artifact: ISO-8601 instants, indented output, unknown properties ignored.
   *
   * @return new mapper instance
   */
  public static ObjectMapper artifacts() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  /**
   * Turns a processo or run identifier into a file-name stem.
   *
   * <p>{@code SMS-PRO-2024/01234} becomes {@code SMS-PRO-2024_01234}.</p>
   *
   * @param id identifier text
   * @return file-safe stem
   */
  public static String fileStem(String id) {
    String stem = UNSAFE_FILE_CHARS.matcher(id.trim()).replaceAll("_");
    if (stem.isEmpty() || stem.chars().allMatch(c -> c == '.')) {
      throw new IllegalArgumentException("identifier cannot name a file: " + id);
    }
    return stem;
  }
}
