package br.rio.confere.infrastructure.persistence;

import br.rio.confere.application.error.ParsingException;
import br.rio.confere.application.port.ConformityPairSource;
import br.rio.confere.domain.conformity.ConformityPair;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link ConformityPairSource} over a directory of {@code <name>.pair.json} documents, listed by name.
 */
public final class JsonPairSource implements ConformityPairSource {
  static final String SUFFIX = ".pair.json";

  private final Path directory;
  private final ObjectMapper mapper = JsonMappers.artifacts();

  public JsonPairSource(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public List<String> names() {
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .map(path -> path.getFileName().toString())
          .filter(name -> name.endsWith(SUFFIX))
          .map(name -> name.substring(0, name.length() - SUFFIX.length()))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException ex) {
      throw new ParsingException("unable to list pairs in " + directory, ex);
    }
  }

  @Override
  public ConformityPair read(String name) {
    Path file = directory.resolve(name + SUFFIX);
    try {
      ConformityPair pair = mapper.readValue(file.toFile(), ConformityPair.class);
      if (pair == null) {
        throw new ParsingException("pair document is empty: " + file);
      }
      return pair;
    } catch (IOException ex) {
      throw new ParsingException("unable to read pair " + file + ": " + ex.getMessage(), ex);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new ParsingException("invalid pair " + file + ": " + ex.getMessage(), ex);
    }
  }
}
