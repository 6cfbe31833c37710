/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/** Writes/updates the {@code keymeta.json5.example} config template. */
final class ConfigTemplateWriter {

  private ConfigTemplateWriter() {}

  /**
   * Writes the example file if missing or if the contents changed.
   *
   * @param path destination path (usually next to {@code keymeta.json5})
   * @param contents canonical template to persist
   * @return {@code true} when the file was (re)written
   */
  static boolean writeExample(Path path, String contents) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(contents, "contents");

    try {
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      byte[] data = contents.getBytes(StandardCharsets.UTF_8);
      if (Files.exists(path) && Arrays.equals(Files.readAllBytes(path), data)) {
        return false;
      }
      Files.write(path, data);
      return true;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write config template: " + path, e);
    }
  }
}
