/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;

/** Keeps {@code tradepost.json5.example} in sync with the bundled template. */
final class ConfigTemplateWriter {

  private ConfigTemplateWriter() {}

  /**
   * Writes the example file when it is missing or stale. Unchanged files are not touched so their
   * modification time stays meaningful to operators.
   *
   * @param path destination path (usually {@code config/tradepost.json5.example})
   * @param contents canonical template to persist
   * @return {@code true} when the file was written
   */
  static boolean writeExample(Path path, String contents) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(contents, "contents");

    byte[] data = contents.getBytes(StandardCharsets.UTF_8);
    try {
      if (Files.exists(path) && Arrays.equals(Files.readAllBytes(path), data)) {
        return false;
      }
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
      Files.write(tmp, data);
      Files.move(
          tmp,
          path,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
      return true;
    } catch (IOException e) {
      throw new RuntimeException("Failed to write config template: " + path, e);
    }
  }
}
