package wavemap.ui;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;
import wavemap.util.Vocabulary;

class WaveMapConfigTest {

  @Test
  void testDefaults() throws IOException {
    WaveMapConfig cfg = new WaveMapConfig();
    Assertions.assertEquals("time_", cfg.time_column_prefix);
    Assertions.assertTrue(cfg.include_flattened);
    Assertions.assertFalse(cfg.strict_port_blocks);
    Assertions.assertSame(Vocabulary.getDefault(), cfg.loadVocabulary());
  }

  @Test
  void testLoad(@TempDir Path dir) throws IOException {
    Path vocabulary = dir.resolve("words.yaml");
    Files.writeString(vocabulary, "fsm_states: [WAIT]\n");
    Path file = dir.resolve("wavemap.yaml");
    Files.writeString(file, "strict_port_blocks: true\nflatten_passes: 3\nclock_label: clk\nvocabulary: " + vocabulary + "\n");

    WaveMapConfig cfg = WaveMapConfig.load(file);
    Assertions.assertTrue(cfg.strict_port_blocks);
    Assertions.assertEquals(3, cfg.flatten_passes);
    Assertions.assertEquals("clk", cfg.clock_label);
    Assertions.assertEquals("other", cfg.default_label);
    Assertions.assertTrue(cfg.loadVocabulary().isFsmState("WAIT"));
  }

  @Test
  void testEmptyFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("empty.yaml");
    Files.writeString(file, "");
    Assertions.assertEquals(1, WaveMapConfig.load(file).flatten_passes);
  }

  @Test
  void testInvalidFile(@TempDir Path dir) throws IOException {
    Path passes = dir.resolve("passes.yaml");
    Files.writeString(passes, "flatten_passes: 0\n");
    Assertions.assertThrows(IllegalArgumentException.class, () -> WaveMapConfig.load(passes));
    Path malformed = dir.resolve("malformed.yaml");
    Files.writeString(malformed, "flatten_passes: [1\n");
    Assertions.assertThrows(YAMLException.class, () -> WaveMapConfig.load(malformed));
  }
}
