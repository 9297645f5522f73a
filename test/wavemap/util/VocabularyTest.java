package wavemap.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VocabularyTest {

  @ParameterizedTest
  @ValueSource(strings = {"module", "always", "always_ff", "assign", "if", "else", "begin", "end", "wire", "logic"})
  void testDefaultKeywords(String word) {
    Assertions.assertTrue(Vocabulary.getDefault().isKeyword(word));
  }

  @Test
  void testDefaultMarkers() {
    Vocabulary vocabulary = Vocabulary.getDefault();
    Assertions.assertTrue(vocabulary.isFsmState("IDLE"));
    Assertions.assertTrue(vocabulary.isEmptyValue(null));
    Assertions.assertTrue(vocabulary.isEmptyValue("  "));
    Assertions.assertTrue(vocabulary.isEmptyValue(" - "));
    Assertions.assertTrue(vocabulary.isEmptyValue("?"));
    Assertions.assertFalse(vocabulary.isEmptyValue("x"));
    Assertions.assertFalse(vocabulary.isEmptyValue("z"));
    Assertions.assertFalse(vocabulary.isEmptyValue("0"));
  }

  @Test
  void testPartialFileKeepsDefaults(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("vocabulary.yaml");
    Files.writeString(file, "fsm_states:\n  - WAIT\n  - DONE\nempty_markers: none\n");
    Vocabulary vocabulary = Vocabulary.load(file);
    Assertions.assertTrue(vocabulary.isFsmState("WAIT"));
    Assertions.assertFalse(vocabulary.isFsmState("IDLE"));
    Assertions.assertTrue(vocabulary.isKeyword("module"));
    Assertions.assertTrue(vocabulary.isEmptyValue("-"));
  }
}
