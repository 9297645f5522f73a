package wavemap.ui;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import wavemap.util.Vocabulary;

/**
 * Data-Class to hold tool options.
 */
public class WaveMapConfig {

  public String time_column_prefix = "time_";
  public String clock_label = "clock";
  public String default_label = "other";

  public boolean strict_port_blocks = false;
  public boolean include_flattened = true;
  public int flatten_passes = 1;

  /** Vocabulary YAML replacing the bundled one, null for the bundled one */
  public String vocabulary = null;

  /**
   * Reads options from a YAML file; keys not given keep their defaults.
   * @throws YAMLException if the file is not valid YAML for these options
   * @throws IllegalArgumentException if an option is out of range
   */
  public static WaveMapConfig load(Path file) throws IOException {
    Yaml yaml = new Yaml(new Constructor(WaveMapConfig.class, new LoaderOptions()));
    try (InputStream in = new FileInputStream(file.toFile())) {
      WaveMapConfig ret = yaml.load(in);
      if (ret == null)
        return new WaveMapConfig();
      if (ret.flatten_passes < 1)
        throw new IllegalArgumentException(file + ": flatten_passes must be at least 1, got " + ret.flatten_passes);
      return ret;
    }
  }

  public Vocabulary loadVocabulary() throws IOException {
    return vocabulary == null ? Vocabulary.getDefault() : Vocabulary.load(Path.of(vocabulary));
  }
}
