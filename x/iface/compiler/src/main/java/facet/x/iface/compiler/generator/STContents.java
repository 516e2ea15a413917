package facet.x.iface.compiler.generator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.stringtemplate.v4.ST;

/**
 * A StringTemplate rendered against a model. Templates address the model as {@code mdl} and read
 * it through JavaBean-style getters.
 */
public final class STContents {

  private final ST st;

  public STContents(String template, Object model) {
    this.st = new ST(template);
    this.st.add("mdl", model);
  }

  /**
   * Writes the rendered contents to a file, replacing it if present.
   *
   * @param file the target file
   * @throws IOException if the file cannot be written
   */
  public void write(File file) throws IOException {
    Files.writeString(file.toPath(), toString(), StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return st.render();
  }
}
