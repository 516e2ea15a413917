package facet.x.iface.compiler.generator;

import java.util.List;

/**
 * A generated delegating method: its signature and the statements of its body.
 *
 * @param name the method name
 * @param signature the declaration line, without the opening brace
 * @param body the body statements, one per line
 */
public record MethodView(String name, String signature, List<String> body) {

  public MethodView {
    body = List.copyOf(body);
  }

  // ST (StringTemplate) requires JavaBean-style getters
  public String getName() {
    return name;
  }

  public String getSignature() {
    return signature;
  }

  public List<String> getBody() {
    return body;
  }
}
