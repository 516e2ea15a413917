package facet.x.iface.compiler.declaration;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A method declared on a contract.
 *
 * @param identifier the method name as written
 * @param receiver the receiver shape
 * @param parameters the non-receiver parameters, in order
 * @param result the declared result type, or null for a method returning nothing
 * @param async whether the method suspends
 * @param defaultBody whether the contract itself supplies a body
 * @param directives raw directives on the method
 * @param span where the method is declared
 */
public record MethodDeclaration(
    String identifier,
    Receiver receiver,
    List<ParameterDeclaration> parameters,
    @Nullable TypeRef result,
    boolean async,
    boolean defaultBody,
    List<Directive> directives,
    SourceSpan span) {

  public MethodDeclaration {
    parameters = List.copyOf(parameters);
    directives = List.copyOf(directives);
  }

  /** The same method with every directive removed from it and from its parameters. */
  public MethodDeclaration withoutDirectives() {
    return new MethodDeclaration(
        identifier,
        receiver,
        parameters.stream().map(ParameterDeclaration::withoutDirectives).toList(),
        result,
        async,
        defaultBody,
        List.of(),
        span);
  }

  public static Builder builder(String identifier) {
    return new Builder(identifier);
  }

  /** Builder for hand-written declarations, mostly used by readers and tests. */
  public static final class Builder {
    private final String identifier;
    private Receiver receiver = Receiver.SHARED_REFERENCE;
    private final List<ParameterDeclaration> parameters = new ArrayList<>();
    private @Nullable TypeRef result;
    private boolean async;
    private boolean defaultBody;
    private final List<Directive> directives = new ArrayList<>();
    private SourceSpan span = SourceSpan.unknown();

    private Builder(String identifier) {
      this.identifier = identifier;
    }

    public Builder receiver(Receiver receiver) {
      this.receiver = receiver;
      return this;
    }

    public Builder parameter(ParameterDeclaration parameter) {
      this.parameters.add(parameter);
      return this;
    }

    public Builder result(@Nullable TypeRef result) {
      this.result = result;
      return this;
    }

    public Builder async(boolean async) {
      this.async = async;
      return this;
    }

    public Builder defaultBody(boolean defaultBody) {
      this.defaultBody = defaultBody;
      return this;
    }

    public Builder directive(Directive directive) {
      this.directives.add(directive);
      return this;
    }

    public Builder span(SourceSpan span) {
      this.span = span;
      return this;
    }

    public MethodDeclaration build() {
      return new MethodDeclaration(
          identifier, receiver, parameters, result, async, defaultBody, directives, span);
    }
  }
}
