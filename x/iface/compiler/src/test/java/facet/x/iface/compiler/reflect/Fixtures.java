package facet.x.iface.compiler.reflect;

import facet.java.api.annotations.DispatchMode;
import facet.java.api.annotations.Downcast;
import facet.java.api.annotations.ExternalDowncast;
import facet.java.api.annotations.GraphQLArgument;
import facet.java.api.annotations.GraphQLField;
import facet.java.api.annotations.GraphQLInterface;
import facet.java.api.annotations.Ignore;
import facet.java.api.annotations.InjectContext;
import facet.java.api.types.ScalarValue;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/** Annotated interfaces used as compiler input in tests. */
public final class Fixtures {

  private Fixtures() {}

  public static final class Database {}

  @GraphQLInterface(
      description = "A character in the saga",
      implementers = {Human.class, Droid.class})
  public interface Character {
    int MAX_FRIENDS = 10;

    String id();

    @GraphQLField(name = "displayName", description = "Name shown to users")
    String name();

    @Deprecated
    Optional<String> nickname();

    List<String> friends(
        @InjectContext Database db,
        @GraphQLArgument(name = "first", description = "Page size", defaultValue = "10")
            int limit);

    @Downcast
    default Optional<Human> asHuman() {
      return Optional.empty();
    }

    @Ignore
    static String describe(Character character) {
      return character.id();
    }

    /** Exposed on the generated union as an associated type. */
    interface Visitor {
      void visit(Character character);
    }
  }

  public static class Human implements Character {
    @Override
    public String id() {
      return "1000";
    }

    @Override
    public String name() {
      return "Luke Skywalker";
    }

    @Override
    public Optional<String> nickname() {
      return Optional.of("Luke");
    }

    @Override
    public List<String> friends(Database db, int limit) {
      return List.of("Han Solo", "Leia Organa");
    }

    @Override
    public Optional<Human> asHuman() {
      return Optional.of(this);
    }
  }

  public static class Droid implements Character {
    @Override
    public String id() {
      return "2001";
    }

    @Override
    public String name() {
      return "R2-D2";
    }

    @Override
    public Optional<String> nickname() {
      return Optional.empty();
    }

    @Override
    public List<String> friends(Database db, int limit) {
      return List.of();
    }
  }

  @GraphQLInterface(
      name = "Node",
      implementers = {Human.class},
      dispatch = DispatchMode.OPEN,
      dispatchName = "AnyNode")
  public interface Node {
    String id();

    CompletableFuture<String> summary();

    default CompletionStage<Integer> rank() {
      return CompletableFuture.completedFuture(0);
    }

    @Override
    String toString();
  }

  @GraphQLInterface(scalar = "T", async = true)
  public interface Payload<T extends ScalarValue> {
    String kind();
  }

  @GraphQLInterface(implementers = {Human.class})
  @ExternalDowncast(
      implementer = Droid.class,
      function = "facet.x.iface.compiler.reflect.Fixtures::toDroid")
  public interface Broken {
    String id();
  }

  @GraphQLInterface(implementers = {Human.class})
  public interface Mutator {
    String id();

    static Mutator create() {
      return () -> "0";
    }
  }

  /** Uses member and parameter names that generated wrappers also need. */
  @GraphQLInterface(implementers = {Ticket.class})
  public interface Entry {
    String kind();

    String unwrap();

    Optional<String> value(String dispatchValue);

    String delegate(String delegate);
  }

  @GraphQLInterface(implementers = {Ticket.class}, dispatch = DispatchMode.OPEN)
  public interface Handle {
    String unwrap();

    String lookup(String delegate);
  }

  public static class Ticket implements Entry, Handle {
    @Override
    public String kind() {
      return "ticket";
    }

    @Override
    public String unwrap() {
      return "T-1";
    }

    @Override
    public Optional<String> value(String dispatchValue) {
      return Optional.of(dispatchValue);
    }

    @Override
    public String delegate(String delegate) {
      return delegate;
    }

    @Override
    public String lookup(String delegate) {
      return delegate;
    }
  }

  @GraphQLInterface
  public interface Counter {
    long total();
  }

  public interface Plain {
    String id();
  }

  public static Optional<Droid> toDroid(Broken broken) {
    return Optional.empty();
  }
}
