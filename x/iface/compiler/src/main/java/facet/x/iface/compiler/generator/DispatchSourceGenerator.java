package facet.x.iface.compiler.generator;

import facet.x.iface.compiler.model.ContractModel;
import facet.x.iface.compiler.model.DispatchArtifact;
import java.io.File;
import java.io.IOException;

/**
 * Generates the Java source of dispatch types. Each dispatch shape has a corresponding inner
 * generator class:
 *
 * <ul>
 *   <li>{@link OpenDispatchGenerator} - a final handle class wrapping any implementation
 *   <li>{@link ClosedDispatchGenerator} - a tagged union with one variant per implementer
 * </ul>
 */
public final class DispatchSourceGenerator {

  private DispatchSourceGenerator() {
    // Static utility class
  }

  /**
   * Generates the source of the artifact chosen for a contract.
   *
   * @param model the compiled contract
   * @param artifact its dispatch representation
   * @param packageName the package of the generated type
   * @return the generated Java source code
   */
  public static String generate(
      ContractModel model, DispatchArtifact artifact, String packageName) {
    if (artifact instanceof DispatchArtifact.OpenDispatch open) {
      return OpenDispatchGenerator.generate(new OpenDispatchView(model, open, packageName));
    }
    return ClosedDispatchGenerator.generate(
        new ClosedDispatchView(model, (DispatchArtifact.ClosedDispatch) artifact, packageName));
  }

  /**
   * Generates the source of the artifact chosen for a contract and writes it below {@code
   * outputDir}.
   *
   * @return the file that was written
   * @throws IOException if there's an error writing the file
   */
  public static File generateToFile(
      ContractModel model, DispatchArtifact artifact, String packageName, File outputDir)
      throws IOException {
    if (artifact instanceof DispatchArtifact.OpenDispatch open) {
      return OpenDispatchGenerator.generateToFile(
          new OpenDispatchView(model, open, packageName), outputDir);
    }
    return ClosedDispatchGenerator.generateToFile(
        new ClosedDispatchView(model, (DispatchArtifact.ClosedDispatch) artifact, packageName),
        outputDir);
  }

  /**
   * Writes generated content to a file in the appropriate package directory.
   *
   * @param content the STContents to write
   * @param packageName the Java package name
   * @param className the class name
   * @param outputDir the base output directory
   * @return the file that was written
   * @throws IOException if there's an error writing the file
   */
  private static File writeToFile(
      STContents content, String packageName, String className, File outputDir) throws IOException {
    File packageDir =
        packageName.isEmpty()
            ? outputDir
            : new File(outputDir, packageName.replace('.', File.separatorChar));
    if (!packageDir.exists() && !packageDir.mkdirs()) {
      throw new IOException("Failed to create directory: " + packageDir);
    }

    File outputFile = new File(packageDir, className + ".java");
    content.write(outputFile);
    return outputFile;
  }

  /** Generator for open dispatch handles. */
  public static final class OpenDispatchGenerator {

    private static final String TEMPLATE =
        """
        <if(mdl.hasPackage)>package <mdl.packageName>;

        <endif>import facet.java.api.types.GraphQLInterfaceValue;
        import facet.java.api.types.ScalarValue;
        import facet.java.api.types.Shareable;
        import java.util.Objects;
        import java.util.concurrent.CompletableFuture;

        /**
         * Open dispatch handle for the GraphQL interface {@code <mdl.graphqlName>}. Wraps any
         * implementation of {@link <mdl.contractIdentifier>}.
        <if(mdl.hasDescription)>
         *
         * <mdl.description>
        <endif>
        <if(mdl.hasDefaultScalarType)>
         *
         * Use {@code <mdl.defaultScalarType>} as the scalar type unless a custom one is needed.
        <endif>
         */
        <mdl.classModifier>final class <mdl.className><mdl.typeParameters>
                implements <mdl.interfacesClause> {

            private final <mdl.delegateType> delegate;

            public <mdl.className>(<mdl.delegateType> delegate) {
                this.delegate = Objects.requireNonNull(delegate, "delegate");
            }

            /** The wrapped implementation. */
            public <mdl.delegateType> dispatchValue() {
                return delegate;
            }

            <mdl.methods: {m |
        <m.signature> {
            <m.body; separator="\\n">
        \\}
        }; separator="\\n">

            @Override
            public String concreteTypeName() {
                <mdl.concreteTypeNameBody; separator="\\n">
            }
        <if(mdl.hasContext)>

            public String concreteTypeName(<mdl.contextType> context) {
                <mdl.contextualConcreteTypeNameBody; separator="\\n">
            }
        <endif>
        }
        """;

    private OpenDispatchGenerator() {}

    /**
     * Generates the handle source code as a string.
     *
     * @param view the open dispatch view
     * @return the generated Java source code
     */
    public static String generate(OpenDispatchView view) {
      return new STContents(TEMPLATE, view).toString();
    }

    /**
     * Generates the handle source code and writes it to a file.
     *
     * @param view the open dispatch view
     * @param outputDir the output directory
     * @return the file that was written
     * @throws IOException if there's an error writing the file
     */
    public static File generateToFile(OpenDispatchView view, File outputDir) throws IOException {
      STContents contents = new STContents(TEMPLATE, view);
      return writeToFile(contents, view.getPackageName(), view.getClassName(), outputDir);
    }
  }

  /** Generator for closed tagged unions. */
  public static final class ClosedDispatchGenerator {

    private static final String TEMPLATE =
        """
        <if(mdl.hasPackage)>package <mdl.packageName>;

        <endif>import facet.java.api.types.GraphQLInterfaceValue;
        import facet.java.api.types.ScalarValue;
        import facet.java.api.types.Shareable;
        import java.util.Objects;
        import java.util.concurrent.CompletableFuture;

        /**
         * Closed dispatch over the implementers of the GraphQL interface {@code <mdl.graphqlName>},
         * declared by {@link <mdl.contractIdentifier>}.
        <if(mdl.hasDescription)>
         *
         * <mdl.description>
        <endif>
        <if(mdl.hasAssociatedTypes)>
         *
         * Associated types: <mdl.associatedTypes; separator=", ">.
        <endif>
        <if(mdl.hasDefaultScalarType)>
         *
         * Use {@code <mdl.defaultScalarType>} as the scalar type unless a custom one is needed.
        <endif>
         */
        <mdl.classModifier>final class <mdl.className><mdl.typeParameters>
                implements <mdl.interfacesClause> {

            /** Variant tags, one per implementer. */
            public enum Kind {
                <mdl.tags>
            }
        <if(mdl.hasConstants)>

            <mdl.constants; separator="\\n">
        <endif>

            private final Kind dispatchKind;
            private final Object dispatchValue;

            private <mdl.className>(Kind kind, Object value) {
                this.dispatchKind = Objects.requireNonNull(kind, "kind");
                this.dispatchValue = Objects.requireNonNull(value, "value");
            }

            <mdl.variants: {v |
        public static <mdl.genericPrefix><mdl.className><mdl.typeArguments> <v.factoryName>(
                <v.javaType> value) {
            return new <mdl.className><mdl.diamond>(Kind.<v.tag>, value);
        \\}
        }; separator="\\n">

            /** The variant held by this value. */
            public Kind dispatchKind() {
                return dispatchKind;
            }

            /** The implementation held by this value, an instance of the variant's type. */
            public Object dispatchValue() {
                return dispatchValue;
            }

            <mdl.methods: {m |
        <m.signature> {
            <m.body; separator="\\n">
        \\}
        }; separator="\\n">

            @Override
            public String concreteTypeName() {
                <mdl.concreteTypeNameBody; separator="\\n">
            }
        }
        """;

    private ClosedDispatchGenerator() {}

    /**
     * Generates the union source code as a string.
     *
     * @param view the closed dispatch view
     * @return the generated Java source code
     */
    public static String generate(ClosedDispatchView view) {
      return new STContents(TEMPLATE, view).toString();
    }

    /**
     * Generates the union source code and writes it to a file.
     *
     * @param view the closed dispatch view
     * @param outputDir the output directory
     * @return the file that was written
     * @throws IOException if there's an error writing the file
     */
    public static File generateToFile(ClosedDispatchView view, File outputDir) throws IOException {
      STContents contents = new STContents(TEMPLATE, view);
      return writeToFile(contents, view.getPackageName(), view.getClassName(), outputDir);
    }
  }
}
