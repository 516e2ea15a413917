package facet.x.iface.compiler;

import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.generator.DispatchSourceGenerator;
import facet.x.iface.compiler.model.DispatchArtifact;
import facet.x.iface.compiler.reflect.AnnotatedInterfaceReader;
import facet.x.iface.compiler.schema.InterfaceContribution;
import facet.x.iface.compiler.schema.InterfaceTypeBuilder;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for interface code generation. Reads annotated Java interfaces, compiles each
 * one and writes its dispatch type. Can be called from a build plugin or programmatically.
 */
public class InterfaceCodegen {

  private static final Logger log = LoggerFactory.getLogger(InterfaceCodegen.class);

  private final AnnotatedInterfaceReader reader;
  private final ContractCompiler compiler;
  private final InterfaceTypeBuilder typeBuilder;

  public InterfaceCodegen() {
    this(new AnnotatedInterfaceReader(), new ContractCompiler(), new InterfaceTypeBuilder());
  }

  public InterfaceCodegen(
      AnnotatedInterfaceReader reader,
      ContractCompiler compiler,
      InterfaceTypeBuilder typeBuilder) {
    this.reader = reader;
    this.compiler = compiler;
    this.typeBuilder = typeBuilder;
  }

  /**
   * Result of the code generation process.
   *
   * @param openCount number of open dispatch handles generated
   * @param closedCount number of closed unions generated
   * @param generatedFiles the written source files
   * @param contributions the schema contribution of each contract, in input order
   */
  public record Result(
      int openCount,
      int closedCount,
      List<File> generatedFiles,
      List<InterfaceContribution> contributions) {
    public int totalCount() {
      return openCount + closedCount;
    }
  }

  /**
   * Generates dispatch types for annotated interfaces.
   *
   * @param contracts the interfaces, each annotated with {@code @GraphQLInterface}
   * @param outputDir output directory for generated Java files
   * @param packageName Java package name for generated types
   * @return result containing counts of generated types
   * @throws ContractCompilationException if a contract does not compile
   * @throws IllegalArgumentException if a contract is not an annotated interface, or one of its
   *     types has no GraphQL counterpart
   * @throws IOException if there's an error writing files
   */
  public Result generate(List<Class<?>> contracts, File outputDir, String packageName)
      throws IOException {
    // Ensure output directory exists
    if (!outputDir.exists() && !outputDir.mkdirs()) {
      throw new IOException("Failed to create output directory: " + outputDir);
    }

    // Compile everything before writing, so a bad contract leaves no partial output
    List<CompilationResult.Success> compiled = new ArrayList<>();
    List<InterfaceContribution> contributions = new ArrayList<>();
    for (Class<?> contract : contracts) {
      ContractDeclaration declaration = reader.read(contract);
      CompilationResult result = compiler.compile(declaration);
      if (result instanceof CompilationResult.Failure failure) {
        throw new ContractCompilationException(
            declaration.qualifiedIdentifier(), failure.diagnostics());
      }
      CompilationResult.Success success = (CompilationResult.Success) result;
      compiled.add(success);
      contributions.add(typeBuilder.build(success.model()));
    }

    List<File> generatedFiles = new ArrayList<>();
    int openCount = 0;
    int closedCount = 0;
    for (CompilationResult.Success success : compiled) {
      File file =
          DispatchSourceGenerator.generateToFile(
              success.model(), success.artifact(), packageName, outputDir);
      log.info("Generated {} for interface {}", file, success.model().name());
      generatedFiles.add(file);
      if (success.artifact() instanceof DispatchArtifact.OpenDispatch) {
        openCount++;
      } else {
        closedCount++;
      }
    }

    return new Result(openCount, closedCount, generatedFiles, contributions);
  }
}
