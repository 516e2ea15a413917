package facet.x.iface.compiler.directive;

import facet.x.iface.compiler.declaration.ContractDeclaration;
import facet.x.iface.compiler.declaration.MethodDeclaration;
import facet.x.iface.compiler.declaration.ParameterDeclaration;

/**
 * Turns the raw directives of a declaration element into a structured options record. The
 * compiler treats implementations as a black box: it only sees options or a parse failure.
 */
public interface DirectiveExtractor {

  ContractOptions contractOptions(ContractDeclaration declaration) throws DirectiveParseException;

  MethodOptions methodOptions(MethodDeclaration method) throws DirectiveParseException;

  ArgumentOptions argumentOptions(ParameterDeclaration parameter) throws DirectiveParseException;
}
