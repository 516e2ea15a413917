/**
 * The interface declaration compiler.
 *
 * <p>{@link facet.x.iface.compiler.ContractCompiler} runs the stages ({@link
 * facet.x.iface.compiler.MethodClassifier}, {@link facet.x.iface.compiler.ArgumentRoleResolver},
 * {@link facet.x.iface.compiler.ImplementerResolver}, {@link
 * facet.x.iface.compiler.ScalarParameterResolver}, {@link
 * facet.x.iface.compiler.DispatchSelector}, {@link facet.x.iface.compiler.AsyncAdaptationMarker})
 * over one declaration; {@link facet.x.iface.compiler.InterfaceCodegen} drives it from annotated
 * Java interfaces to generated dispatch sources.
 */
@NullMarked
package facet.x.iface.compiler;

import org.jspecify.annotations.NullMarked;
