/**
 * Output model of the interface compiler: the {@link facet.x.iface.compiler.model.ContractModel}
 * consumed by the schema builder and the {@link facet.x.iface.compiler.model.DispatchArtifact}
 * consumed by the source generator.
 */
@NullMarked
package facet.x.iface.compiler.model;

import org.jspecify.annotations.NullMarked;
