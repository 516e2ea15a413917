/**
 * Annotations for declaring GraphQL interface contracts on Java interfaces.
 *
 * <ul>
 *   <li>{@link facet.java.api.annotations.GraphQLInterface} - marks the contract and lists its
 *       implementers
 *   <li>{@link facet.java.api.annotations.ExternalDowncast} - binds a static downcast function
 *   <li>{@link facet.java.api.annotations.GraphQLField}, {@link
 *       facet.java.api.annotations.Ignore} and {@link facet.java.api.annotations.Downcast} - shape
 *       how methods are compiled
 *   <li>{@link facet.java.api.annotations.GraphQLArgument}, {@link
 *       facet.java.api.annotations.InjectContext} and {@link
 *       facet.java.api.annotations.InjectExecutor} - shape how parameters are compiled
 * </ul>
 */
package facet.java.api.annotations;
