package org.javai.sqlguard.generate;

/**
 * A grammar-constrained text generator.
 * <p>
 * Implementations are external collaborators and are not trusted: the compiler validates
 * every candidate they return. Transport or protocol failures are reported as
 * {@link GenerationException}.
 */
public interface GenerationService {

	GenerationResponse generate(GenerationRequest request);

	/**
	 * Whether the service has what it needs to be called, such as credentials.
	 */
	default boolean isConfigured() {
		return true;
	}
}
