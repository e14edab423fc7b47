package io.hearthwarrio.veilguard.core.intercept;

/**
 * Execution context whose {@link DocumentCapabilities} can be replaced.
 */
public interface CapabilityHost {

    /**
     * @return false for nested frames
     */
    boolean isTopLevelContext();

    DocumentCapabilities getCapabilities();

    void setCapabilities(DocumentCapabilities capabilities);

    /**
     * @return token living as long as this context
     */
    InitializationToken initializationToken();
}
