package com.resyntax.json;

import java.util.Iterator;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Provider interface for regexp AST JSON serialization/deserialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., resyntax-jackson)
 * to your classpath. The provider will be automatically discovered. When
 * several are present, the system property {@value #PROVIDER_PROPERTY}
 * selects one by name.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(regexp);
 * Regexp parsed = provider.getDeserializer().deserializeRegexp(json);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * System property naming the provider {@link #getProvider()} returns.
     */
    String PROVIDER_PROPERTY = "resyntax.json.provider";

    /**
     * Returns the serializer for converting regexp trees to JSON.
     *
     * @return the AST JSON serializer
     */
    AstJsonSerializer getSerializer();

    /**
     * Returns the deserializer for converting JSON to regexp trees.
     *
     * @return the AST JSON deserializer
     */
    AstJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    /**
     * Gets the provider named by {@value #PROVIDER_PROPERTY}, or the first
     * available AstJsonProvider when the property is unset.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static AstJsonProvider getProvider() {
        String configured = System.getProperty(PROVIDER_PROPERTY);
        if (configured != null && !configured.isBlank()) {
            Logger.getLogger(AstJsonProvider.class.getName())
                .config(() -> PROVIDER_PROPERTY + " selects provider '" + configured.trim() + "'");
            return getProvider(configured.trim());
        }
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            AstJsonProvider provider = iterator.next();
            Logger.getLogger(AstJsonProvider.class.getName())
                .fine(() -> "Using AstJsonProvider " + provider.getName());
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add resyntax-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets an AstJsonProvider by name via ServiceLoader.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    /**
     * Checks if any provider is available on the classpath.
     *
     * @return true if at least one provider is available
     */
    static boolean isProviderAvailable() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
