package com.hdltree.json;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Converts hdltree ASTs and declaration records to and from JSON.
 * Implementations are discovered via Java's ServiceLoader mechanism, so adding
 * hdltree-jackson (or another provider) to the classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(designFile);
 * DesignFile parsed = provider.getDeserializer().deserializeDesignFile(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        List<AstJsonProvider> providers = available();
        if (providers.isEmpty()) {
            throw new IllegalStateException(
                "No AstJsonProvider found on the classpath. " +
                "Add hdltree-jackson (or another provider) to your dependencies."
            );
        }
        return providers.get(0);
    }

    /**
     * Gets a provider by name, ignoring case.
     *
     * @throws IllegalStateException if no matching provider is found
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : available()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'.");
    }

    static boolean isProviderAvailable() {
        return !available().isEmpty();
    }

    static List<AstJsonProvider> available() {
        List<AstJsonProvider> providers = new ArrayList<>();
        ServiceLoader.load(AstJsonProvider.class).forEach(providers::add);
        return providers;
    }
}
