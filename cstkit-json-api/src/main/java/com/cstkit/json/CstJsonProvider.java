package com.cstkit.json;

import com.cstkit.codegen.PositionProvider;
import com.cstkit.nodes.Module;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * A JSON binding for syntax trees, registered under
 * {@code META-INF/services/com.cstkit.json.CstJsonProvider}.
 *
 * <pre>{@code
 * String json = CstJsonProvider.getProvider()
 *     .serializeResolved(module, PositionProvider.BASIC, PositionProvider.SYNTACTIC);
 * }</pre>
 */
public interface CstJsonProvider {

    CstJsonSerializer getSerializer();

    CstJsonDeserializer getDeserializer();

    /** Lookup key for {@link #getProvider(String)}, e.g. "Jackson". */
    String getName();

    /**
     * Renders {@code module} once per provider, so each node carries a range
     * for every one of them, then serializes it.
     *
     * @throws CstJsonException if the tree cannot be written
     */
    default String serializeResolved(Module module, PositionProvider... providers) throws CstJsonException {
        for (PositionProvider provider : providers) {
            module.resolvePositions(provider);
        }
        return getSerializer().serialize(module);
    }

    /**
     * @throws CstJsonException if no binding is registered
     */
    static CstJsonProvider getProvider() {
        List<CstJsonProvider> providers = loadAll();
        if (providers.isEmpty()) {
            throw new CstJsonException("No JSON binding registered; add cstkit-jackson to the classpath");
        }
        return providers.get(0);
    }

    /**
     * @param name binding name, case-insensitive
     * @throws CstJsonException if no registered binding has that name
     */
    static CstJsonProvider getProvider(String name) {
        List<CstJsonProvider> providers = loadAll();
        for (CstJsonProvider provider : providers) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        String available = providers.stream().map(CstJsonProvider::getName).collect(Collectors.joining(", "));
        throw new CstJsonException("No JSON binding named '" + name + "'; registered: ["
            + available + "]");
    }

    static boolean isProviderAvailable() {
        return !loadAll().isEmpty();
    }

    private static List<CstJsonProvider> loadAll() {
        List<CstJsonProvider> providers = new ArrayList<>();
        ServiceLoader.load(CstJsonProvider.class).forEach(providers::add);
        return providers;
    }
}
