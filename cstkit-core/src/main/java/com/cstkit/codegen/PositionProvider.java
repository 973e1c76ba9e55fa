package com.cstkit.codegen;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Identity under which a {@link CodegenState} records node ranges.
 *
 * <p>Providers compare by identity. Each one knows how to create the state
 * that records under it, so consumers pick a provider for the precision they
 * need and let it build the matching state:</p>
 * <pre>{@code
 * CodegenState state = PositionProvider.SYNTACTIC.createState("    ", "\n");
 * module.render(state);
 * CodeRange range = name.position(PositionProvider.SYNTACTIC).orElseThrow();
 * }</pre>
 */
public final class PositionProvider {

    /** A few coarse ranges per statement, first recording wins. */
    public static final PositionProvider BASIC =
        new PositionProvider("BasicPositionProvider", CodegenState::new);

    /** An exact range for every rendered node. */
    public static final PositionProvider SYNTACTIC =
        new PositionProvider("SyntacticPositionProvider", SyntacticCodegenState::new);

    private final String name;
    private final BiFunction<String, String, ? extends CodegenState> stateFactory;

    public PositionProvider(String name, BiFunction<String, String, ? extends CodegenState> stateFactory) {
        this.name = Objects.requireNonNull(name, "name");
        this.stateFactory = Objects.requireNonNull(stateFactory, "stateFactory");
    }

    public String name() {
        return name;
    }

    /**
     * Creates a fresh state for one render pass that records under this provider.
     */
    public CodegenState createState(String defaultIndent, String defaultNewline) {
        CodegenState state = stateFactory.apply(defaultIndent, defaultNewline);
        if (state.provider() != this) {
            throw new CstUsageException(
                "State factory for " + name + " produced a state recording under " + state.provider().name());
        }
        return state;
    }

    @Override
    public String toString() {
        return name;
    }
}
