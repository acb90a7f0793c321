package org.pcc.compiler.backend.emit;

import org.pcc.compiler.api.OutputFormat;
import org.pcc.compiler.config.CompilerOptions;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the emitter responsible for each output format.
 */
public final class EmitterRegistry {

    private final Map<OutputFormat, IFormatEmitter> emitters = new EnumMap<>(OutputFormat.class);

    /**
     * Registers an emitter, replacing any previous one for the format.
     * @param format The output format.
     * @param emitter The emitter.
     */
    public void register(OutputFormat format, IFormatEmitter emitter) {
        emitters.put(format, emitter);
    }

    /**
     * @param format The output format.
     * @return The emitter for the format, if registered.
     */
    public Optional<IFormatEmitter> get(OutputFormat format) {
        return Optional.ofNullable(emitters.get(format));
    }

    /**
     * Initializes a new registry with the JSON, TEXT and MARKDOWN emitters.
     * @param options Supplies the JSON escaping mode and the nesting limit.
     * @return A new registry with default emitters.
     */
    public static EmitterRegistry initializeWithDefaults(CompilerOptions options) {
        EmitterRegistry reg = new EmitterRegistry();
        reg.register(OutputFormat.JSON, new JsonEmitter(options.jsonEscaping(), options.maxNestingDepth()));
        reg.register(OutputFormat.TEXT, new TextEmitter(options.maxNestingDepth()));
        reg.register(OutputFormat.MARKDOWN, new MarkdownEmitter(options.maxNestingDepth()));
        return reg;
    }
}
