package org.mmlc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.Associativity;
import org.mmlc.compiler.frontend.ast.OperatorDef;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable compiler settings read from the {@code mmlc.compiler} block of the HOCON
 * configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * mmlc.compiler {
 *   target-abi = "x86_64"
 *   verbosity = 2
 *   parallelism = 4
 *   strict-struct-layout = false
 *   operators = [
 *     { name = "+", precedence = 60, assoc = "left", arity = 2, signature = "Int -> Int -> Int" }
 *   ]
 * }
 * </pre>
 *
 * @param targetAbi          Architecture hint used to select the ABI strategy.
 * @param verbosity          {@code CompilerLogger} level.
 * @param parallelism        Worker threads used when compiling several modules.
 * @param strictStructLayout Whether lowering an aggregate with no known layout is an error.
 * @param builtinOperators   The built-in operator table.
 */
public record CompilerConfig(String targetAbi, int verbosity, int parallelism, boolean strictStructLayout,
                             List<OperatorDef> builtinOperators) {

    /** Path of the compiler block inside the configuration. */
    public static final String CONFIG_PATH = "mmlc.compiler";

    public CompilerConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        builtinOperators = List.copyOf(builtinOperators);
    }

    /**
     * Loads the configuration with the usual precedence: system properties, then
     * environment, then {@code application.conf}, then {@code reference.conf}.
     * @return The resolved settings.
     */
    public static CompilerConfig load() {
        return fromConfig(loadConfig());
    }

    /**
     * @return The resolved root configuration, layered as described for {@link #load()}.
     */
    public static Config loadConfig() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    /**
     * @return The settings of {@code reference.conf} alone.
     */
    public static CompilerConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the {@code mmlc.compiler} block. Missing keys fall back to {@code reference.conf}.
     * @param config The root configuration.
     * @return The settings.
     * @throws ConfigException if a value has the wrong type or an operator entry is malformed.
     */
    public static CompilerConfig fromConfig(Config config) {
        Config compiler = config.withFallback(ConfigFactory.defaultReference()).resolve().getConfig(CONFIG_PATH);
        List<OperatorDef> operators = new ArrayList<>();
        for (Config op : compiler.getConfigList("operators")) {
            operators.add(readOperator(op));
        }
        return new CompilerConfig(
                compiler.getString("target-abi"),
                compiler.getInt("verbosity"),
                compiler.getInt("parallelism"),
                compiler.getBoolean("strict-struct-layout"),
                operators);
    }

    /**
     * @param hint The new architecture hint.
     * @return A copy targeting the given architecture.
     */
    public CompilerConfig withTargetAbi(String hint) {
        return new CompilerConfig(hint, verbosity, parallelism, strictStructLayout, builtinOperators);
    }

    /**
     * @param operators The replacement built-in operators.
     * @return A copy with the given operator table.
     */
    public CompilerConfig withBuiltinOperators(List<OperatorDef> operators) {
        return new CompilerConfig(targetAbi, verbosity, parallelism, strictStructLayout, operators);
    }

    private static OperatorDef readOperator(Config op) {
        String name = op.getString("name");
        String assoc = op.getString("assoc");
        Associativity associativity;
        try {
            associativity = Associativity.valueOf(assoc.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(op.origin(), "assoc",
                    "Operator '" + name + "' has unknown associativity '" + assoc + "'", e);
        }
        int arity = op.getInt("arity");
        if (arity != 1 && arity != 2) {
            throw new ConfigException.BadValue(op.origin(), "arity",
                    "Operator '" + name + "' must have arity 1 or 2, was " + arity);
        }
        TypeSpec signature = parseSignature(op.getString("signature"));
        if (!(signature instanceof TypeSpec.TypeFn fn) || fn.params().size() != arity) {
            throw new ConfigException.BadValue(op.origin(), "signature",
                    "Operator '" + name + "' signature must take exactly " + arity + " operand(s)");
        }
        return new OperatorDef(name, op.getInt("precedence"), associativity, arity, signature,
                OperatorDef.Origin.BUILTIN, SourceSpan.SYNTHETIC);
    }

    /**
     * Parses a signature of the form {@code Int -> Int -> Bool} into a curried function type.
     * A single name yields a plain type reference.
     * @param text The signature.
     * @return The type.
     */
    static TypeSpec parseSignature(String text) {
        List<TypeSpec> parts = Arrays.stream(text.split("->"))
                .map(String::trim)
                .<TypeSpec>map(TypeSpec.TypeRef::new)
                .toList();
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new TypeSpec.TypeFn(parts.subList(0, parts.size() - 1), parts.get(parts.size() - 1));
    }
}
