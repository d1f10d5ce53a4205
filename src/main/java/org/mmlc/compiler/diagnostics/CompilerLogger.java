package org.mmlc.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Progress output of the compiler, filtered by the configured verbosity before it reaches
 * SLF4J (where the Logback levels apply as usual).
 * <ul>
 *   <li>{@link #ERROR}: failed modules only.</li>
 *   <li>{@link #WARN}: also pipelines halted by a gating stage.</li>
 *   <li>{@link #INFO}: also one line per module.</li>
 *   <li>{@link #DEBUG}: also one line per semantic stage with its timing.</li>
 *   <li>{@link #TRACE}: also every diagnostic of a failed module.</li>
 * </ul>
 */
public final class CompilerLogger {

    public static final int ERROR = 0;
    public static final int WARN = 1;
    public static final int INFO = 2;
    public static final int DEBUG = 3;
    public static final int TRACE = 4;

    private static final Logger LOG = LoggerFactory.getLogger(CompilerLogger.class);

    private static volatile int level = INFO;

    private CompilerLogger() {}

    /**
     * @param newLevel The verbosity, clamped to {@link #ERROR}..{@link #TRACE}.
     */
    public static void setLevel(int newLevel) {
        level = Math.max(ERROR, Math.min(TRACE, newLevel));
    }

    public static int getLevel() {
        return level;
    }

    public static void moduleStarted(String module, int members) {
        if (level >= INFO) {
            LOG.info("Compiling module '{}' ({} member(s))", module, members);
        }
    }

    public static void stageFinished(String module, String stage, long elapsedMicros, int newErrors) {
        if (level >= DEBUG) {
            LOG.debug("{} on '{}' took {} us, {} new error(s)", stage, module, elapsedMicros, newErrors);
        }
    }

    public static void pipelineHalted(String module, String stage) {
        if (level >= WARN) {
            LOG.warn("Semantic analysis of '{}' halted by {}", module, stage);
        }
    }

    /**
     * Reports a module rejected with diagnostics; at {@link #TRACE} each diagnostic is
     * logged on its own line.
     */
    public static void moduleFailed(String module, List<SemanticError> diagnostics) {
        LOG.info("Module '{}' failed with {} error(s)", module, diagnostics.size());
        if (level >= TRACE) {
            for (SemanticError error : diagnostics) {
                LOG.trace("  {}: {} [{}]", error.span(), error.message(), error.phase());
            }
        }
    }

    public static void moduleCompiled(String module, int structLayouts, String target) {
        if (level >= INFO) {
            LOG.info("Module '{}' resolved: {} struct layout(s), target {}", module, structLayouts, target);
        }
    }
}
