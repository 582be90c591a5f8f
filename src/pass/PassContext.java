package pass;

import ast.ASTBuilder;
import ast.ASTUnit;
import ast.Provenance;
import debuginfo.DebugInfoMap;
import driver.Config;

/**
 * Everything a pass may touch during one pipeline run.
 */
public final class PassContext {
    private final ASTUnit unit;
    private final ASTBuilder builder;
    private final Provenance provenance;
    private final DebugInfoMap debugInfo;
    private final StopSignal stopSignal;
    private final int solverTimeoutMs;

    public PassContext(ASTUnit unit, Provenance provenance, DebugInfoMap debugInfo,
            StopSignal stopSignal, int solverTimeoutMs) {
        this.unit = unit;
        this.builder = new ASTBuilder(unit);
        this.provenance = provenance;
        this.debugInfo = debugInfo;
        this.stopSignal = stopSignal;
        this.solverTimeoutMs = solverTimeoutMs;
    }

    public PassContext(ASTUnit unit, Provenance provenance, DebugInfoMap debugInfo) {
        this(unit, provenance, debugInfo, new StopSignal(), Config.getInstance().solverTimeoutMs);
    }

    public PassContext(ASTUnit unit) {
        this(unit, Provenance.empty(), DebugInfoMap.empty());
    }

    public ASTUnit getUnit() {
        return unit;
    }

    public ASTBuilder getBuilder() {
        return builder;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public DebugInfoMap getDebugInfo() {
        return debugInfo;
    }

    public StopSignal getStopSignal() {
        return stopSignal;
    }

    public int getSolverTimeoutMs() {
        return solverTimeoutMs;
    }
}
